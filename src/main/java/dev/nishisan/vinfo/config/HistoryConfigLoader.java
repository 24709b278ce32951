/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.vinfo.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import dev.nishisan.vinfo.probe.ProcessControlBackend;
import dev.nishisan.vinfo.render.RenderMode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class HistoryConfigLoader {

    public static final String DEFAULT_RESOURCE = "validator-info-history.yaml";

    private static final Pattern VARIABLE = Pattern.compile("\\$\\{([^}]+)\\}");
    private static final ObjectMapper mapper;

    static {
        YAMLFactory yamlFactory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
        mapper = new ObjectMapper(yamlFactory);
    }

    public static HistoryYamlConfig load(Path yamlFile) throws IOException {
        return load(yamlFile, System::getenv);
    }

    public static HistoryYamlConfig load(Path yamlFile, Function<String, String> envProvider) throws IOException {
        return parse(Files.readString(yamlFile), envProvider);
    }

    /**
     * Loads the bundled default configuration, resolving variables such as
     * {@code VINFO_PROCESS_BACKEND} from the environment.
     */
    public static HistoryYamlConfig loadDefault(Function<String, String> envProvider) throws IOException {
        try (InputStream in = HistoryConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Resource " + DEFAULT_RESOURCE + " not found on classpath");
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), envProvider);
        }
    }

    private static HistoryYamlConfig parse(String content, Function<String, String> envProvider) throws IOException {
        return mapper.readValue(resolveVariables(content, envProvider), HistoryYamlConfig.class);
    }

    private static String resolveVariables(String content, Function<String, String> envProvider) {
        // ${VAR} and ${VAR:default}
        Matcher matcher = VARIABLE.matcher(content);
        StringBuilder builder = new StringBuilder();
        int i = 0;
        while (matcher.find()) {
            builder.append(content, i, matcher.start());
            builder.append(getReplacement(matcher.group(1), envProvider));
            i = matcher.end();
        }
        builder.append(content.substring(i));
        return builder.toString();
    }

    private static String getReplacement(String group, Function<String, String> envProvider) {
        String[] parts = group.split(":", 2);
        String varName = parts[0];
        String defaultValue = parts.length > 1 ? parts[1] : null;

        String value = envProvider.apply(varName);
        if (value != null) {
            return value;
        }
        if (defaultValue != null) {
            return defaultValue;
        }
        throw new IllegalArgumentException(
                "Environment variable or property '" + varName + "' not found and no default value provided.");
    }

    public static void save(Path yamlFile, HistoryYamlConfig config) throws IOException {
        mapper.writeValue(yamlFile.toFile(), config);
    }

    public static HistoryConfig convertToDomain(HistoryYamlConfig yamlConfig) {
        StorageConfig storage = yamlConfig.getStorage();
        if (storage == null || storage.getDir() == null || storage.getDir().isBlank()) {
            throw new IllegalArgumentException("Storage directory is missing");
        }
        HistoryConfig.Builder builder = HistoryConfig.builder(Path.of(storage.getDir()));
        if (storage.getSuffix() != null) {
            builder.storeSuffix(storage.getSuffix());
        }

        ProcessConfig process = yamlConfig.getProcess();
        if (process != null) {
            if (process.getBackend() != null) {
                builder.processBackend(ProcessControlBackend.fromString(process.getBackend()));
            }
            if (process.getService() != null && !process.getService().isBlank()) {
                builder.serviceName(process.getService().trim());
            }
            Duration timeout = parseDuration(process.getTimeout());
            if (timeout != null) {
                builder.probeTimeout(timeout);
            }
        }

        ReportConfig report = yamlConfig.getReport();
        if (report != null) {
            if (report.getZone() != null && !report.getZone().isBlank()) {
                builder.zone(ZoneId.of(report.getZone().trim()));
            }
            builder.mode(RenderMode.fromString(report.getMode()));
            builder.verbose(report.isVerbose());
            builder.count(report.getCount());
        }

        SoftwareConfig software = yamlConfig.getSoftware();
        if (software != null && software.getPackages() != null) {
            builder.packages(software.getPackages());
        }
        return builder.build();
    }

    private static Duration parseDuration(String s) {
        if (s == null || s.isBlank())
            return null;
        s = s.trim().toUpperCase();
        try {
            return Duration.parse(s); // Try standard ISO-8601 first (PT10M)
        } catch (java.time.format.DateTimeParseException e) {
            // Fallback for simple "10m", "2h", "30s", "500ms"
            if (s.endsWith("MS")) {
                return Duration.ofMillis(Long.parseLong(s.substring(0, s.length() - 2)));
            } else if (s.endsWith("H")) {
                return Duration.ofHours(Long.parseLong(s.substring(0, s.length() - 1)));
            } else if (s.endsWith("M")) {
                return Duration.ofMinutes(Long.parseLong(s.substring(0, s.length() - 1)));
            } else if (s.endsWith("S")) {
                return Duration.ofSeconds(Long.parseLong(s.substring(0, s.length() - 1)));
            }
            throw e;
        }
    }
}
