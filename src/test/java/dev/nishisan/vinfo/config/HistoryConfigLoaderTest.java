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

import dev.nishisan.vinfo.probe.ProcessControlBackend;
import dev.nishisan.vinfo.render.RenderMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HistoryConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldSaveLoadAndConvertToDomain() throws IOException {
        Path yamlFile = tempDir.resolve("history.yaml");

        HistoryYamlConfig yamlConfig = new HistoryYamlConfig();
        StorageConfig storage = new StorageConfig();
        storage.setDir("/data/indy");
        storage.setSuffix("_stats_db");
        yamlConfig.setStorage(storage);

        ProcessConfig process = new ProcessConfig();
        process.setBackend("supervisor");
        process.setService("validator");
        process.setTimeout("1500ms");
        yamlConfig.setProcess(process);

        ReportConfig report = new ReportConfig();
        report.setZone("America/Sao_Paulo");
        report.setMode("json");
        report.setVerbose(true);
        report.setCount(5);
        yamlConfig.setReport(report);

        SoftwareConfig software = new SoftwareConfig();
        software.setPackages(List.of("indy-node", "indy-plenum", "sovrin"));
        yamlConfig.setSoftware(software);

        HistoryConfigLoader.save(yamlFile, yamlConfig);
        HistoryYamlConfig loaded = HistoryConfigLoader.load(yamlFile);
        assertEquals("/data/indy", loaded.getStorage().getDir());

        HistoryConfig config = HistoryConfigLoader.convertToDomain(loaded);

        assertEquals(Path.of("/data/indy"), config.dataDir());
        assertEquals("_stats_db", config.storeSuffix());
        assertEquals(ProcessControlBackend.SUPERVISOR, config.processBackend());
        assertEquals("validator", config.serviceName());
        assertEquals(Duration.ofMillis(1500), config.probeTimeout());
        assertEquals(ZoneId.of("America/Sao_Paulo"), config.zone());
        assertEquals(RenderMode.JSON, config.mode());
        assertTrue(config.verbose());
        assertEquals(5, config.count());
        assertEquals(List.of("indy-node", "indy-plenum", "sovrin"), config.packages());
    }

    @Test
    void shouldApplyDefaultsForOmittedSections() throws IOException {
        Path yamlFile = tempDir.resolve("minimal.yaml");
        Files.writeString(yamlFile, "storage:\n  dir: /srv/data\n");

        HistoryConfig config = HistoryConfigLoader.convertToDomain(HistoryConfigLoader.load(yamlFile));

        assertEquals("_info_db", config.storeSuffix());
        assertEquals(ProcessControlBackend.SYSTEMD, config.processBackend());
        assertEquals("indy-node", config.serviceName());
        assertEquals(Duration.ofSeconds(10), config.probeTimeout());
        assertEquals(RenderMode.NARRATIVE, config.mode());
        assertFalse(config.verbose());
        assertEquals(1, config.count());
        assertEquals(List.of("indy-node", "sovrin"), config.packages());
    }

    @Test
    void shouldResolveEnvironmentVariables() throws IOException {
        Path yamlFile = tempDir.resolve("env.yaml");
        Files.writeString(yamlFile, String.join("\n",
                "storage:",
                "  dir: ${DATA_DIR}",
                "process:",
                "  backend: ${BACKEND:systemd}",
                "  timeout: ${TIMEOUT:PT30S}",
                ""));
        Map<String, String> env = Map.of("DATA_DIR", "/opt/indy", "BACKEND", "supervisorctl");

        HistoryConfig config = HistoryConfigLoader.convertToDomain(HistoryConfigLoader.load(yamlFile, env::get));

        assertEquals(Path.of("/opt/indy"), config.dataDir());
        assertEquals(ProcessControlBackend.SUPERVISOR, config.processBackend());
        assertEquals(Duration.ofSeconds(30), config.probeTimeout());
    }

    @Test
    void shouldFailOnUnresolvedVariableWithoutDefault() throws IOException {
        Path yamlFile = tempDir.resolve("missing.yaml");
        Files.writeString(yamlFile, "storage:\n  dir: ${NOT_SET}\n");

        assertThrows(IllegalArgumentException.class, () -> HistoryConfigLoader.load(yamlFile, name -> null));
    }

    @Test
    void shouldLoadBundledDefaultsAndToggleBackendFromEnvironment() throws IOException {
        HistoryConfig defaults = HistoryConfigLoader.convertToDomain(HistoryConfigLoader.loadDefault(name -> null));
        assertEquals(Path.of("/var/lib/indy/data"), defaults.dataDir());
        assertEquals(ProcessControlBackend.SYSTEMD, defaults.processBackend());
        assertEquals(ZoneId.of("UTC"), defaults.zone());

        Map<String, String> env = Map.of("VINFO_PROCESS_BACKEND", "supervisor", "VINFO_DATA_DIR", "/tmp/stores");
        HistoryConfig supervised = HistoryConfigLoader.convertToDomain(HistoryConfigLoader.loadDefault(env::get));
        assertEquals(ProcessControlBackend.SUPERVISOR, supervised.processBackend());
        assertEquals(Path.of("/tmp/stores"), supervised.dataDir());
    }

    @Test
    void shouldRejectInvalidSettings() throws IOException {
        assertThrows(IllegalArgumentException.class,
                () -> HistoryConfigLoader.convertToDomain(new HistoryYamlConfig()));

        Path badBackend = tempDir.resolve("bad-backend.yaml");
        Files.writeString(badBackend, "storage:\n  dir: /srv\nprocess:\n  backend: upstart\n");
        HistoryYamlConfig yaml = HistoryConfigLoader.load(badBackend);
        assertThrows(IllegalArgumentException.class, () -> HistoryConfigLoader.convertToDomain(yaml));

        assertThrows(IllegalArgumentException.class,
                () -> HistoryConfig.builder(Path.of("/srv")).probeTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> HistoryConfig.builder(Path.of("/srv")).storeSuffix("").build());
    }
}
