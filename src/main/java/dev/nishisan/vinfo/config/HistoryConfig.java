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

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Resolved settings of the history reporter.
 */
public final class HistoryConfig {
    private final Path dataDir;
    private final String storeSuffix;
    private final ProcessControlBackend processBackend;
    private final String serviceName;
    private final Duration probeTimeout;
    private final ZoneId zone;
    private final RenderMode mode;
    private final boolean verbose;
    private final int count;
    private final List<String> packages;

    private HistoryConfig(Builder builder) {
        this.dataDir = Objects.requireNonNull(builder.dataDir, "dataDir");
        this.storeSuffix = Objects.requireNonNull(builder.storeSuffix, "storeSuffix");
        this.processBackend = Objects.requireNonNull(builder.processBackend, "processBackend");
        this.serviceName = Objects.requireNonNull(builder.serviceName, "serviceName");
        this.probeTimeout = Objects.requireNonNull(builder.probeTimeout, "probeTimeout");
        this.zone = Objects.requireNonNull(builder.zone, "zone");
        this.mode = Objects.requireNonNull(builder.mode, "mode");
        this.verbose = builder.verbose;
        this.count = builder.count;
        this.packages = List.copyOf(builder.packages);
        validate();
    }

    public static Builder builder(Path dataDir) {
        return new Builder(dataDir);
    }

    public Path dataDir() {
        return dataDir;
    }

    public String storeSuffix() {
        return storeSuffix;
    }

    public ProcessControlBackend processBackend() {
        return processBackend;
    }

    public String serviceName() {
        return serviceName;
    }

    public Duration probeTimeout() {
        return probeTimeout;
    }

    public ZoneId zone() {
        return zone;
    }

    public RenderMode mode() {
        return mode;
    }

    public boolean verbose() {
        return verbose;
    }

    /** Default number of most recent records shown in tail mode. */
    public int count() {
        return count;
    }

    public List<String> packages() {
        return packages;
    }

    private void validate() {
        if (storeSuffix.isEmpty()) {
            throw new IllegalArgumentException("storeSuffix must not be empty");
        }
        if (probeTimeout.isNegative() || probeTimeout.isZero()) {
            throw new IllegalArgumentException("probeTimeout must be > 0");
        }
    }

    public static final class Builder {
        private final Path dataDir;
        private String storeSuffix = "_info_db";
        private ProcessControlBackend processBackend = ProcessControlBackend.SYSTEMD;
        private String serviceName = "indy-node";
        private Duration probeTimeout = Duration.ofSeconds(10);
        private ZoneId zone = ZoneId.systemDefault();
        private RenderMode mode = RenderMode.NARRATIVE;
        private boolean verbose;
        private int count = 1;
        private List<String> packages = List.of("indy-node", "sovrin");

        private Builder(Path dataDir) {
            this.dataDir = dataDir;
        }

        public Builder storeSuffix(String storeSuffix) {
            this.storeSuffix = storeSuffix;
            return this;
        }

        public Builder processBackend(ProcessControlBackend processBackend) {
            this.processBackend = processBackend;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder probeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder mode(RenderMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder count(int count) {
            this.count = count;
            return this;
        }

        public Builder packages(List<String> packages) {
            this.packages = Objects.requireNonNull(packages, "packages");
            return this;
        }

        public HistoryConfig build() {
            return new HistoryConfig(this);
        }
    }
}
