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

package dev.nishisan.vinfo.probe;

import java.util.Locale;

/**
 * Supported process control planes.
 */
public enum ProcessControlBackend {
    SYSTEMD,
    SUPERVISOR;

    /**
     * Parses a configuration value, ignoring case. {@code supervisord} and {@code supervisorctl}
     * are accepted as aliases of {@link #SUPERVISOR}.
     *
     * @param value the configured value
     * @return the backend
     * @throws IllegalArgumentException for unknown values
     */
    public static ProcessControlBackend fromString(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "SYSTEMD", "SYSTEMCTL" -> SYSTEMD;
            case "SUPERVISOR", "SUPERVISORD", "SUPERVISORCTL" -> SUPERVISOR;
            default -> throw new IllegalArgumentException("Unknown process control backend '" + value + "'");
        };
    }

    /**
     * Creates the probe for this backend.
     *
     * @param runner  command runner
     * @param service managed service name
     * @return the probe
     */
    public ProcessControlProbe create(CommandRunner runner, String service) {
        return switch (this) {
            case SYSTEMD -> new SystemdProcessControl(runner, service);
            case SUPERVISOR -> new SupervisorProcessControl(runner, service);
        };
    }
}
