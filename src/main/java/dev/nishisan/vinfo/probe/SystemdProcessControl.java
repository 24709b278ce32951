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

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link ProcessControlProbe} using {@code systemctl is-active} and {@code systemctl is-enabled}.
 * Both commands exit non-zero for inactive or disabled units, so only the printed word is used.
 */
public final class SystemdProcessControl implements ProcessControlProbe {
    private static final Logger LOGGER = Logger.getLogger(SystemdProcessControl.class.getName());

    private final CommandRunner runner;
    private final String service;

    public SystemdProcessControl(CommandRunner runner, String service) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.service = Objects.requireNonNull(service, "service");
    }

    @Override
    public RunState getRunState() throws ProbeException {
        String out = runner.run(List.of("systemctl", "is-active", service)).stdout().trim();
        switch (out) {
            case "active", "reloading", "activating":
                return RunState.RUNNING;
            case "inactive", "failed", "deactivating":
                return RunState.STOPPED;
            default:
                LOGGER.info(() -> "Unrecognized systemctl is-active output for " + service + ": '" + out + "'");
                return RunState.INDETERMINATE;
        }
    }

    @Override
    public EnabledState getEnabledState() throws ProbeException {
        String out = runner.run(List.of("systemctl", "is-enabled", service)).stdout().trim();
        switch (out) {
            case "enabled", "enabled-runtime", "static":
                return EnabledState.ENABLED;
            case "disabled", "masked", "masked-runtime":
                return EnabledState.DISABLED;
            default:
                LOGGER.info(() -> "Unrecognized systemctl is-enabled output for " + service + ": '" + out + "'");
                return EnabledState.INDETERMINATE;
        }
    }
}
