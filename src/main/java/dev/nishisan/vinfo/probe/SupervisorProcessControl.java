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
 * {@link ProcessControlProbe} using {@code supervisorctl}.
 * <p>
 * {@code supervisorctl status <svc>} prints {@code <svc> RUNNING pid 42, uptime 1:02:03}. The
 * enabled state comes from {@code supervisorctl avail}, where a program listed as
 * {@code in use} is enabled and one listed as {@code avail} is not.
 */
public final class SupervisorProcessControl implements ProcessControlProbe {
    private static final Logger LOGGER = Logger.getLogger(SupervisorProcessControl.class.getName());

    private final CommandRunner runner;
    private final String service;

    public SupervisorProcessControl(CommandRunner runner, String service) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.service = Objects.requireNonNull(service, "service");
    }

    @Override
    public RunState getRunState() throws ProbeException {
        String out = runner.run(List.of("supervisorctl", "status", service)).stdout().trim();
        String[] tokens = out.split("\\s+");
        String status = tokens.length > 1 && tokens[0].equals(service) ? tokens[1] : "";
        switch (status) {
            case "RUNNING", "STARTING":
                return RunState.RUNNING;
            case "STOPPED", "STOPPING", "EXITED", "FATAL", "BACKOFF":
                return RunState.STOPPED;
            default:
                LOGGER.info(() -> "Unrecognized supervisorctl status output for " + service + ": '" + out + "'");
                return RunState.INDETERMINATE;
        }
    }

    @Override
    public EnabledState getEnabledState() throws ProbeException {
        String out = runner.run(List.of("supervisorctl", "avail")).stdout();
        for (String line : out.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.startsWith(service + " ") && !trimmed.startsWith(service + "\t")) {
                continue;
            }
            String rest = trimmed.substring(service.length()).trim();
            if (rest.startsWith("in use")) {
                return EnabledState.ENABLED;
            }
            if (rest.startsWith("avail")) {
                return EnabledState.DISABLED;
            }
        }
        LOGGER.info(() -> "Service " + service + " not found in supervisorctl avail output");
        return EnabledState.INDETERMINATE;
    }
}
