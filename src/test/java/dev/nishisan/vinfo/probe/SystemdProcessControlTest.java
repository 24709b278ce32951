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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SystemdProcessControlTest {

    private static SystemdProcessControl answering(int exitCode, String stdout) {
        return new SystemdProcessControl(command -> {
            assertEquals("systemctl", command.get(0));
            assertEquals("indy-node", command.get(2));
            return new CommandResult(exitCode, stdout);
        }, "indy-node");
    }

    @Test
    void activeUnitIsRunning() throws Exception {
        assertEquals(RunState.RUNNING, answering(0, "active\n").getRunState());
    }

    @Test
    void inactiveOrFailedUnitIsStopped() throws Exception {
        assertEquals(RunState.STOPPED, answering(3, "inactive\n").getRunState());
        assertEquals(RunState.STOPPED, answering(3, "failed\n").getRunState());
    }

    @Test
    void unexpectedOutputIsIndeterminate() throws Exception {
        assertEquals(RunState.INDETERMINATE, answering(4, "").getRunState());
        assertEquals(EnabledState.INDETERMINATE, answering(1, "bogus").getEnabledState());
    }

    @Test
    void enabledStates() throws Exception {
        assertEquals(EnabledState.ENABLED, answering(0, "enabled\n").getEnabledState());
        assertEquals(EnabledState.ENABLED, answering(0, "static\n").getEnabledState());
        assertEquals(EnabledState.DISABLED, answering(1, "disabled\n").getEnabledState());
        assertEquals(EnabledState.DISABLED, answering(1, "masked\n").getEnabledState());
    }

    @Test
    void usesIsActiveAndIsEnabled() throws Exception {
        List<String> seen = new ArrayList<>();
        SystemdProcessControl probe = new SystemdProcessControl(command -> {
            seen.add(command.get(1));
            return new CommandResult(0, "active");
        }, "indy-node");

        probe.getRunState();
        probe.getEnabledState();

        assertEquals(List.of("is-active", "is-enabled"), seen);
    }

    @Test
    void runnerFailurePropagates() {
        SystemdProcessControl probe = new SystemdProcessControl(command -> {
            throw new ProbeException("no systemctl");
        }, "indy-node");
        assertThrows(ProbeException.class, probe::getRunState);
    }
}
