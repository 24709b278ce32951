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

import static org.junit.jupiter.api.Assertions.assertEquals;

class SupervisorProcessControlTest {

    private static SupervisorProcessControl answering(String stdout) {
        return new SupervisorProcessControl(command -> new CommandResult(0, stdout), "indy-node");
    }

    @Test
    void runningProgram() throws Exception {
        assertEquals(RunState.RUNNING,
                answering("indy-node                        RUNNING   pid 1234, uptime 1:02:03\n").getRunState());
    }

    @Test
    void stoppedOrFailedProgram() throws Exception {
        assertEquals(RunState.STOPPED, answering("indy-node STOPPED   Oct 17 10:00 AM\n").getRunState());
        assertEquals(RunState.STOPPED, answering("indy-node FATAL     Exited too quickly\n").getRunState());
    }

    @Test
    void otherProgramOrNoSuchProcessIsIndeterminate() throws Exception {
        assertEquals(RunState.INDETERMINATE, answering("indy-node-2 RUNNING pid 1, uptime 0:00:01").getRunState());
        assertEquals(RunState.INDETERMINATE, answering("indy-node: ERROR (no such process)").getRunState());
    }

    @Test
    void enabledStateFromAvail() throws Exception {
        String avail = String.join("\n",
                "indy-node-agent                  in use    auto      999:999",
                "indy-node                        in use    auto      999:999",
                "sovrin-monitor                   avail     manual    999:999");
        assertEquals(EnabledState.ENABLED, answering(avail).getEnabledState());
        assertEquals(EnabledState.DISABLED,
                new SupervisorProcessControl(command -> new CommandResult(0, avail), "sovrin-monitor")
                        .getEnabledState());
        assertEquals(EnabledState.INDETERMINATE,
                new SupervisorProcessControl(command -> new CommandResult(0, avail), "other")
                        .getEnabledState());
    }
}
