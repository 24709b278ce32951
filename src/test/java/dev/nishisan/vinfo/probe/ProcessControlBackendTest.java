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

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ProcessControlBackendTest {

    @Test
    void parsesNamesAndAliases() {
        assertEquals(ProcessControlBackend.SYSTEMD, ProcessControlBackend.fromString("systemd"));
        assertEquals(ProcessControlBackend.SYSTEMD, ProcessControlBackend.fromString(" Systemctl "));
        assertEquals(ProcessControlBackend.SUPERVISOR, ProcessControlBackend.fromString("supervisord"));
        assertEquals(ProcessControlBackend.SUPERVISOR, ProcessControlBackend.fromString("SUPERVISORCTL"));
    }

    @Test
    void rejectsUnknownBackends() {
        assertThrows(IllegalArgumentException.class, () -> ProcessControlBackend.fromString("upstart"));
        assertThrows(IllegalArgumentException.class, () -> ProcessControlBackend.fromString(null));
    }

    @Test
    void createsTheMatchingProbe() {
        CommandRunner runner = command -> new CommandResult(0, "");
        assertInstanceOf(SystemdProcessControl.class, ProcessControlBackend.SYSTEMD.create(runner, "indy-node"));
        assertInstanceOf(SupervisorProcessControl.class,
                ProcessControlBackend.SUPERVISOR.create(runner, "indy-node"));
    }

    @Test
    void dpkgProbeReadsVersionOrEmpty() throws Exception {
        DpkgPackageVersionProbe installed = new DpkgPackageVersionProbe(command -> new CommandResult(0, "1.12.4\n"));
        DpkgPackageVersionProbe missing = new DpkgPackageVersionProbe(command -> new CommandResult(1, ""));

        assertEquals("1.12.4", installed.getInstalledVersion("indy-node").orElseThrow());
        assertEquals(Optional.empty(), missing.getInstalledVersion("sovrin"));
    }
}
