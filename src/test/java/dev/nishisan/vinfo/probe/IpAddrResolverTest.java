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
import static org.junit.jupiter.api.Assertions.assertThrows;

class IpAddrResolverTest {

    private static final String OUTPUT = String.join("\n",
            "1: lo    inet 127.0.0.1/8 scope host lo\\       valid_lft forever preferred_lft forever",
            "2: eth0    inet 10.0.0.2/24 brd 10.0.0.255 scope global eth0\\       valid_lft forever",
            "2: eth0    inet6 fe80::1/64 scope link \\       valid_lft forever preferred_lft forever");

    @Test
    void findsTheNetworkOfAnAddress() {
        assertEquals(Optional.of("10.0.0.2/24"), IpAddrResolver.find(OUTPUT, "10.0.0.2"));
        assertEquals(Optional.of("fe80::1/64"), IpAddrResolver.find(OUTPUT, "fe80::1"));
    }

    @Test
    void prefixMatchesAreNotConfused() {
        assertEquals(Optional.empty(), IpAddrResolver.find(OUTPUT, "10.0.0.25"));
        assertEquals(Optional.empty(), IpAddrResolver.find(OUTPUT, "10.0.0"));
    }

    @Test
    void resolveRunsIpAddr() throws Exception {
        IpAddrResolver resolver = new IpAddrResolver(command -> new CommandResult(0, OUTPUT));
        assertEquals(Optional.of("127.0.0.1/8"), resolver.resolve("127.0.0.1"));
    }

    @Test
    void failingCommandRaises() {
        IpAddrResolver resolver = new IpAddrResolver(command -> new CommandResult(255, ""));
        assertThrows(ProbeException.class, () -> resolver.resolve("10.0.0.2"));
    }
}
