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

package dev.nishisan.vinfo.cell;

import java.util.Objects;

/**
 * A discovered listener socket for a declared port. Equality is by the full triple.
 *
 * @param port     the listening port
 * @param protocol the transport protocol, such as {@code tcp}
 * @param ip       the bound address in network notation, such as {@code 10.0.0.5/24}
 */
public record Binding(int port, String protocol, String ip) {

    public Binding {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(ip, "ip");
    }

    @Override
    public String toString() {
        return ip + ":" + port + "/" + protocol;
    }
}
