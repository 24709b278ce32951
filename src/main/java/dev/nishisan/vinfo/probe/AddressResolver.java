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

import java.util.Optional;

/**
 * Resolves a local IP address to its network notation ({@code ip/prefix}).
 */
@FunctionalInterface
public interface AddressResolver {

    /**
     * @param ip a local address
     * @return the address with its prefix length, or empty if no interface carries it
     * @throws ProbeException if the interface table could not be read
     */
    Optional<String> resolve(String ip) throws ProbeException;
}
