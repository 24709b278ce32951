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
import java.util.Optional;

/**
 * {@link AddressResolver} parsing {@code ip -o addr show} output, where each line carries an
 * {@code inet 10.0.0.5/24} or {@code inet6 fe80::1/64} token.
 */
public final class IpAddrResolver implements AddressResolver {
    private static final List<String> COMMAND = List.of("ip", "-o", "addr", "show");

    private final CommandRunner runner;

    public IpAddrResolver(CommandRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public Optional<String> resolve(String ip) throws ProbeException {
        CommandResult result = runner.run(COMMAND);
        if (!result.succeeded()) {
            throw new ProbeException("ip exited with status " + result.exitCode());
        }
        return find(result.stdout(), ip);
    }

    static Optional<String> find(String output, String ip) {
        for (String line : output.split("\n")) {
            String[] tokens = line.trim().split("\\s+");
            for (int i = 0; i + 1 < tokens.length; i++) {
                if (!tokens[i].equals("inet") && !tokens[i].equals("inet6")) {
                    continue;
                }
                String cidr = tokens[i + 1];
                int slash = cidr.indexOf('/');
                String address = slash < 0 ? cidr : cidr.substring(0, slash);
                if (address.equals(ip)) {
                    return Optional.of(cidr);
                }
            }
        }
        return Optional.empty();
    }
}
