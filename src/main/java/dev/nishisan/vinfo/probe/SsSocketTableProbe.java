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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link SocketTableProbe} parsing {@code ss -ltunH} output.
 * <p>
 * Lines look like {@code tcp LISTEN 0 128 0.0.0.0:9701 0.0.0.0:*}; the fifth column is the
 * local address, IPv6 addresses are bracketed and an optional {@code %iface} scope is dropped.
 */
public final class SsSocketTableProbe implements SocketTableProbe {
    private static final List<String> COMMAND = List.of("ss", "-ltunH");

    private final CommandRunner runner;

    public SsSocketTableProbe(CommandRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public List<SocketEntry> listBindings(int port) throws ProbeException {
        CommandResult result = runner.run(COMMAND);
        if (!result.succeeded()) {
            throw new ProbeException("ss exited with status " + result.exitCode());
        }
        return parse(result.stdout(), port);
    }

    static List<SocketEntry> parse(String output, int port) {
        List<SocketEntry> entries = new ArrayList<>();
        for (String line : output.split("\n")) {
            String[] columns = line.trim().split("\\s+");
            if (columns.length < 5) {
                continue;
            }
            String local = columns[4];
            int colon = local.lastIndexOf(':');
            if (colon <= 0) {
                continue;
            }
            String portText = local.substring(colon + 1);
            if (!portText.equals(Integer.toString(port))) {
                continue;
            }
            String ip = local.substring(0, colon);
            if (ip.startsWith("[") && ip.endsWith("]")) {
                ip = ip.substring(1, ip.length() - 1);
            }
            int scope = ip.indexOf('%');
            if (scope >= 0) {
                ip = ip.substring(0, scope);
            }
            entries.add(new SocketEntry(columns[0].toLowerCase(Locale.ROOT), ip));
        }
        return entries;
    }
}
