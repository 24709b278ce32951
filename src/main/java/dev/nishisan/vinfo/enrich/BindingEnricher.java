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

package dev.nishisan.vinfo.enrich;

import dev.nishisan.vinfo.cell.Binding;
import dev.nishisan.vinfo.cell.BindingListCell;
import dev.nishisan.vinfo.probe.AddressResolver;
import dev.nishisan.vinfo.probe.ProbeException;
import dev.nishisan.vinfo.probe.SocketEntry;
import dev.nishisan.vinfo.probe.SocketTableProbe;
import dev.nishisan.vinfo.schema.EnrichmentPass;
import dev.nishisan.vinfo.schema.FieldEnricher;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replaces a bare port number with the listener bindings found in the live socket table.
 * <p>
 * Each bound address is shown in network notation. Wildcard addresses map to {@code 0.0.0.0/0}
 * or {@code ::/0}; other addresses are looked up once per distinct IP within a record and fall
 * back to the bare address when no interface carries them. A port with no listener resolves to an
 * empty list, which is a known value.
 */
public final class BindingEnricher implements FieldEnricher<BindingListCell> {
    private static final Logger LOGGER = Logger.getLogger(BindingEnricher.class.getName());

    static final String NETWORK_CACHE = "binding.network";
    private static final Set<String> IPV4_ANY = Set.of("0.0.0.0", "*");
    private static final Set<String> IPV6_ANY = Set.of("::", "[::]");

    private final SocketTableProbe socketTable;
    private final AddressResolver resolver;

    public BindingEnricher(SocketTableProbe socketTable, AddressResolver resolver) {
        this.socketTable = Objects.requireNonNull(socketTable, "socketTable");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    @Override
    public BindingListCell enrich(String fieldName, BindingListCell unknown, EnrichmentPass pass) {
        Optional<Integer> declared = unknown.declaredPort();
        if (declared.isEmpty()) {
            return unknown;
        }
        int port = declared.get();
        List<SocketEntry> sockets;
        try {
            sockets = socketTable.listBindings(port);
        } catch (ProbeException e) {
            LOGGER.log(Level.WARNING, "Socket table lookup for " + fieldName + " (port " + port + ") failed", e);
            return unknown;
        }
        List<Binding> bindings = new ArrayList<>(sockets.size());
        for (SocketEntry socket : sockets) {
            String network = pass.memoize(NETWORK_CACHE, socket.ip(), this::toNetwork);
            bindings.add(new Binding(port, socket.protocol(), network));
        }
        return BindingListCell.resolved(port, bindings);
    }

    private String toNetwork(String ip) {
        if (IPV4_ANY.contains(ip)) {
            return "0.0.0.0/0";
        }
        if (IPV6_ANY.contains(ip)) {
            return "::/0";
        }
        try {
            return resolver.resolve(ip).orElse(ip);
        } catch (ProbeException e) {
            LOGGER.log(Level.WARNING, "Netmask lookup for " + ip + " failed", e);
            return ip;
        }
    }
}
