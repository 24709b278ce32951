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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Listener bindings of a validator port.
 * <p>
 * Records store either the bare port number or the already resolved list of
 * {@code {port, protocol, ip}} objects. A bare port yields an unknown cell that remembers the
 * declared port so enrichment can resolve it from the live socket table. An empty list is a
 * present value meaning no listener was found.
 */
public final class BindingListCell extends ValueCell<List<Binding>> {

    public static final CellKind<BindingListCell> KIND = new CellKind<>() {
        @Override
        public FieldOutcome<BindingListCell> wrap(JsonNode raw) {
            if (CellKind.isAbsent(raw)) {
                return FieldOutcome.parsed(unknown());
            }
            if (raw.isIntegralNumber()) {
                int port = raw.intValue();
                if (port < 0 || port > 65_535) {
                    return FieldOutcome.malformed("port out of range: " + port);
                }
                return FieldOutcome.parsed(unresolved(port));
            }
            if (!raw.isArray()) {
                return FieldOutcome.malformed("expected a port or binding list but got " + raw.getNodeType());
            }
            List<Binding> bindings = new ArrayList<>(raw.size());
            for (JsonNode entry : raw) {
                JsonNode port = entry.get("port");
                JsonNode protocol = entry.get("protocol");
                JsonNode ip = entry.get("ip");
                if (port == null || !port.isIntegralNumber() || protocol == null || !protocol.isTextual()
                        || ip == null || !ip.isTextual()) {
                    return FieldOutcome.malformed("invalid binding entry " + entry);
                }
                bindings.add(new Binding(port.intValue(), protocol.asText(), ip.asText()));
            }
            return FieldOutcome.parsed(new BindingListCell(bindings, null));
        }

        @Override
        public BindingListCell unknown() {
            return new BindingListCell(null, null);
        }

        @Override
        public String name() {
            return "binding-list";
        }
    };

    private final Integer declaredPort;

    public BindingListCell(List<Binding> bindings, Integer declaredPort) {
        super(bindings == null ? null : dedup(bindings));
        this.declaredPort = declaredPort;
    }

    /**
     * Creates an unknown cell carrying the port number found in the record.
     *
     * @param port the declared port
     * @return the unresolved cell
     */
    public static BindingListCell unresolved(int port) {
        return new BindingListCell(null, port);
    }

    /**
     * Creates a resolved cell for the given port.
     *
     * @param port     the declared port
     * @param bindings the discovered bindings, possibly empty
     * @return the resolved cell
     */
    public static BindingListCell resolved(int port, List<Binding> bindings) {
        return new BindingListCell(bindings, port);
    }

    /** Returns the port number the record declared, if any. */
    public Optional<Integer> declaredPort() {
        return Optional.ofNullable(declaredPort);
    }

    @Override
    protected String format(List<Binding> bindings) {
        if (bindings.isEmpty()) {
            return "no bindings found";
        }
        List<String> parts = new ArrayList<>(bindings.size());
        for (Binding binding : bindings) {
            parts.add(binding.toString());
        }
        return String.join(", ", parts);
    }

    private static List<Binding> dedup(List<Binding> bindings) {
        Set<Binding> unique = new LinkedHashSet<>(bindings);
        return List.copyOf(unique);
    }
}
