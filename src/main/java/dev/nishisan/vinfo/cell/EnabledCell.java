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

/**
 * Whether the validator service starts at boot. Stored either as a boolean or as the
 * {@code enabled}/{@code disabled} label.
 */
public final class EnabledCell extends ValueCell<Boolean> {

    public static final CellKind<EnabledCell> KIND = new CellKind<>() {
        @Override
        public FieldOutcome<EnabledCell> wrap(JsonNode raw) {
            if (CellKind.isAbsent(raw)) {
                return FieldOutcome.parsed(unknown());
            }
            if (raw.isBoolean()) {
                return FieldOutcome.parsed(new EnabledCell(raw.booleanValue()));
            }
            if (raw.isTextual()) {
                switch (raw.asText().trim().toLowerCase()) {
                    case "enabled", "true" -> {
                        return FieldOutcome.parsed(new EnabledCell(true));
                    }
                    case "disabled", "false" -> {
                        return FieldOutcome.parsed(new EnabledCell(false));
                    }
                    default -> {
                        return FieldOutcome.malformed("unrecognized enabled label '" + raw.asText() + "'");
                    }
                }
            }
            return FieldOutcome.malformed("expected a boolean but got " + raw.getNodeType());
        }

        @Override
        public EnabledCell unknown() {
            return new EnabledCell(null);
        }

        @Override
        public String name() {
            return "enabled";
        }
    };

    public EnabledCell(Boolean enabled) {
        super(enabled);
    }

    @Override
    protected String format(Boolean enabled) {
        return enabled ? "enabled" : "disabled";
    }
}
