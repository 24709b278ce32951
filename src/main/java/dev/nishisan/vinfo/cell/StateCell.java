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
 * Process run state label, such as {@code running} or {@code stopped}.
 */
public final class StateCell extends ValueCell<String> {

    public static final String UNKNOWN_STATE = "in unknown state";

    public static final CellKind<StateCell> KIND = new CellKind<>() {
        @Override
        public FieldOutcome<StateCell> wrap(JsonNode raw) {
            if (CellKind.isAbsent(raw)) {
                return FieldOutcome.parsed(unknown());
            }
            if (!raw.isTextual()) {
                return FieldOutcome.malformed("expected a state label but got " + raw.getNodeType());
            }
            return FieldOutcome.parsed(new StateCell(raw.asText()));
        }

        @Override
        public StateCell unknown() {
            return new StateCell(null);
        }

        @Override
        public String name() {
            return "state";
        }
    };

    public StateCell(String state) {
        super(state);
    }

    @Override
    protected String unknownText() {
        return UNKNOWN_STATE;
    }

    @Override
    protected String format(String state) {
        return state;
    }
}
