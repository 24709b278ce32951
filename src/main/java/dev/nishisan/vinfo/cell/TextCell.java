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
 * Plain text value. Scalar JSON values are accepted and kept in their textual form.
 */
public final class TextCell extends ValueCell<String> {

    public static final CellKind<TextCell> KIND = new CellKind<>() {
        @Override
        public FieldOutcome<TextCell> wrap(JsonNode raw) {
            if (CellKind.isAbsent(raw)) {
                return FieldOutcome.parsed(unknown());
            }
            if (!raw.isValueNode()) {
                return FieldOutcome.malformed("expected a scalar but got " + raw.getNodeType());
            }
            return FieldOutcome.parsed(new TextCell(raw.asText()));
        }

        @Override
        public TextCell unknown() {
            return new TextCell(null);
        }

        @Override
        public String name() {
            return "text";
        }
    };

    public TextCell(String value) {
        super(value);
    }

    @Override
    protected String format(String value) {
        return value;
    }
}
