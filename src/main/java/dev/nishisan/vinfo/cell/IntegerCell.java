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
 * Integral counter value. Whole floating point numbers such as {@code 3.0} are accepted.
 */
public final class IntegerCell extends ValueCell<Long> {

    public static final CellKind<IntegerCell> KIND = new CellKind<>() {
        @Override
        public FieldOutcome<IntegerCell> wrap(JsonNode raw) {
            if (CellKind.isAbsent(raw)) {
                return FieldOutcome.parsed(unknown());
            }
            if (raw.isIntegralNumber() && raw.canConvertToLong()) {
                return FieldOutcome.parsed(new IntegerCell(raw.longValue()));
            }
            if (raw.isFloatingPointNumber()) {
                double value = raw.doubleValue();
                if (value != Math.rint(value) || Math.abs(value) >= 0x1p63) {
                    return FieldOutcome.malformed("not an integer: " + raw.asText());
                }
                return FieldOutcome.parsed(new IntegerCell((long) value));
            }
            if (raw.isTextual()) {
                try {
                    return FieldOutcome.parsed(new IntegerCell(Long.parseLong(raw.asText().trim())));
                } catch (NumberFormatException e) {
                    return FieldOutcome.malformed("not an integer: '" + raw.asText() + "'");
                }
            }
            return FieldOutcome.malformed("expected an integer but got " + raw.getNodeType());
        }

        @Override
        public IntegerCell unknown() {
            return new IntegerCell(null);
        }

        @Override
        public String name() {
            return "integer";
        }
    };

    public IntegerCell(Long value) {
        super(value);
    }

    @Override
    protected String format(Long value) {
        return Long.toString(value);
    }
}
