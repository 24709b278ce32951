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

import java.util.Locale;

/**
 * Rate value rendered with two decimals.
 */
public final class FloatCell extends ValueCell<Double> {

    public static final CellKind<FloatCell> KIND = new CellKind<>() {
        @Override
        public FieldOutcome<FloatCell> wrap(JsonNode raw) {
            if (CellKind.isAbsent(raw)) {
                return FieldOutcome.parsed(unknown());
            }
            if (raw.isNumber()) {
                return FieldOutcome.parsed(new FloatCell(raw.doubleValue()));
            }
            if (raw.isTextual()) {
                try {
                    return FieldOutcome.parsed(new FloatCell(Double.parseDouble(raw.asText().trim())));
                } catch (NumberFormatException e) {
                    return FieldOutcome.malformed("not a number: '" + raw.asText() + "'");
                }
            }
            return FieldOutcome.malformed("expected a number but got " + raw.getNodeType());
        }

        @Override
        public FloatCell unknown() {
            return new FloatCell(null);
        }

        @Override
        public String name() {
            return "float";
        }
    };

    public FloatCell(Double value) {
        super(value);
    }

    @Override
    protected String format(Double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
