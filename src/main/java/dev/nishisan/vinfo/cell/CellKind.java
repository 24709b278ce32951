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
 * Constructor of one {@link ValueCell} variant from raw JSON.
 *
 * @param <C> the cell type produced
 */
public interface CellKind<C extends ValueCell<?>> {

    /**
     * Builds a cell from a raw value. A missing or JSON {@code null} value yields a parsed unknown
     * cell; a value of the wrong shape yields a malformed outcome.
     *
     * @param raw the raw value, may be {@code null}
     * @return the outcome, never {@code null}
     */
    FieldOutcome<C> wrap(JsonNode raw);

    /**
     * Returns an unknown cell of this kind.
     *
     * @return the unknown cell
     */
    C unknown();

    /** Returns a short name used in log messages. */
    String name();

    static boolean isAbsent(JsonNode raw) {
        return raw == null || raw.isNull() || raw.isMissingNode();
    }
}
