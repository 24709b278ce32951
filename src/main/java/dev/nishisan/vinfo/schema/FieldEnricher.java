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

package dev.nishisan.vinfo.schema;

import dev.nishisan.vinfo.cell.ValueCell;

/**
 * Computes a value from live system state for a field that is unknown after parsing.
 * <p>
 * Implementations must degrade to returning the given cell when their probe fails.
 *
 * @param <C> the cell type
 */
@FunctionalInterface
public interface FieldEnricher<C extends ValueCell<?>> {

    /**
     * @param fieldName the declared field name
     * @param unknown   the current, unknown cell
     * @param pass      per-record enrichment state
     * @return the replacement cell, or {@code unknown} when nothing could be computed
     */
    C enrich(String fieldName, C unknown, EnrichmentPass pass);
}
