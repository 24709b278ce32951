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

import dev.nishisan.vinfo.cell.CellKind;
import dev.nishisan.vinfo.cell.ValueCell;

import java.util.Objects;

/**
 * One declared field of a {@link Schema}: either a value cell or a nested schema.
 */
public interface FieldSpec {

    String name();

    /**
     * A leaf field holding a {@link ValueCell}.
     *
     * @param name     field name in the raw record
     * @param kind     cell constructor
     * @param enricher optional hook replacing the cell when it is still unknown after parsing
     * @param <C>      the cell type
     */
    record CellField<C extends ValueCell<?>>(String name, CellKind<C> kind, FieldEnricher<C> enricher)
            implements FieldSpec {
        public CellField {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(kind, "kind");
        }
    }

    /**
     * A field whose value is a sub-record described by another schema.
     *
     * @param name   field name in the raw record
     * @param schema the nested schema
     */
    record NestedField(String name, Schema schema) implements FieldSpec {
        public NestedField {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(schema, "schema");
        }
    }
}
