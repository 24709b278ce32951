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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, declarative shape of a record. Field order drives text rendering.
 */
public final class Schema {
    private final String name;
    private final List<FieldSpec> fields;

    private Schema(String name, List<FieldSpec> fields) {
        this.name = name;
        this.fields = List.copyOf(fields);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<FieldSpec> fields() {
        return fields;
    }

    @Override
    public String toString() {
        return "Schema[" + name + "]";
    }

    public static final class Builder {
        private final String name;
        private final List<FieldSpec> fields = new ArrayList<>();
        private final Set<String> names = new HashSet<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public <C extends ValueCell<?>> Builder cell(String field, CellKind<C> kind) {
            return add(new FieldSpec.CellField<>(field, kind, null));
        }

        public <C extends ValueCell<?>> Builder cell(String field, CellKind<C> kind, FieldEnricher<C> enricher) {
            return add(new FieldSpec.CellField<>(field, kind, Objects.requireNonNull(enricher, "enricher")));
        }

        public Builder nested(String field, Schema schema) {
            return add(new FieldSpec.NestedField(field, schema));
        }

        private Builder add(FieldSpec spec) {
            if (!names.add(spec.name())) {
                throw new IllegalArgumentException("Duplicate field '" + spec.name() + "' in schema " + name);
            }
            fields.add(spec);
            return this;
        }

        public Schema build() {
            return new Schema(name, fields);
        }
    }
}
