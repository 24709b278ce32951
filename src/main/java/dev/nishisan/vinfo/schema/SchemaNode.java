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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.nishisan.vinfo.cell.ValueCell;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Typed value tree built from one raw record. Each field holds either a {@link ValueCell} or a
 * nested {@code SchemaNode}; iteration follows the schema's declaration order.
 */
public final class SchemaNode {
    private final Schema schema;
    private final Map<String, Object> values = new LinkedHashMap<>();

    SchemaNode(Schema schema) {
        this.schema = schema;
    }

    public Schema schema() {
        return schema;
    }

    public Set<String> fieldNames() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /**
     * Returns the value of a field: a {@link ValueCell} or a nested {@link SchemaNode}.
     *
     * @param field the field name
     * @return the value
     * @throws IllegalArgumentException if the schema declares no such field
     */
    public Object get(String field) {
        Object value = values.get(field);
        if (value == null) {
            throw new IllegalArgumentException("No field '" + field + "' in schema " + schema.name());
        }
        return value;
    }

    public ValueCell<?> cell(String field) {
        Object value = get(field);
        if (!(value instanceof ValueCell<?> cell)) {
            throw new IllegalArgumentException("Field '" + field + "' of " + schema.name() + " is a nested record");
        }
        return cell;
    }

    public <C extends ValueCell<?>> C cell(String field, Class<C> type) {
        return type.cast(cell(field));
    }

    public SchemaNode node(String field) {
        Object value = get(field);
        if (!(value instanceof SchemaNode node)) {
            throw new IllegalArgumentException("Field '" + field + "' of " + schema.name() + " is not a nested record");
        }
        return node;
    }

    /** Returns {@code true} when every cell of this subtree is unknown. */
    public boolean isUnknown() {
        for (Object value : values.values()) {
            if (value instanceof SchemaNode node && !node.isUnknown()) {
                return false;
            }
            if (value instanceof ValueCell<?> cell && !cell.isUnknown()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Serializes the tree with cells collapsed to their normalized raw values.
     *
     * @return the canonical JSON object
     */
    public ObjectNode toJson() {
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        values.forEach((field, value) -> {
            if (value instanceof SchemaNode node) {
                json.set(field, node.toJson());
            } else {
                json.set(field, ((ValueCell<?>) value).toJson());
            }
        });
        return json;
    }

    void put(String field, Object value) {
        values.put(field, value);
    }
}
