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

import com.fasterxml.jackson.databind.JsonNode;
import dev.nishisan.vinfo.cell.FieldOutcome;
import dev.nishisan.vinfo.cell.ValueCell;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds {@link SchemaNode} trees from raw JSON records.
 * <p>
 * Every field is constructed independently: a malformed value is logged with the field and
 * schema name and replaced by an unknown cell of the declared kind, the rest of the record is
 * still built. Once the tree is complete, enrichers run for the cells that are still unknown.
 */
public final class SchemaBuilder {
    private static final Logger LOGGER = Logger.getLogger(SchemaBuilder.class.getName());

    private SchemaBuilder() {
    }

    /**
     * Builds and enriches the typed tree of one record.
     *
     * @param raw     the raw JSON object, or {@code null} when the record has no data
     * @param schema  the record schema
     * @param verbose include raw values in field failure logs
     * @return the typed tree
     */
    public static SchemaNode build(JsonNode raw, Schema schema, boolean verbose) {
        SchemaNode root = construct(raw, schema, verbose);
        enrich(root, new EnrichmentPass());
        return root;
    }

    private static SchemaNode construct(JsonNode raw, Schema schema, boolean verbose) {
        SchemaNode node = new SchemaNode(schema);
        JsonNode source = raw != null && raw.isObject() ? raw : null;
        if (raw != null && !raw.isNull() && !raw.isObject()) {
            LOGGER.warning(() -> "Expected an object for " + schema.name() + " but got " + raw.getNodeType());
        }
        for (FieldSpec spec : schema.fields()) {
            JsonNode value = source == null ? null : source.get(spec.name());
            if (spec instanceof FieldSpec.NestedField nested) {
                node.put(nested.name(), construct(value, nested.schema(), verbose));
            } else {
                node.put(spec.name(), constructCell((FieldSpec.CellField<?>) spec, value, schema, verbose));
            }
        }
        return node;
    }

    private static ValueCell<?> constructCell(FieldSpec.CellField<?> spec, JsonNode value, Schema schema,
            boolean verbose) {
        FieldOutcome<?> outcome;
        try {
            outcome = spec.kind().wrap(value);
        } catch (RuntimeException e) {
            outcome = FieldOutcome.malformed(e.toString());
        }
        if (outcome.isMalformed()) {
            String reason = outcome.reason();
            LOGGER.warning(() -> "Field '" + spec.name() + "' of " + schema.name() + " set to unknown: " + reason
                    + (verbose ? " (raw value " + value + ")" : ""));
            return spec.kind().unknown();
        }
        return outcome.cell().orElseThrow();
    }

    private static void enrich(SchemaNode node, EnrichmentPass pass) {
        for (FieldSpec spec : node.schema().fields()) {
            if (spec instanceof FieldSpec.NestedField nested) {
                enrich(node.node(nested.name()), pass);
            } else {
                enrichCell(node, (FieldSpec.CellField<?>) spec, pass);
            }
        }
    }

    private static <C extends ValueCell<?>> void enrichCell(SchemaNode node, FieldSpec.CellField<C> spec,
            EnrichmentPass pass) {
        if (spec.enricher() == null) {
            return;
        }
        ValueCell<?> current = node.cell(spec.name());
        if (!current.isUnknown()) {
            return;
        }
        @SuppressWarnings("unchecked")
        C unknown = (C) current;
        try {
            C enriched = spec.enricher().enrich(spec.name(), unknown, pass);
            if (enriched != null) {
                node.put(spec.name(), enriched);
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Enrichment of field '" + spec.name() + "' in " + node.schema().name()
                    + " failed, keeping unknown", e);
        }
    }
}
