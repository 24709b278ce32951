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

package dev.nishisan.vinfo.render;

import com.fasterxml.jackson.databind.JsonNode;
import dev.nishisan.vinfo.query.StoredRecord;
import dev.nishisan.vinfo.schema.Schema;
import dev.nishisan.vinfo.schema.SchemaBuilder;
import dev.nishisan.vinfo.schema.SchemaNode;

import java.util.Objects;

/**
 * Turns stored records into text according to a {@link RenderRequest}.
 * <p>
 * The typed tree is rebuilt, and enriched, for every record. The narrative layout needs the whole
 * typed record: when a field path or raw output is requested it falls back to the tree layout.
 */
public final class ReportRenderer {

    private final Schema schema;
    private final JsonReportRenderer json = new JsonReportRenderer();
    private final TreeReportRenderer tree = new TreeReportRenderer();
    private final NarrativeReportRenderer narrative = new NarrativeReportRenderer();

    public ReportRenderer(Schema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    /**
     * @param record  the decoded record
     * @param request rendering options
     * @return the rendered text
     * @throws MissingPathException if the requested field path does not exist in the record
     */
    public String render(StoredRecord record, RenderRequest request) throws MissingPathException {
        boolean selective = request.raw() || request.fieldPath() != null;
        if (request.mode() == RenderMode.NARRATIVE && !selective) {
            return narrative.render(SchemaBuilder.build(record.json(), schema, request.verbose()), request.verbose());
        }
        JsonNode document;
        if (request.raw()) {
            document = record.json();
        } else {
            SchemaNode typed = SchemaBuilder.build(record.json(), schema, request.verbose());
            document = typed.toJson();
        }
        if (request.fieldPath() != null) {
            document = FieldPathSelector.select(document, request.fieldPath());
        }
        return request.mode() == RenderMode.JSON ? json.render(document) : tree.render(document);
    }
}
