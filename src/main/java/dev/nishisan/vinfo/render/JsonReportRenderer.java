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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dev.nishisan.vinfo.JsonSupport;
import dev.nishisan.vinfo.schema.SchemaNode;

import java.io.UncheckedIOException;

/**
 * Canonical JSON output. Typed trees are serialized with cells collapsed to their normalized raw
 * values and unknown cells as {@code null}.
 */
public final class JsonReportRenderer {

    public String render(SchemaNode tree) {
        return render(tree.toJson());
    }

    public String render(JsonNode json) {
        try {
            return JsonSupport.MAPPER.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize record", e);
        }
    }
}
