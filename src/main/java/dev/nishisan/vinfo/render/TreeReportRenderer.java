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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Flat indented rendering of a JSON document: one {@code "key":} line per object member that
 * holds a container, one {@code "key": value} line per scalar member, and one line per scalar
 * list item. Empty objects and lists render as {@value #EMPTY}.
 */
public final class TreeReportRenderer {

    public static final String EMPTY = "n/a";
    private static final String INDENT = "    ";

    public String render(JsonNode root) {
        List<String> lines = new ArrayList<>();
        if (root.isContainerNode() && root.isEmpty()) {
            lines.add(EMPTY);
        } else if (root.isContainerNode()) {
            walk(root, 0, lines);
        } else {
            lines.add(scalar(root));
        }
        return String.join("\n", lines);
    }

    private void walk(JsonNode node, int depth, List<String> lines) {
        String indent = INDENT.repeat(depth);
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = indent + "\"" + field.getKey() + "\":";
                JsonNode value = field.getValue();
                if (!value.isContainerNode()) {
                    lines.add(key + " " + scalar(value));
                } else if (value.isEmpty()) {
                    lines.add(key + " " + EMPTY);
                } else {
                    lines.add(key);
                    walk(value, depth + 1, lines);
                }
            }
            return;
        }
        for (JsonNode item : node) {
            if (!item.isContainerNode()) {
                lines.add(indent + scalar(item));
            } else if (item.isEmpty()) {
                lines.add(indent + EMPTY);
            } else {
                walk(item, depth, lines);
            }
        }
    }

    private static String scalar(JsonNode value) {
        return value.isNull() ? "null" : value.asText();
    }
}
