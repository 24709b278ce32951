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

/**
 * Resolves dotted paths such as {@code Node_info.Metrics.uptime} in a JSON document. Numeric
 * segments index into arrays.
 */
public final class FieldPathSelector {

    private FieldPathSelector() {
    }

    public static JsonNode select(JsonNode root, String path) throws MissingPathException {
        JsonNode current = root;
        for (String segment : path.split("\\.")) {
            JsonNode next = null;
            if (current.isObject()) {
                next = current.get(segment);
            } else if (current.isArray() && isIndex(segment)) {
                next = current.get(Integer.parseInt(segment));
            }
            if (next == null) {
                throw new MissingPathException(path, segment);
            }
            current = next;
        }
        return current;
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
