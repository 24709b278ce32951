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

import java.util.Objects;

/**
 * How a record is turned into text.
 *
 * @param mode      output layout
 * @param verbose   keep marked narrative lines
 * @param raw       render the stored document instead of the normalized tree
 * @param fieldPath dotted path of the only field to render, or {@code null} for the whole record
 */
public record RenderRequest(RenderMode mode, boolean verbose, boolean raw, String fieldPath) {

    public RenderRequest {
        Objects.requireNonNull(mode, "mode");
        if (fieldPath != null && fieldPath.isBlank()) {
            fieldPath = null;
        }
    }

    public static RenderRequest of(RenderMode mode, boolean verbose) {
        return new RenderRequest(mode, verbose, false, null);
    }
}
