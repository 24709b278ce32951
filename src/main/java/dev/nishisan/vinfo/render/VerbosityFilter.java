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

import java.util.ArrayList;
import java.util.List;

/**
 * Drops or keeps report lines authored with a leading {@link #MARKER}.
 * <p>
 * In non-verbose mode marked lines are removed; in verbose mode they are kept. The marker is
 * stripped from every line that remains.
 */
public final class VerbosityFilter {

    public static final String MARKER = "#";

    private VerbosityFilter() {
    }

    public static List<String> apply(List<String> lines, boolean verbose) {
        List<String> out = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line.startsWith(MARKER)) {
                if (verbose) {
                    out.add(line.substring(MARKER.length()));
                }
            } else {
                out.add(line);
            }
        }
        return out;
    }

    public static String apply(String text, boolean verbose) {
        return String.join("\n", apply(List.of(text.split("\n", -1)), verbose));
    }
}
