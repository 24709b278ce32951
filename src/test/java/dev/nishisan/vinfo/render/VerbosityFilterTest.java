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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class VerbosityFilterTest {

    private final List<String> lines = List.of("always", "#verbose only", "also always", "#");

    @Test
    void dropsMarkedLinesWhenNotVerbose() {
        assertEquals(List.of("always", "also always"), VerbosityFilter.apply(lines, false));
    }

    @Test
    void keepsMarkedLinesWithoutTheMarkerWhenVerbose() {
        assertEquals(List.of("always", "verbose only", "also always", ""), VerbosityFilter.apply(lines, true));
    }

    @Test
    void markerOnlyCountsAtLineStart() {
        assertEquals("a # b\nc", VerbosityFilter.apply("a # b\n#x\nc", false));
    }
}
