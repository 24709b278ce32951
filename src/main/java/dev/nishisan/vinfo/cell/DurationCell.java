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

package dev.nishisan.vinfo.cell;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Elapsed time in whole seconds, rendered as days, hours, minutes and seconds.
 * <p>
 * A component is printed when it is non-zero or when a larger component was already printed, so
 * {@code 3600} renders as {@code 1 hour, 0 minutes, 0 seconds}. Zero renders as {@code 0 seconds}.
 */
public final class DurationCell extends ValueCell<Long> {

    private static final long[] UNIT_SECONDS = {86_400L, 3_600L, 60L, 1L};
    private static final String[] UNIT_NAMES = {"day", "hour", "minute", "second"};

    public static final CellKind<DurationCell> KIND = new CellKind<>() {
        @Override
        public FieldOutcome<DurationCell> wrap(JsonNode raw) {
            if (CellKind.isAbsent(raw)) {
                return FieldOutcome.parsed(unknown());
            }
            if (!raw.isNumber()) {
                return FieldOutcome.malformed("expected seconds but got " + raw.getNodeType());
            }
            long seconds = (long) Math.floor(raw.doubleValue());
            if (seconds < 0) {
                return FieldOutcome.malformed("negative duration " + raw.asText());
            }
            return FieldOutcome.parsed(new DurationCell(seconds));
        }

        @Override
        public DurationCell unknown() {
            return new DurationCell(null);
        }

        @Override
        public String name() {
            return "duration";
        }
    };

    public DurationCell(Long seconds) {
        super(seconds);
    }

    @Override
    protected String format(Long seconds) {
        List<String> parts = new ArrayList<>(UNIT_SECONDS.length);
        long remaining = seconds;
        for (int i = 0; i < UNIT_SECONDS.length; i++) {
            long amount = remaining / UNIT_SECONDS[i];
            remaining = remaining % UNIT_SECONDS[i];
            if (amount != 0 || !parts.isEmpty()) {
                parts.add(amount + " " + UNIT_NAMES[i] + (amount == 1 ? "" : "s"));
            }
        }
        if (parts.isEmpty()) {
            return "0 seconds";
        }
        return String.join(", ", parts);
    }
}
