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

package dev.nishisan.vinfo.query;

/**
 * Selection of records from a store.
 * <p>
 * When {@code fromTs} or {@code toTs} is set the query is a bounded window and the other two
 * parameters are ignored. Otherwise {@code fromStart} selects every record in ascending order
 * and ignores {@code count}, and the default tail mode selects the {@code count} most recent
 * records. A negative {@code count} means no limit.
 *
 * @param count     number of most recent records in tail mode
 * @param fromStart select all records from the first one
 * @param fromTs    inclusive lower timestamp bound, or {@code null}
 * @param toTs      inclusive upper timestamp bound, or {@code null}
 */
public record RangeQuery(int count, boolean fromStart, Long fromTs, Long toTs) {

    public static final int UNLIMITED = -1;

    public RangeQuery {
        if (fromTs != null && toTs != null && fromTs > toTs) {
            throw new InvalidRangeException(fromTs, toTs);
        }
    }

    public static RangeQuery last(int count) {
        return new RangeQuery(count, false, null, null);
    }

    public static RangeQuery all() {
        return new RangeQuery(UNLIMITED, false, null, null);
    }

    public static RangeQuery fromStartQuery() {
        return new RangeQuery(UNLIMITED, true, null, null);
    }

    public static RangeQuery window(Long fromTs, Long toTs) {
        return new RangeQuery(UNLIMITED, false, fromTs, toTs);
    }

    public boolean isBounded() {
        return fromTs != null || toTs != null;
    }

    public boolean isUnlimited() {
        return count < 0;
    }
}
