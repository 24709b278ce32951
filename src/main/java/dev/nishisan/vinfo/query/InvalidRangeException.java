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
 * Raised when a query's lower timestamp bound is greater than its upper bound.
 */
public class InvalidRangeException extends IllegalArgumentException {

    private final long fromTs;
    private final long toTs;

    public InvalidRangeException(long fromTs, long toTs) {
        super("Invalid range: from " + fromTs + " is after to " + toTs);
        this.fromTs = fromTs;
        this.toTs = toTs;
    }

    public long fromTs() {
        return fromTs;
    }

    public long toTs() {
        return toTs;
    }
}
