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

package dev.nishisan.vinfo.store;

import java.io.IOException;

/**
 * Positioned iterator over a {@link RecordStore} in key order. A freshly created cursor is not
 * valid until one of the seek methods is called.
 */
public interface RecordCursor {

    /** Positions at the smallest key. */
    void seekToFirst();

    /** Positions at the greatest key. */
    void seekToLast();

    /**
     * Positions at the greatest key less than or equal to {@code key}. The cursor is invalid when
     * every stored key is greater.
     *
     * @param key the upper bound
     */
    void seekForPrev(long key);

    boolean isValid();

    /** Moves to the next greater key. */
    void next();

    /** Moves to the next smaller key. */
    void prev();

    long key();

    byte[] value() throws IOException;
}
