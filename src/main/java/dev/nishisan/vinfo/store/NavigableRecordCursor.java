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
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;

/**
 * {@link RecordCursor} over a sorted key index. Subclasses load the value a key points to.
 *
 * @param <V> the index entry type
 */
abstract class NavigableRecordCursor<V> implements RecordCursor {
    private final NavigableMap<Long, V> index;
    private Map.Entry<Long, V> current;

    NavigableRecordCursor(NavigableMap<Long, V> index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    @Override
    public void seekToFirst() {
        current = index.firstEntry();
    }

    @Override
    public void seekToLast() {
        current = index.lastEntry();
    }

    @Override
    public void seekForPrev(long key) {
        current = index.floorEntry(key);
    }

    @Override
    public boolean isValid() {
        return current != null;
    }

    @Override
    public void next() {
        current = index.higherEntry(position().getKey());
    }

    @Override
    public void prev() {
        current = index.lowerEntry(position().getKey());
    }

    @Override
    public long key() {
        return position().getKey();
    }

    @Override
    public byte[] value() throws IOException {
        return load(position().getValue());
    }

    protected abstract byte[] load(V entry) throws IOException;

    private Map.Entry<Long, V> position() {
        if (current == null) {
            throw new IllegalStateException("Cursor is not positioned on a record");
        }
        return current;
    }
}
