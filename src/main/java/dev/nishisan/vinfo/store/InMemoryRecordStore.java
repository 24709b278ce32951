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

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@link RecordStore} over an in-memory snapshot of records.
 */
public final class InMemoryRecordStore implements RecordStore {
    private final String name;
    private final NavigableMap<Long, byte[]> records;

    /**
     * @param name    store name
     * @param records records by timestamp; copied
     */
    public InMemoryRecordStore(String name, Map<Long, byte[]> records) {
        this.name = Objects.requireNonNull(name, "name");
        this.records = Collections.unmodifiableNavigableMap(new TreeMap<>(records));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int size() {
        return records.size();
    }

    @Override
    public RecordCursor newCursor() {
        return new NavigableRecordCursor<byte[]>(records) {
            @Override
            protected byte[] load(byte[] value) {
                return value.clone();
            }
        };
    }

    @Override
    public void close() {
    }
}
