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

package dev.nishisan.vinfo.schema;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * State shared by the enrichers of a single record. Lookups memoized here are not reused for the
 * next record.
 */
public final class EnrichmentPass {
    private final Map<String, Map<Object, Object>> caches = new HashMap<>();

    /**
     * Returns the cached value for {@code key} in the named cache, computing it on first use.
     *
     * @param cache  cache name
     * @param key    lookup key
     * @param loader computes the value, must not return {@code null}
     * @param <K>    key type
     * @param <V>    value type
     * @return the cached value
     */
    @SuppressWarnings("unchecked")
    public <K, V> V memoize(String cache, K key, Function<K, V> loader) {
        Map<Object, Object> values = caches.computeIfAbsent(cache, c -> new HashMap<>());
        return (V) values.computeIfAbsent(key, k -> loader.apply((K) k));
    }
}
