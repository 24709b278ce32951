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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.nishisan.vinfo.JsonSupport;
import dev.nishisan.vinfo.store.RecordCursor;
import dev.nishisan.vinfo.store.RecordStore;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Resolves a {@link RangeQuery} against a {@link RecordStore} into decoded records in ascending
 * timestamp order.
 * <p>
 * Every decoded record gets an {@value #UPDATE_TIME_FIELD} field combining the local date-time of
 * its key with the key itself. A record that is not a JSON object aborts the query with a
 * {@link RecordDecodeException}; no partial result is returned for that store.
 */
public final class RangeQueryEngine {
    private static final Logger LOGGER = Logger.getLogger(RangeQueryEngine.class.getName());

    public static final String UPDATE_TIME_FIELD = "Update_time";

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ZoneId zone;

    public RangeQueryEngine(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    /**
     * Runs a query.
     *
     * @param store the store to read
     * @param query the selection
     * @return matching records, oldest first
     * @throws RecordDecodeException if a selected record is not valid JSON
     * @throws IOException           if the store cannot be read
     */
    public List<StoredRecord> query(RecordStore store, RangeQuery query) throws IOException {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(query, "query");
        RecordCursor cursor = store.newCursor();
        List<StoredRecord> records;
        if (query.isBounded()) {
            records = window(store, cursor, query.fromTs(), query.toTs());
        } else if (query.fromStart()) {
            records = window(store, cursor, null, null);
        } else {
            records = tail(store, cursor, query);
        }
        LOGGER.fine(() -> "Selected " + records.size() + " of " + store.size() + " records from " + store.name());
        return records;
    }

    /**
     * Formats a store key the way it is injected into records.
     *
     * @param timestamp epoch seconds
     * @return the human-readable update time
     */
    public String formatTimestamp(long timestamp) {
        return DATE_TIME.format(Instant.ofEpochSecond(timestamp).atZone(zone)) + " (" + timestamp + ")";
    }

    private List<StoredRecord> window(RecordStore store, RecordCursor cursor, Long fromTs, Long toTs)
            throws IOException {
        if (fromTs != null) {
            cursor.seekForPrev(fromTs);
            if (!cursor.isValid()) {
                cursor.seekToFirst();
            }
        } else {
            cursor.seekToFirst();
        }
        List<StoredRecord> records = new ArrayList<>();
        for (; cursor.isValid(); cursor.next()) {
            long key = cursor.key();
            if (toTs != null && key > toTs) {
                break;
            }
            if (fromTs != null && key < fromTs) {
                continue;
            }
            records.add(decode(store, key, cursor.value()));
        }
        return records;
    }

    private List<StoredRecord> tail(RecordStore store, RecordCursor cursor, RangeQuery query) throws IOException {
        List<StoredRecord> records = new ArrayList<>();
        cursor.seekToLast();
        while (cursor.isValid() && (query.isUnlimited() || records.size() < query.count())) {
            records.add(decode(store, cursor.key(), cursor.value()));
            cursor.prev();
        }
        Collections.reverse(records);
        return records;
    }

    private StoredRecord decode(RecordStore store, long key, byte[] value) throws RecordDecodeException {
        JsonNode node;
        try {
            node = JsonSupport.MAPPER.readTree(value);
        } catch (JsonProcessingException e) {
            throw new RecordDecodeException(store.name(), key, e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RecordDecodeException(store.name(), key, e.getMessage(), e);
        }
        if (node == null || !node.isObject()) {
            String type = node == null ? "empty document" : node.getNodeType().toString();
            throw new RecordDecodeException(store.name(), key, "expected a JSON object but got " + type, null);
        }
        ObjectNode json = (ObjectNode) node;
        json.put(UPDATE_TIME_FIELD, formatTimestamp(key));
        return new StoredRecord(key, json);
    }
}
