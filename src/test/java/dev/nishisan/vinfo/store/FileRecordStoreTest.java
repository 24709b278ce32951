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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileRecordStoreTest {

    @TempDir
    Path tempDir;

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private Path threeRecords() throws IOException {
        TreeMap<Long, byte[]> records = new TreeMap<>();
        records.put(100L, utf8("{\"n\":1}"));
        records.put(200L, utf8("{\"n\":2}"));
        records.put(300L, utf8("{\"n\":3}"));
        return RecordFileWriter.write(tempDir.resolve("Node1_info_db"), records);
    }

    private static List<Long> keysForward(RecordCursor cursor) {
        List<Long> keys = new ArrayList<>();
        for (; cursor.isValid(); cursor.next()) {
            keys.add(cursor.key());
        }
        return keys;
    }

    @Test
    void iteratesInKeyOrderBothWays() throws IOException {
        try (FileRecordStore store = FileRecordStore.open("Node1", threeRecords())) {
            assertEquals(3, store.size());
            RecordCursor cursor = store.newCursor();
            cursor.seekToFirst();
            assertEquals(List.of(100L, 200L, 300L), keysForward(cursor));

            cursor.seekToLast();
            assertEquals(300L, cursor.key());
            assertArrayEquals(utf8("{\"n\":3}"), cursor.value());
            cursor.prev();
            assertEquals(200L, cursor.key());
            cursor.prev();
            cursor.prev();
            assertFalse(cursor.isValid());
        }
    }

    @Test
    void seekForPrevFindsTheFloorKey() throws IOException {
        try (FileRecordStore store = FileRecordStore.open("Node1", threeRecords())) {
            RecordCursor cursor = store.newCursor();

            cursor.seekForPrev(250L);
            assertEquals(200L, cursor.key());
            cursor.seekForPrev(300L);
            assertEquals(300L, cursor.key());
            cursor.seekForPrev(99L);
            assertFalse(cursor.isValid());
        }
    }

    @Test
    void unpositionedCursorRejectsAccess() throws IOException {
        try (FileRecordStore store = FileRecordStore.open("Node1", threeRecords())) {
            RecordCursor cursor = store.newCursor();
            assertFalse(cursor.isValid());
            assertThrows(IllegalStateException.class, cursor::key);
            assertThrows(IllegalStateException.class, cursor::next);
        }
    }

    @Test
    void laterFrameWithSameKeyWins() throws IOException {
        Path file = threeRecords();
        RecordFileWriter.append(file, 200L, utf8("{\"n\":22}"));

        try (FileRecordStore store = FileRecordStore.open("Node1", file)) {
            assertEquals(3, store.size());
            RecordCursor cursor = store.newCursor();
            cursor.seekForPrev(200L);
            assertArrayEquals(utf8("{\"n\":22}"), cursor.value());
        }
    }

    @Test
    void tornTailIsIgnoredAndFileLeftUntouched() throws IOException {
        Path file = threeRecords();
        byte[] frame = RecordFileWriter.frame(400L, utf8("{\"n\":4}"));
        Files.write(file, Arrays.copyOf(frame, frame.length - 3), StandardOpenOption.APPEND);
        long sizeBefore = Files.size(file);

        try (FileRecordStore store = FileRecordStore.open("Node1", file)) {
            assertEquals(3, store.size());
            RecordCursor cursor = store.newCursor();
            cursor.seekToLast();
            assertEquals(300L, cursor.key());
        }
        assertEquals(sizeBefore, Files.size(file));
    }

    @Test
    void garbageAfterValidFramesStopsTheScan() throws IOException {
        Path file = threeRecords();
        Files.write(file, utf8("not a frame at all, just text"), StandardOpenOption.APPEND);

        try (FileRecordStore store = FileRecordStore.open("Node1", file)) {
            assertEquals(3, store.size());
        }
    }

    @Test
    void emptyFileIsAnEmptyStore() throws IOException {
        Path file = Files.createFile(tempDir.resolve("Empty_info_db"));

        try (FileRecordStore store = FileRecordStore.open("Empty", file)) {
            assertEquals(0, store.size());
            RecordCursor cursor = store.newCursor();
            cursor.seekToLast();
            assertFalse(cursor.isValid());
        }
    }

    @Test
    void missingFileFailsToOpen() {
        assertThrows(IOException.class, () -> FileRecordStore.open("Ghost", tempDir.resolve("Ghost_info_db")));
    }

    @Test
    void inMemoryStoreBehavesTheSame() throws IOException {
        TreeMap<Long, byte[]> records = new TreeMap<>();
        records.put(5L, utf8("a"));
        records.put(1L, utf8("b"));
        try (InMemoryRecordStore store = new InMemoryRecordStore("mem", records)) {
            RecordCursor cursor = store.newCursor();
            cursor.seekToFirst();
            assertEquals(List.of(1L, 5L), keysForward(cursor));
            cursor.seekForPrev(4L);
            byte[] value = cursor.value();
            value[0] = 'z';
            assertTrue(Arrays.equals(utf8("b"), cursor.value()));
        }
    }
}
