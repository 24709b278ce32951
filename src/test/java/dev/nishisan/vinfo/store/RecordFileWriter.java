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
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

/**
 * Writes record files in the collector's format.
 */
public final class RecordFileWriter {

    private RecordFileWriter() {
    }

    public static Path write(Path file, Map<Long, byte[]> records) throws IOException {
        try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            for (Map.Entry<Long, byte[]> record : records.entrySet()) {
                out.write(frame(record.getKey(), record.getValue()));
            }
        }
        return file;
    }

    public static void append(Path file, long key, byte[] value) throws IOException {
        Files.write(file, frame(key, value), StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    public static byte[] frame(long key, byte[] value) {
        ByteBuffer buffer = ByteBuffer.allocate(RecordFrame.LENGTH_PREFIX + RecordFrame.HEADER + value.length);
        buffer.putInt(RecordFrame.HEADER + value.length);
        buffer.putInt(RecordFrame.MAGIC);
        buffer.put(RecordFrame.VERSION);
        buffer.putLong(key);
        buffer.putInt(value.length);
        buffer.put(value);
        return buffer.array();
    }
}
