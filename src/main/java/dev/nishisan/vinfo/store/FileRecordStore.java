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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Read-only {@link RecordStore} over the collector's append-only record file.
 * <p>
 * The file is scanned once on open to build a sorted index of value locations; values are read
 * on demand. A later frame with the same key replaces an earlier one. A torn or unreadable tail
 * ends the scan with a warning and the records before it stay available. The file is never
 * written.
 *
 * @see RecordFrame
 */
public final class FileRecordStore implements RecordStore {
    private static final Logger LOGGER = Logger.getLogger(FileRecordStore.class.getName());

    private final String name;
    private final Path path;
    private final FileChannel channel;
    private final NavigableMap<Long, Location> index;

    private FileRecordStore(String name, Path path, FileChannel channel, NavigableMap<Long, Location> index) {
        this.name = name;
        this.path = path;
        this.channel = channel;
        this.index = Collections.unmodifiableNavigableMap(index);
    }

    /**
     * Opens a record file and indexes it.
     *
     * @param name the store name
     * @param path the record file
     * @return the opened store
     * @throws IOException if the file cannot be opened or read
     */
    public static FileRecordStore open(String name, Path path) throws IOException {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            return new FileRecordStore(name, path, channel, buildIndex(channel, path));
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }

    @Override
    public String name() {
        return name;
    }

    public Path path() {
        return path;
    }

    @Override
    public int size() {
        return index.size();
    }

    @Override
    public RecordCursor newCursor() {
        return new NavigableRecordCursor<Location>(index) {
            @Override
            protected byte[] load(Location location) throws IOException {
                byte[] value = new byte[location.length()];
                int read = readFully(channel, ByteBuffer.wrap(value), location.offset());
                if (read < location.length()) {
                    throw new IOException("Short read of record at offset " + location.offset() + " in " + path);
                }
                return value;
            }
        };
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    private static NavigableMap<Long, Location> buildIndex(FileChannel channel, Path path) throws IOException {
        NavigableMap<Long, Location> index = new TreeMap<>();
        long size = channel.size();
        long offset = 0L;
        ByteBuffer lenBuf = ByteBuffer.allocate(RecordFrame.LENGTH_PREFIX);
        ByteBuffer header = ByteBuffer.allocate(RecordFrame.HEADER);
        while (offset < size) {
            lenBuf.clear();
            if (readFully(channel, lenBuf, offset) < RecordFrame.LENGTH_PREFIX) {
                warnTail(path, offset, "truncated length prefix");
                break;
            }
            lenBuf.flip();
            int frameLen = lenBuf.getInt();
            long bodyStart = offset + RecordFrame.LENGTH_PREFIX;
            if (frameLen < RecordFrame.HEADER || frameLen > RecordFrame.MAX_FRAME || bodyStart + frameLen > size) {
                warnTail(path, offset, "invalid frame length " + frameLen);
                break;
            }
            header.clear();
            if (readFully(channel, header, bodyStart) < RecordFrame.HEADER) {
                warnTail(path, offset, "truncated header");
                break;
            }
            header.flip();
            int magic = header.getInt();
            byte version = header.get();
            long key = header.getLong();
            int valueLen = header.getInt();
            if (magic != RecordFrame.MAGIC || version != RecordFrame.VERSION) {
                warnTail(path, offset, "unsupported frame format");
                break;
            }
            if (valueLen < 0 || valueLen != frameLen - RecordFrame.HEADER) {
                warnTail(path, offset, "value length " + valueLen + " does not match frame");
                break;
            }
            index.put(key, new Location(bodyStart + RecordFrame.HEADER, valueLen));
            offset = bodyStart + frameLen;
        }
        return index;
    }

    private static void warnTail(Path path, long offset, String reason) {
        LOGGER.warning(() -> "Ignoring tail of " + path + " from offset " + offset + ": " + reason);
    }

    private static int readFully(FileChannel channel, ByteBuffer buffer, long offset) throws IOException {
        int total = 0;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, offset + total);
            if (read <= 0) {
                break;
            }
            total += read;
        }
        return total;
    }

    private record Location(long offset, int length) {
    }
}
