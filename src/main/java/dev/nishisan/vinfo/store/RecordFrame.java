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

/**
 * On-disk framing of a record written by the collector.
 * <pre>
 * [ LEN(4) ][ MAGIC(4) ][ VERSION(1) ][ KEY(8) ][ VALUE_LEN(4) ][ VALUE(VALUE_LEN) ]
 * </pre>
 * {@code LEN} counts the bytes after itself. All integers are big-endian, so keys compare the
 * same way as their encoding.
 */
public final class RecordFrame {

    public static final int MAGIC = 0x56_48_53_54; // 'VHST'
    public static final byte VERSION = 0x01;

    /** Bytes of the length prefix. */
    public static final int LENGTH_PREFIX = 4;
    /** Bytes between the length prefix and the value. */
    public static final int HEADER = 4 + 1 + 8 + 4;
    /** Upper bound on a single frame, guarding against reading a corrupt length. */
    public static final int MAX_FRAME = 64 * 1024 * 1024;

    private RecordFrame() {
    }
}
