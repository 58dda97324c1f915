/*
 * Vimdoc-HTML - Vimdoc Help File Conversion
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.vimdoc.syntax;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The source buffer a syntax tree was parsed from. Node positions are byte offsets into the UTF-8
 * encoding of the source, so the buffer is kept as bytes and decoded on demand.
 */
public final class SourceText {
    private final byte[] bytes;
    private int[] lineStarts;

    private SourceText(byte[] bytes) {
        this.bytes = bytes;
    }

    public static SourceText of(String text) {
        return new SourceText(text.getBytes(StandardCharsets.UTF_8));
    }

    /** Wraps raw bytes that may or may not be valid UTF-8. */
    public static SourceText ofBytes(byte[] bytes) {
        return new SourceText(Arrays.copyOf(bytes, bytes.length));
    }

    public int length() {
        return bytes.length;
    }

    /**
     * Decodes the byte range {@code [start, end)} strictly.
     *
     * @throws CharacterCodingException if the range is not valid UTF-8
     */
    public String utf8Text(int start, int end) throws CharacterCodingException {
        checkRange(start, end);
        return strictDecoder().decode(ByteBuffer.wrap(bytes, start, end - start)).toString();
    }

    /** Decodes the byte range {@code [start, end)}, replacing malformed input. */
    public String lenientText(int start, int end) {
        checkRange(start, end);
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    /** Returns the byte offset of a row/column position. */
    public int offsetOf(Point point) {
        int[] starts = lineStarts();
        if (point.row() < 0 || point.row() >= starts.length) {
            throw new IllegalArgumentException(
                    "Row " + point.row() + " is outside the source (" + starts.length + " rows)");
        }
        int offset = starts[point.row()] + point.column();
        if (point.column() < 0 || offset > bytes.length) {
            throw new IllegalArgumentException("Column out of range at " + point);
        }
        return offset;
    }

    /** Returns the row/column position of a byte offset. */
    public Point pointAt(int offset) {
        if (offset < 0 || offset > bytes.length) {
            throw new IllegalArgumentException("Offset " + offset + " is outside the source");
        }
        int[] starts = lineStarts();
        int row = Arrays.binarySearch(starts, offset);
        if (row < 0) {
            row = -row - 2;
        }
        return new Point(row, offset - starts[row]);
    }

    @Override
    public String toString() {
        return lenientText(0, bytes.length);
    }

    private int[] lineStarts() {
        if (lineStarts == null) {
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < bytes.length; i++) {
                if (bytes[i] == '\n') {
                    starts.add(i + 1);
                }
            }
            lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        }
        return lineStarts;
    }

    private void checkRange(int start, int end) {
        if (start < 0 || end > bytes.length || start > end) {
            throw new IndexOutOfBoundsException(
                    "Range ["
                            + start
                            + ", "
                            + end
                            + ") outside source of "
                            + bytes.length
                            + " bytes");
        }
    }

    private static CharsetDecoder strictDecoder() {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder();
        decoder.onMalformedInput(CodingErrorAction.REPORT);
        decoder.onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder;
    }
}
