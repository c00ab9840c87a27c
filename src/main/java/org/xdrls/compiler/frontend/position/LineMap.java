package org.xdrls.compiler.frontend.position;

import java.util.Arrays;

/**
 * Converts offsets in a schema file to zero-based (line, column) coordinates.
 * <p>
 * The start offset of every line is computed once: offset 0, plus one past every
 * {@code '\n'}. An offset is resolved against the greatest line start not exceeding it.
 * Offsets and columns are UTF-16 code units of the decoded text, which coincide with
 * byte offsets for 7-bit input.
 */
public final class LineMap {

    private final int[] lineStarts;
    private final int length;

    private LineMap(int[] lineStarts, int length) {
        this.lineStarts = lineStarts;
        this.length = length;
    }

    /**
     * Builds the line map of a text.
     *
     * @param text The decoded file content.
     * @return The line map.
     */
    public static LineMap of(String text) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return new LineMap(Arrays.copyOf(starts, count), text.length());
    }

    /**
     * @return The number of lines, counting a trailing empty line after a final newline.
     */
    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Finds the line containing an offset.
     *
     * @param offset An offset in {@code [0, length]}.
     * @return The zero-based line index.
     */
    public int lineOf(int offset) {
        checkOffset(offset);
        int index = Arrays.binarySearch(lineStarts, offset);
        // Not a line start: insertion point - 1 is the greatest start below the offset.
        return index >= 0 ? index : -index - 2;
    }

    /**
     * @param line A zero-based line index.
     * @return The offset at which the line starts.
     */
    public int lineStart(int line) {
        return lineStarts[line];
    }

    /**
     * Resolves an offset to a position.
     *
     * @param offset An offset in {@code [0, length]}.
     * @return The zero-based line and column.
     */
    public TextPosition position(int offset) {
        int line = lineOf(offset);
        return new TextPosition(line, offset - lineStarts[line]);
    }

    private void checkOffset(int offset) {
        if (offset < 0 || offset > length) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside [0, " + length + "]");
        }
    }
}
