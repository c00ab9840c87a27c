package org.xdrls.index;

/**
 * An identifier occurrence on one line, used to find the name under a cursor.
 *
 * @param startColumn The column of the first character.
 * @param endColumn The column one past the last character.
 * @param name The identifier text.
 */
public record LineToken(int startColumn, int endColumn, String name) {

    /**
     * Checks whether a cursor column touches this token. Both ends are inclusive, so a
     * cursor placed right after the last character still selects the identifier.
     *
     * @param column The cursor column.
     * @return true if {@code startColumn <= column <= endColumn}.
     */
    public boolean touches(int column) {
        return startColumn <= column && column <= endColumn;
    }
}
