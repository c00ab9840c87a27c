package org.xdrls.index;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A range in a schema file, as returned by definition and reference queries.
 * Lines and columns are zero-based; the end column is exclusive.
 *
 * @param file The normalized absolute path of the file.
 * @param startLine The line of the first character.
 * @param startColumn The column of the first character.
 * @param endLine The line of the end position.
 * @param endColumn The column one past the last character.
 */
public record SourceLocation(Path file, int startLine, int startColumn, int endLine, int endColumn) {

    public SourceLocation {
        Objects.requireNonNull(file, "file");
    }

    @Override
    public String toString() {
        return String.format("%s:%d:%d-%d", file, startLine, startColumn, endColumn);
    }
}
