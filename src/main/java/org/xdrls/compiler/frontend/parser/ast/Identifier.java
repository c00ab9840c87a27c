package org.xdrls.compiler.frontend.parser.ast;

import java.util.Objects;

/**
 * A name as it appears in a schema file, together with its half-open
 * {@code [start, end)} offset range in the decoded source text.
 *
 * @param name The identifier text.
 * @param start Offset of the first character.
 * @param end Offset one past the last character.
 */
public record Identifier(String name, int start, int end) {

    public Identifier {
        Objects.requireNonNull(name, "name");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ") for '" + name + "'");
        }
    }
}
