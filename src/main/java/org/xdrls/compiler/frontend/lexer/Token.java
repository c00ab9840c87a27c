package org.xdrls.compiler.frontend.lexer;

/**
 * Represents a single token extracted from a schema file by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., keyword, identifier, number).
 * @param text The exact text of the token from the source code.
 * @param start The offset of the first character of the token in the source text.
 * @param end The offset one past the last character of the token.
 * @param line The 1-based line number where the token was found.
 * @param column The 1-based column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        int start,
        int end,
        int line,
        int column
) {
}
