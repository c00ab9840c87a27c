package org.xdrls.compiler.frontend.lexer;

import java.util.Map;
import java.util.Optional;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    LEFT_BRACE, RIGHT_BRACE,
    LEFT_PAREN, RIGHT_PAREN,
    LEFT_BRACKET, RIGHT_BRACKET,
    LESS, GREATER,
    SEMICOLON, COMMA, COLON, EQUAL, STAR,

    // Literals.
    /** A type, constant, member or field name. */
    IDENTIFIER,
    /** A decimal, hexadecimal or octal constant, optionally negative. */
    NUMBER,

    // Keywords.
    CONST, TYPEDEF, ENUM, STRUCT, UNION, SWITCH, CASE, DEFAULT, VOID,
    OPAQUE, STRING, UNSIGNED, INT, HYPER, FLOAT, DOUBLE, QUADRUPLE, BOOL,

    /** Represents the end of the source file. */
    END_OF_FILE;

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("const", CONST),
            Map.entry("typedef", TYPEDEF),
            Map.entry("enum", ENUM),
            Map.entry("struct", STRUCT),
            Map.entry("union", UNION),
            Map.entry("switch", SWITCH),
            Map.entry("case", CASE),
            Map.entry("default", DEFAULT),
            Map.entry("void", VOID),
            Map.entry("opaque", OPAQUE),
            Map.entry("string", STRING),
            Map.entry("unsigned", UNSIGNED),
            Map.entry("int", INT),
            Map.entry("hyper", HYPER),
            Map.entry("float", FLOAT),
            Map.entry("double", DOUBLE),
            Map.entry("quadruple", QUADRUPLE),
            Map.entry("bool", BOOL)
    );

    /**
     * Looks up the keyword token type for a word. Keywords are case-sensitive.
     *
     * @param word The scanned word.
     * @return The keyword type, or empty if the word is an ordinary identifier.
     */
    public static Optional<TokenType> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word));
    }
}
