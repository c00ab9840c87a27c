package org.xdrls.compiler.frontend.lexer;

import org.xdrls.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts the text of a schema
 * file into a sequence of tokens.
 * <p>
 * Offsets are counted in {@code char}s of the decoded text. C-style block and
 * line comments and rpcgen pass-through lines (starting with {@code %}) produce
 * no tokens.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int tokenLine = 1;
    private int tokenColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            tokenLine = line;
            tokenColumn = current - lineStart + 1;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", current, current, line, current - lineStart + 1));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case '<': addToken(TokenType.LESS); break;
            case '>': addToken(TokenType.GREATER); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '=': addToken(TokenType.EQUAL); break;
            case '*': addToken(TokenType.STAR); break;
            case '/':
                if (match('/')) {
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
            case '%':
                if (onlyBlanksBefore(start)) {
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
            case '-':
                if (isDigit(peek())) {
                    number();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
            // Ignore whitespace
            case ' ', '\r', '\t', '\f':
                break;
            case '\n':
                newLine();
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(TokenType.keyword(text).orElse(TokenType.IDENTIFIER));
    }

    private void number() {
        if (previous() == '0' && (peek() == 'x' || peek() == 'X')) {
            advance(); // consume 'x'
            if (!isHexDigit(peek())) {
                error("Invalid number format: " + source.substring(start, current));
                return;
            }
            while (isHexDigit(peek())) advance();
        } else {
            while (isDigit(peek())) advance();
        }
        if (isAlpha(peek())) {
            while (isAlphaNumeric(peek())) advance();
            error("Invalid number format: " + source.substring(start, current));
            return;
        }
        addToken(TokenType.NUMBER);
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (advance() == '\n') {
                newLine();
            }
        }
        error("Unterminated comment.");
    }

    private boolean onlyBlanksBefore(int offset) {
        for (int i = offset - 1; i >= lineStart; i--) {
            char c = source.charAt(i);
            if (c != ' ' && c != '\t') return false;
        }
        return true;
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), start, current, tokenLine, tokenColumn));
    }

    private void error(String message) {
        diagnostics.reportError(message, logicalFileName, tokenLine, tokenColumn);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
