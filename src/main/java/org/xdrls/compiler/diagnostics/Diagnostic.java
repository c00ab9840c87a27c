package org.xdrls.compiler.diagnostics;

/**
 * Represents a single error produced while scanning or parsing a schema file.
 *
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The 1-based line number of the issue.
 * @param columnNumber The 1-based column number of the issue.
 */
public record Diagnostic(
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    @Override
    public String toString() {
        return String.format("[ERROR] %s:%d:%d: %s", fileName, lineNumber, columnNumber, message);
    }
}
