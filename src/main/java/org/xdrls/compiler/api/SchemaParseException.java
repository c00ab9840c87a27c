package org.xdrls.compiler.api;

import org.xdrls.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when a schema file cannot be scanned or parsed.
 * <p>
 * It carries every diagnostic collected while reading the file.
 */
public class SchemaParseException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new parse exception.
     * @param message The detail message.
     * @param diagnostics The diagnostics that caused the failure.
     */
    public SchemaParseException(String message, List<Diagnostic> diagnostics) {
        super(message, null);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics that caused the failure.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
