package org.xdrls.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostic messages raised by the lexer and parser.
 * <p>
 * This decouples error reporting from the scanning and parsing logic: both phases keep
 * going after a problem and the caller decides afterwards whether the result is usable.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message      The error message.
     * @param fileName     The file in which the error occurred.
     * @param lineNumber   The line number of the error.
     * @param columnNumber The column number of the error.
     */
    public void reportError(String message, String fileName, int lineNumber, int columnNumber) {
        diagnostics.add(new Diagnostic(message, fileName, lineNumber, columnNumber));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
