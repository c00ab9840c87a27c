package org.xdrls.compiler.frontend.occurrence;

import org.xdrls.compiler.frontend.parser.ast.Identifier;

/**
 * A single appearance of an identifier in a schema file, classified as the site that
 * introduces the name or as a use of it.
 *
 * @param identifier The identifier and its source span.
 * @param isDefinition Whether this occurrence introduces the name into the global namespace.
 */
public record Occurrence(Identifier identifier, boolean isDefinition) {

    /**
     * @return The identifier text.
     */
    public String name() {
        return identifier.name();
    }
}
