package org.xdrls.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The abstract syntax tree of one schema file: its definitions in source order.
 *
 * @param definitions The top-level definitions.
 */
public record Specification(List<Definition> definitions) {

    public Specification {
        definitions = List.copyOf(definitions);
    }
}
