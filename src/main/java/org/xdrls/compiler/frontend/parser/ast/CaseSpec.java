package org.xdrls.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * One arm of a union: one or more {@code case} guards sharing a declaration.
 *
 * @param values The guard values, in source order.
 * @param declaration The arm declaration.
 */
public record CaseSpec(List<Value> values, Declaration declaration) {

    public CaseSpec {
        values = List.copyOf(values);
        Objects.requireNonNull(declaration, "declaration");
    }
}
