package org.xdrls.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The body of a discriminated union. Arms may themselves declare inline struct or
 * union types, so bodies nest to arbitrary depth; each body owns its children.
 *
 * @param discriminant The {@code switch} declaration.
 * @param cases The {@code case} arms, in source order.
 * @param defaultDeclaration The {@code default} arm, or null if the union has none.
 */
public record UnionBody(Declaration discriminant, List<CaseSpec> cases, Declaration defaultDeclaration) {

    public UnionBody {
        Objects.requireNonNull(discriminant, "discriminant");
        cases = List.copyOf(cases);
    }

    /**
     * @return The {@code default} arm, if present.
     */
    public Optional<Declaration> defaultArm() {
        return Optional.ofNullable(defaultDeclaration);
    }
}
