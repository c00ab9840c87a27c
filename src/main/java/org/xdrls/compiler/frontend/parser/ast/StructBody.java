package org.xdrls.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The members of a struct, in source order.
 *
 * @param members The member declarations.
 */
public record StructBody(List<Declaration> members) {

    public StructBody {
        members = List.copyOf(members);
    }
}
