package org.xdrls.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The members of an enum, in source order.
 *
 * @param members The member assignments.
 */
public record EnumBody(List<EnumAssign> members) {

    public EnumBody {
        members = List.copyOf(members);
    }
}
