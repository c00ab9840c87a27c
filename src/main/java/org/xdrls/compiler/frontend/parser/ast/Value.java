package org.xdrls.compiler.frontend.parser.ast;

/**
 * A value used as an enum member assignment, an array or string bound, or a union case guard.
 */
public sealed interface Value permits Value.Constant, Value.Reference {

    /**
     * A literal numeric constant, kept as its source text.
     * @param text The literal text, e.g. {@code 10}, {@code 0x1F} or {@code -3}.
     */
    record Constant(String text) implements Value {}

    /**
     * A use of a named constant or enum member.
     * @param identifier The referenced name.
     */
    record Reference(Identifier identifier) implements Value {}
}
