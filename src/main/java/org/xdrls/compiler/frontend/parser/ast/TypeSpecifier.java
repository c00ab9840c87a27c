package org.xdrls.compiler.frontend.parser.ast;

/**
 * The type part of a declaration: a built-in type, an inline body, or the name of a declared type.
 */
public sealed interface TypeSpecifier permits TypeSpecifier.BuiltIn, TypeSpecifier.InlineEnum,
        TypeSpecifier.InlineStruct, TypeSpecifier.InlineUnion, TypeSpecifier.Named {

    /**
     * A primitive type such as {@code int}, {@code unsigned hyper} or {@code bool}.
     * @param name The normalized type name.
     */
    record BuiltIn(String name) implements TypeSpecifier {}

    /**
     * An anonymous {@code enum { ... }} used directly as a type.
     * @param body The enum members.
     */
    record InlineEnum(EnumBody body) implements TypeSpecifier {}

    /**
     * An anonymous {@code struct { ... }} used directly as a type.
     * @param body The struct members.
     */
    record InlineStruct(StructBody body) implements TypeSpecifier {}

    /**
     * An anonymous {@code union switch (...) { ... }} used directly as a type.
     * @param body The union arms.
     */
    record InlineUnion(UnionBody body) implements TypeSpecifier {}

    /**
     * A reference to a type declared elsewhere by name.
     * @param identifier The referenced type name.
     */
    record Named(Identifier identifier) implements TypeSpecifier {}
}
