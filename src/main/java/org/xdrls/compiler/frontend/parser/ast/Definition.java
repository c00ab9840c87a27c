package org.xdrls.compiler.frontend.parser.ast;

import java.util.Objects;

/**
 * A top-level item of a schema file.
 */
public sealed interface Definition permits Definition.Constant, Definition.TypeDef,
        Definition.EnumDef, Definition.StructDef, Definition.UnionDef {

    /**
     * {@code const NAME = value;}
     * @param identifier The constant name.
     * @param value The literal text of the constant.
     */
    record Constant(Identifier identifier, String value) implements Definition {
        public Constant {
            Objects.requireNonNull(identifier, "identifier");
        }
    }

    /**
     * {@code typedef declaration;}. The name declared by the wrapped declaration is the alias.
     * @param declaration The aliased declaration.
     */
    record TypeDef(Declaration declaration) implements Definition {
        public TypeDef {
            Objects.requireNonNull(declaration, "declaration");
        }
    }

    /**
     * {@code enum NAME { ... };}
     * @param identifier The enum name.
     * @param body The members.
     */
    record EnumDef(Identifier identifier, EnumBody body) implements Definition {}

    /**
     * {@code struct NAME { ... };}
     * @param identifier The struct name.
     * @param body The members.
     */
    record StructDef(Identifier identifier, StructBody body) implements Definition {}

    /**
     * {@code union NAME switch (...) { ... };}
     * @param identifier The union name.
     * @param body The discriminant and arms.
     */
    record UnionDef(Identifier identifier, UnionBody body) implements Definition {}
}
