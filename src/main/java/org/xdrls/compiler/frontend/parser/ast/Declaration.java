package org.xdrls.compiler.frontend.parser.ast;

import java.util.Objects;

/**
 * Describes a struct member, a union arm, a union discriminant or the aliased
 * type of a {@code typedef}. Bounds that are omitted in the source
 * ({@code <>}) are represented by {@code null}.
 */
public sealed interface Declaration permits Declaration.Plain, Declaration.FixedArray,
        Declaration.VariableArray, Declaration.FixedOpaque, Declaration.VariableOpaque,
        Declaration.StringDecl, Declaration.OptionalDecl, Declaration.VoidDecl {

    /**
     * {@code type name}
     * @param type The declared type.
     * @param identifier The declared name.
     */
    record Plain(TypeSpecifier type, Identifier identifier) implements Declaration {
        public Plain {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(identifier, "identifier");
        }
    }

    /**
     * {@code type name[size]}
     * @param type The element type.
     * @param identifier The declared name.
     * @param size The fixed element count.
     */
    record FixedArray(TypeSpecifier type, Identifier identifier, Value size) implements Declaration {
        public FixedArray {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(identifier, "identifier");
            Objects.requireNonNull(size, "size");
        }
    }

    /**
     * {@code type name<maxSize>}
     * @param type The element type.
     * @param identifier The declared name.
     * @param maxSize The upper bound, or null when unbounded.
     */
    record VariableArray(TypeSpecifier type, Identifier identifier, Value maxSize) implements Declaration {
        public VariableArray {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(identifier, "identifier");
        }
    }

    /**
     * {@code opaque name[size]}
     * @param identifier The declared name.
     * @param size The fixed byte count.
     */
    record FixedOpaque(Identifier identifier, Value size) implements Declaration {
        public FixedOpaque {
            Objects.requireNonNull(identifier, "identifier");
            Objects.requireNonNull(size, "size");
        }
    }

    /**
     * {@code opaque name<maxSize>}
     * @param identifier The declared name.
     * @param maxSize The upper bound, or null when unbounded.
     */
    record VariableOpaque(Identifier identifier, Value maxSize) implements Declaration {
        public VariableOpaque {
            Objects.requireNonNull(identifier, "identifier");
        }
    }

    /**
     * {@code string name<maxSize>}
     * @param identifier The declared name.
     * @param maxSize The upper bound, or null when unbounded.
     */
    record StringDecl(Identifier identifier, Value maxSize) implements Declaration {
        public StringDecl {
            Objects.requireNonNull(identifier, "identifier");
        }
    }

    /**
     * {@code type *name}
     * @param type The pointed-to type.
     * @param identifier The declared name.
     */
    record OptionalDecl(TypeSpecifier type, Identifier identifier) implements Declaration {
        public OptionalDecl {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(identifier, "identifier");
        }
    }

    /**
     * {@code void}: no name, no type.
     */
    record VoidDecl() implements Declaration {}
}
