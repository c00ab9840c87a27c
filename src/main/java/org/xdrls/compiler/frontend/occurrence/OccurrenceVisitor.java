package org.xdrls.compiler.frontend.occurrence;

import org.xdrls.compiler.frontend.parser.ast.CaseSpec;
import org.xdrls.compiler.frontend.parser.ast.Declaration;
import org.xdrls.compiler.frontend.parser.ast.Definition;
import org.xdrls.compiler.frontend.parser.ast.EnumAssign;
import org.xdrls.compiler.frontend.parser.ast.EnumBody;
import org.xdrls.compiler.frontend.parser.ast.Identifier;
import org.xdrls.compiler.frontend.parser.ast.Specification;
import org.xdrls.compiler.frontend.parser.ast.StructBody;
import org.xdrls.compiler.frontend.parser.ast.TypeSpecifier;
import org.xdrls.compiler.frontend.parser.ast.UnionBody;
import org.xdrls.compiler.frontend.parser.ast.Value;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * Walks a {@link Specification} depth-first and yields every identifier it contains, in
 * source order, classified as a definition site or a reference site.
 * <p>
 * An occurrence is a definition only if it is
 * <ul>
 *   <li>the name of a constant,</li>
 *   <li>the name of a top-level enum, struct or union,</li>
 *   <li>the name declared by a top-level {@code typedef},</li>
 *   <li>an enum member name, wherever the enum body appears.</li>
 * </ul>
 * Everything else is a reference: type names used in declarations, names used as values,
 * and struct and union member names. Member names are not scoped to their container, so
 * two unrelated fields called {@code x} end up in the same reference bucket.
 * <p>
 * The returned sequences are lazy and can be iterated any number of times; each
 * iteration re-walks the tree.
 */
public final class OccurrenceVisitor {

    private OccurrenceVisitor() {}

    /**
     * Returns the occurrences of a specification as a restartable sequence.
     *
     * @param specification The parsed file.
     * @return An iterable whose every iterator walks the tree afresh.
     */
    public static Iterable<Occurrence> occurrences(Specification specification) {
        Objects.requireNonNull(specification, "specification");
        return () -> stream(specification).iterator();
    }

    /**
     * Returns the occurrences of a specification as a single-use stream.
     *
     * @param specification The parsed file.
     * @return A lazy stream of occurrences in source order.
     */
    public static Stream<Occurrence> stream(Specification specification) {
        return specification.definitions().stream().flatMap(OccurrenceVisitor::visitDefinition);
    }

    private static Stream<Occurrence> visitDefinition(Definition definition) {
        if (definition instanceof Definition.Constant constant) {
            return Stream.of(definition(constant.identifier()));
        } else if (definition instanceof Definition.TypeDef typeDef) {
            return visitDeclaration(typeDef.declaration(), true);
        } else if (definition instanceof Definition.EnumDef enumDef) {
            return Stream.concat(Stream.of(definition(enumDef.identifier())), visitEnum(enumDef.body()));
        } else if (definition instanceof Definition.StructDef structDef) {
            return Stream.concat(Stream.of(definition(structDef.identifier())), visitStruct(structDef.body()));
        } else if (definition instanceof Definition.UnionDef unionDef) {
            return Stream.concat(Stream.of(definition(unionDef.identifier())), visitUnion(unionDef.body()));
        }
        throw new IllegalStateException("Unknown definition: " + definition);
    }

    /**
     * @param declaresGlobalName true for the declaration wrapped by a top-level typedef,
     *                           whose name is a definition; false for members.
     */
    private static Stream<Occurrence> visitDeclaration(Declaration declaration, boolean declaresGlobalName) {
        if (declaration instanceof Declaration.Plain plain) {
            return Stream.concat(visitType(plain.type()), Stream.of(named(plain.identifier(), declaresGlobalName)));
        } else if (declaration instanceof Declaration.OptionalDecl optional) {
            return Stream.concat(visitType(optional.type()), Stream.of(named(optional.identifier(), declaresGlobalName)));
        } else if (declaration instanceof Declaration.FixedArray array) {
            return Stream.of(visitType(array.type()),
                            Stream.of(named(array.identifier(), declaresGlobalName)),
                            visitValue(array.size()))
                    .flatMap(s -> s);
        } else if (declaration instanceof Declaration.VariableArray array) {
            return Stream.of(visitType(array.type()),
                            Stream.of(named(array.identifier(), declaresGlobalName)),
                            visitValue(array.maxSize()))
                    .flatMap(s -> s);
        } else if (declaration instanceof Declaration.FixedOpaque opaque) {
            return Stream.concat(Stream.of(named(opaque.identifier(), declaresGlobalName)), visitValue(opaque.size()));
        } else if (declaration instanceof Declaration.VariableOpaque opaque) {
            return Stream.concat(Stream.of(named(opaque.identifier(), declaresGlobalName)), visitValue(opaque.maxSize()));
        } else if (declaration instanceof Declaration.StringDecl string) {
            return Stream.concat(Stream.of(named(string.identifier(), declaresGlobalName)), visitValue(string.maxSize()));
        } else if (declaration instanceof Declaration.VoidDecl) {
            return Stream.empty();
        }
        throw new IllegalStateException("Unknown declaration: " + declaration);
    }

    private static Stream<Occurrence> visitType(TypeSpecifier type) {
        if (type instanceof TypeSpecifier.BuiltIn) {
            return Stream.empty();
        } else if (type instanceof TypeSpecifier.InlineEnum inline) {
            return visitEnum(inline.body());
        } else if (type instanceof TypeSpecifier.InlineStruct inline) {
            return visitStruct(inline.body());
        } else if (type instanceof TypeSpecifier.InlineUnion inline) {
            return visitUnion(inline.body());
        } else if (type instanceof TypeSpecifier.Named named) {
            return Stream.of(reference(named.identifier()));
        }
        throw new IllegalStateException("Unknown type specifier: " + type);
    }

    private static Stream<Occurrence> visitEnum(EnumBody body) {
        return body.members().stream().flatMap(OccurrenceVisitor::visitEnumMember);
    }

    private static Stream<Occurrence> visitEnumMember(EnumAssign member) {
        return Stream.concat(Stream.of(definition(member.identifier())), visitValue(member.value()));
    }

    private static Stream<Occurrence> visitStruct(StructBody body) {
        return body.members().stream().flatMap(member -> visitDeclaration(member, false));
    }

    private static Stream<Occurrence> visitUnion(UnionBody body) {
        Stream<Occurrence> discriminant = visitDeclaration(body.discriminant(), false);
        Stream<Occurrence> cases = body.cases().stream().flatMap(OccurrenceVisitor::visitCase);
        Stream<Occurrence> defaultArm = body.defaultArm().stream().flatMap(arm -> visitDeclaration(arm, false));
        return Stream.of(discriminant, cases, defaultArm).flatMap(s -> s);
    }

    private static Stream<Occurrence> visitCase(CaseSpec caseSpec) {
        return Stream.concat(
                caseSpec.values().stream().flatMap(OccurrenceVisitor::visitValue),
                visitDeclaration(caseSpec.declaration(), false));
    }

    private static Stream<Occurrence> visitValue(Value value) {
        if (value instanceof Value.Reference reference) {
            return Stream.of(reference(reference.identifier()));
        }
        // Literal constants and omitted bounds carry no identifier.
        return Stream.empty();
    }

    private static Occurrence named(Identifier identifier, boolean isDefinition) {
        return new Occurrence(identifier, isDefinition);
    }

    private static Occurrence definition(Identifier identifier) {
        return new Occurrence(identifier, true);
    }

    private static Occurrence reference(Identifier identifier) {
        return new Occurrence(identifier, false);
    }
}
