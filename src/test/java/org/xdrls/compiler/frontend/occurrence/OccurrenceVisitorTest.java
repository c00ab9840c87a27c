package org.xdrls.compiler.frontend.occurrence;

import org.xdrls.compiler.SchemaParser;
import org.xdrls.compiler.api.SchemaParseException;
import org.xdrls.compiler.frontend.parser.ast.Specification;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link OccurrenceVisitor}.
 */
@Tag("unit")
class OccurrenceVisitorTest {

    private static final String SOURCE = """
            const MAX = 8;
            typedef opaque Hash[32];
            enum Color { RED = 0, GREEN = RED };
            struct Point { int x; Color c<MAX>; };
            union U switch (Color kind) {
            case RED:
                Point p;
            default:
                struct { int inner; } anon;
            };
            typedef Hash Anon;
            """;

    private static Specification parse(String source) throws SchemaParseException {
        return new SchemaParser().parse(source, "test.x");
    }

    /**
     * Verifies the visiting order and the definition/reference classification of a file
     * using every kind of definition.
     */
    @Test
    void testClassificationAndOrder() throws SchemaParseException {
        List<Occurrence> occurrences = OccurrenceVisitor.stream(parse(SOURCE)).collect(Collectors.toList());

        assertThat(occurrences)
                .extracting(Occurrence::name, Occurrence::isDefinition)
                .containsExactly(
                        tuple("MAX", true),
                        tuple("Hash", true),
                        tuple("Color", true),
                        tuple("RED", true),
                        tuple("GREEN", true),
                        tuple("RED", false),
                        tuple("Point", true),
                        tuple("x", false),
                        tuple("Color", false),
                        tuple("c", false),
                        tuple("MAX", false),
                        tuple("U", true),
                        tuple("Color", false),
                        tuple("kind", false),
                        tuple("RED", false),
                        tuple("Point", false),
                        tuple("p", false),
                        tuple("inner", false),
                        tuple("anon", false),
                        tuple("Hash", false),
                        tuple("Anon", true));
    }

    /**
     * Verifies that enum members declared inline inside a struct are still definitions,
     * while the member name of the struct is not.
     */
    @Test
    void testInlineEnumMembersAreDefinitions() throws SchemaParseException {
        Specification spec = parse("struct S { enum { ON = 1, OFF = 0 } state; };");

        assertThat(OccurrenceVisitor.stream(spec).collect(Collectors.toList()))
                .extracting(Occurrence::name, Occurrence::isDefinition)
                .containsExactly(
                        tuple("S", true),
                        tuple("ON", true),
                        tuple("OFF", true),
                        tuple("state", false));
    }

    /**
     * Verifies that the iterable can be walked more than once with identical results.
     */
    @Test
    void testIterableIsRestartable() throws SchemaParseException {
        Iterable<Occurrence> occurrences = OccurrenceVisitor.occurrences(parse(SOURCE));

        List<Occurrence> first = new ArrayList<>();
        occurrences.forEach(first::add);
        List<Occurrence> second = new ArrayList<>();
        occurrences.forEach(second::add);

        assertThat(first).hasSize(21).isEqualTo(second);
    }

    /**
     * Verifies that occurrences come out in ascending source order.
     */
    @Test
    void testOccurrencesFollowSourceOrder() throws SchemaParseException {
        List<Integer> starts = OccurrenceVisitor.stream(parse(SOURCE))
                .map(o -> o.identifier().start())
                .collect(Collectors.toList());

        assertThat(starts).isSorted();
    }

    @Test
    void testEmptySpecificationYieldsNothing() throws SchemaParseException {
        assertThat(OccurrenceVisitor.occurrences(parse(""))).isEmpty();
    }
}
