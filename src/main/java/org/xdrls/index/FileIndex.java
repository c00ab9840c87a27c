package org.xdrls.index;

import org.xdrls.compiler.frontend.occurrence.Occurrence;
import org.xdrls.compiler.frontend.occurrence.OccurrenceVisitor;
import org.xdrls.compiler.frontend.parser.ast.Identifier;
import org.xdrls.compiler.frontend.parser.ast.Specification;
import org.xdrls.compiler.frontend.position.LineMap;
import org.xdrls.compiler.frontend.position.TextPosition;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one schema file contributes to the {@link IndexStore}: its identifier tokens
 * per line, the names it defines and the names it references.
 * <p>
 * Instances are immutable once built.
 */
public final class FileIndex {

    private final Path file;
    private final long contentVersion;
    private final Map<Integer, List<LineToken>> tokensByLine;
    private final Map<String, SourceLocation> definitions;
    private final Map<String, List<SourceLocation>> references;

    private FileIndex(Path file,
                      long contentVersion,
                      Map<Integer, List<LineToken>> tokensByLine,
                      Map<String, SourceLocation> definitions,
                      Map<String, List<SourceLocation>> references) {
        this.file = file;
        this.contentVersion = contentVersion;
        this.tokensByLine = tokensByLine;
        this.definitions = definitions;
        this.references = references;
    }

    /**
     * Builds the contribution of one parsed file.
     *
     * @param file The normalized file identity.
     * @param source The decoded text the specification was parsed from.
     * @param specification The parsed file.
     * @param contentVersion A version number for the text, increasing with every reindex.
     * @return The file's index contribution.
     */
    public static FileIndex build(Path file, String source, Specification specification, long contentVersion) {
        LineMap lineMap = LineMap.of(source);
        Map<Integer, List<LineToken>> tokensByLine = new HashMap<>();
        Map<String, SourceLocation> definitions = new LinkedHashMap<>();
        Map<String, List<SourceLocation>> references = new LinkedHashMap<>();

        for (Occurrence occurrence : OccurrenceVisitor.occurrences(specification)) {
            Identifier identifier = occurrence.identifier();
            TextPosition start = lineMap.position(identifier.start());
            // Identifiers never span lines: the end column is taken relative to the start line.
            int endColumn = identifier.end() - lineMap.lineStart(start.line());
            SourceLocation location = new SourceLocation(file, start.line(), start.column(), start.line(), endColumn);

            tokensByLine.computeIfAbsent(start.line(), k -> new ArrayList<>())
                    .add(new LineToken(start.column(), endColumn, identifier.name()));
            if (occurrence.isDefinition()) {
                definitions.put(identifier.name(), location);
            } else {
                references.computeIfAbsent(identifier.name(), k -> new ArrayList<>()).add(location);
            }
        }

        Map<Integer, List<LineToken>> sortedTokens = new HashMap<>();
        tokensByLine.forEach((line, tokens) -> {
            tokens.sort(Comparator.comparingInt(LineToken::startColumn));
            sortedTokens.put(line, Collections.unmodifiableList(tokens));
        });
        Map<String, List<SourceLocation>> frozenReferences = new LinkedHashMap<>();
        references.forEach((name, locations) -> frozenReferences.put(name, List.copyOf(locations)));

        return new FileIndex(file, contentVersion,
                Collections.unmodifiableMap(sortedTokens),
                Collections.unmodifiableMap(definitions),
                Collections.unmodifiableMap(frozenReferences));
    }

    public Path file() {
        return file;
    }

    public long contentVersion() {
        return contentVersion;
    }

    /**
     * @return line -> tokens on that line, sorted by start column.
     */
    public Map<Integer, List<LineToken>> tokensByLine() {
        return tokensByLine;
    }

    /**
     * @return name -> location of the last definition of that name in this file.
     */
    public Map<String, SourceLocation> definitions() {
        return definitions;
    }

    /**
     * @return name -> reference locations in this file, in source order.
     */
    public Map<String, List<SourceLocation>> references() {
        return references;
    }
}
