package org.xdrls.index;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Answers point queries against an {@link IndexStore}. Unknown files, positions and names
 * are ordinary misses and yield empty results, never exceptions.
 */
public class QueryEngine {

    private final IndexStore store;

    public QueryEngine(IndexStore store) {
        this.store = store;
    }

    /**
     * Finds the identifier under a cursor.
     *
     * @param file The normalized file identity.
     * @param line The zero-based line.
     * @param column The zero-based column.
     * @return The name of the token with the greatest start column not after the cursor,
     *         if the cursor lies within it (both ends inclusive).
     */
    public Optional<String> identifierAt(Path file, int line, int column) {
        return store.tokensOnLine(file, line).flatMap(tokens -> {
            int index = partitionPoint(tokens, column);
            if (index == 0) {
                return Optional.empty();
            }
            LineToken token = tokens.get(index - 1);
            return token.touches(column) ? Optional.of(token.name()) : Optional.empty();
        });
    }

    /**
     * @param name An identifier.
     * @return The location of its definition, if any file defines it.
     */
    public Optional<SourceLocation> definitionOf(String name) {
        return store.definition(name);
    }

    /**
     * Lists the uses of a name.
     * <p>
     * An empty result means the name is unknown; a present but empty list cannot occur for
     * an unknown name. When {@code includeDeclaration} is set and the name has a definition,
     * the definition's location is appended. A name that is defined but never referenced
     * still yields an empty result.
     *
     * @param name An identifier.
     * @param includeDeclaration Whether to append the definition site.
     * @return The reference locations, or empty if the name was never referenced.
     */
    public Optional<List<SourceLocation>> referencesOf(String name, boolean includeDeclaration) {
        Optional<List<SourceLocation>> references = store.references(name);
        if (references.isPresent() && includeDeclaration) {
            store.definition(name).ifPresent(references.get()::add);
        }
        return references;
    }

    /**
     * Returns the number of tokens whose start column is at most {@code column}.
     */
    private static int partitionPoint(List<LineToken> tokens, int column) {
        int low = 0;
        int high = tokens.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (tokens.get(mid).startColumn() <= column) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
