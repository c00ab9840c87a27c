package org.xdrls.index;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Consumer;

/**
 * The process-wide lookup tables built from every indexed schema file:
 * <ul>
 *   <li>tokens: file -> line -> identifier tokens sorted by start column,</li>
 *   <li>definitions: name -> the single location that defines it (last write wins),</li>
 *   <li>references: name -> every location that uses it (unordered, may repeat).</li>
 * </ul>
 * Each table has its own lock, and readers take one lock per table access. A query that
 * reads several tables is therefore not atomic against a concurrent mutation; the tables are
 * only mutated during {@link #rebuild(Population)} and the explicit per-file operations.
 * Mutations take all three locks in the fixed order tokens, definitions, references.
 * <p>
 * Every file's {@link FileIndex} is also kept, in indexing order, so that a single file can
 * be replaced or removed without rescanning the workspace.
 */
public class IndexStore {

    /**
     * Supplies the file contributions of a full rebuild.
     */
    @FunctionalInterface
    public interface Population {
        /**
         * Produces file contributions in discovery order.
         *
         * @param sink Receives each file's contribution; later files win definition conflicts.
         */
        void populate(Consumer<FileIndex> sink);
    }

    private final Object tokensLock = new Object();
    private final Object definitionsLock = new Object();
    private final Object referencesLock = new Object();

    // Guarded by tokensLock.
    private final Map<Path, Map<Integer, List<LineToken>>> tokens = new HashMap<>();
    private final LinkedHashMap<Path, FileIndex> files = new LinkedHashMap<>();
    // Guarded by definitionsLock.
    private final Map<String, SourceLocation> definitions = new HashMap<>();
    // Guarded by referencesLock.
    private final Map<String, List<SourceLocation>> references = new HashMap<>();

    /**
     * Discards all tables and fills them again. All three locks are held for the whole
     * call, so concurrent queries block until the rebuild finishes instead of observing a
     * partially built index. If the population fails, the tables are left empty.
     *
     * @param population Produces the contribution of every file.
     */
    public void rebuild(Population population) {
        synchronized (tokensLock) {
            synchronized (definitionsLock) {
                synchronized (referencesLock) {
                    clearLocked();
                    try {
                        population.populate(this::mergeLocked);
                    } catch (RuntimeException e) {
                        clearLocked();
                        throw e;
                    }
                }
            }
        }
    }

    /**
     * Replaces the contribution of one file, or adds it if the file was not indexed yet.
     * A name whose definition moves away from this file falls back to the latest remaining
     * definition in indexing order.
     *
     * @param fileIndex The new contribution of the file.
     */
    public void replaceFile(FileIndex fileIndex) {
        synchronized (tokensLock) {
            synchronized (definitionsLock) {
                synchronized (referencesLock) {
                    FileIndex previous = files.get(fileIndex.file());
                    Set<String> affected = new HashSet<>(fileIndex.definitions().keySet());
                    if (previous != null) {
                        removeReferencesLocked(previous);
                        affected.addAll(previous.definitions().keySet());
                    }
                    files.put(fileIndex.file(), fileIndex);
                    tokens.put(fileIndex.file(), fileIndex.tokensByLine());
                    appendReferencesLocked(fileIndex);
                    affected.forEach(this::resolveDefinitionLocked);
                }
            }
        }
    }

    /**
     * Drops everything a file contributed.
     *
     * @param file The normalized file identity.
     * @return true if the file was indexed.
     */
    public boolean removeFile(Path file) {
        synchronized (tokensLock) {
            synchronized (definitionsLock) {
                synchronized (referencesLock) {
                    FileIndex previous = files.remove(file);
                    if (previous == null) {
                        return false;
                    }
                    tokens.remove(file);
                    removeReferencesLocked(previous);
                    previous.definitions().keySet().forEach(this::resolveDefinitionLocked);
                    return true;
                }
            }
        }
    }

    /**
     * @param file The normalized file identity.
     * @param line The zero-based line.
     * @return The tokens on that line sorted by start column, or empty if the file or line has none.
     */
    public Optional<List<LineToken>> tokensOnLine(Path file, int line) {
        synchronized (tokensLock) {
            Map<Integer, List<LineToken>> lines = tokens.get(file);
            return lines == null ? Optional.empty() : Optional.ofNullable(lines.get(line));
        }
    }

    /**
     * @param name An identifier.
     * @return The location defining it, if any.
     */
    public Optional<SourceLocation> definition(String name) {
        synchronized (definitionsLock) {
            return Optional.ofNullable(definitions.get(name));
        }
    }

    /**
     * @param name An identifier.
     * @return A copy of the references to it, or empty if the name was never referenced.
     */
    public Optional<List<SourceLocation>> references(String name) {
        synchronized (referencesLock) {
            List<SourceLocation> locations = references.get(name);
            return locations == null ? Optional.empty() : Optional.of(new ArrayList<>(locations));
        }
    }

    /**
     * @return The indexed files in indexing order.
     */
    public List<Path> indexedFiles() {
        synchronized (tokensLock) {
            return List.copyOf(files.keySet());
        }
    }

    /**
     * @param file The normalized file identity.
     * @return The content version the file was last indexed with, if it is indexed.
     */
    public OptionalLong contentVersion(Path file) {
        synchronized (tokensLock) {
            FileIndex fileIndex = files.get(file);
            return fileIndex == null ? OptionalLong.empty() : OptionalLong.of(fileIndex.contentVersion());
        }
    }

    /**
     * @return A copy of the token table.
     */
    public Map<Path, Map<Integer, List<LineToken>>> tokensSnapshot() {
        synchronized (tokensLock) {
            return Map.copyOf(tokens);
        }
    }

    /**
     * @return A copy of the definition table.
     */
    public Map<String, SourceLocation> definitionsSnapshot() {
        synchronized (definitionsLock) {
            return Map.copyOf(definitions);
        }
    }

    /**
     * @return A copy of the reference table.
     */
    public Map<String, List<SourceLocation>> referencesSnapshot() {
        synchronized (referencesLock) {
            Map<String, List<SourceLocation>> copy = new HashMap<>();
            references.forEach((name, locations) -> copy.put(name, List.copyOf(locations)));
            return copy;
        }
    }

    private void clearLocked() {
        files.clear();
        tokens.clear();
        definitions.clear();
        references.clear();
    }

    private void mergeLocked(FileIndex fileIndex) {
        // A file discovered twice keeps its first position and only its latest contribution.
        if (files.containsKey(fileIndex.file())) {
            replaceFile(fileIndex);
            return;
        }
        files.put(fileIndex.file(), fileIndex);
        tokens.put(fileIndex.file(), fileIndex.tokensByLine());
        definitions.putAll(fileIndex.definitions());
        appendReferencesLocked(fileIndex);
    }

    private void appendReferencesLocked(FileIndex fileIndex) {
        fileIndex.references().forEach((name, locations) ->
                references.computeIfAbsent(name, k -> new ArrayList<>()).addAll(locations));
    }

    private void removeReferencesLocked(FileIndex fileIndex) {
        for (String name : fileIndex.references().keySet()) {
            List<SourceLocation> locations = references.get(name);
            if (locations == null) {
                continue;
            }
            locations.removeIf(location -> location.file().equals(fileIndex.file()));
            if (locations.isEmpty()) {
                references.remove(name);
            }
        }
    }

    private void resolveDefinitionLocked(String name) {
        SourceLocation winner = null;
        for (FileIndex fileIndex : files.values()) {
            SourceLocation candidate = fileIndex.definitions().get(name);
            if (candidate != null) {
                winner = candidate;
            }
        }
        if (winner == null) {
            definitions.remove(name);
        } else {
            definitions.put(name, winner);
        }
    }
}
