package org.xdrls.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xdrls.compiler.api.ISchemaParser;
import org.xdrls.compiler.api.SchemaParseException;
import org.xdrls.compiler.frontend.io.SourceLoader;
import org.xdrls.compiler.frontend.parser.ast.Specification;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Discovers the schema files below a workspace root and feeds them into an {@link IndexStore}.
 * <p>
 * A file that cannot be read or parsed contributes nothing and does not affect any other
 * file; such skips are only logged. An invalid root is fatal.
 */
public class WorkspaceIndexer {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkspaceIndexer.class);

    private final ISchemaParser parser;
    private final IndexStore store;
    private final IndexerOptions options;
    private final AtomicLong versions = new AtomicLong();

    /**
     * @param parser Turns file contents into syntax trees.
     * @param store The tables to fill.
     * @param options File selection settings.
     */
    public WorkspaceIndexer(ISchemaParser parser, IndexStore store, IndexerOptions options) {
        this.parser = parser;
        this.store = store;
        this.options = options;
    }

    /**
     * Counts of one indexing run.
     *
     * @param discovered Files with the schema extension found below the root.
     * @param indexed Files that were parsed and merged into the index.
     * @param skipped Files that could not be read or parsed.
     */
    public record IndexSummary(int discovered, int indexed, int skipped) {}

    /**
     * Normalizes a path into the file identity used as key by the index.
     *
     * @param path Any path.
     * @return The absolute, normalized path.
     */
    public static Path fileIdentity(Path path) {
        return path.toAbsolutePath().normalize();
    }

    /**
     * Recursively finds every schema file below {@code root} and rebuilds the index from
     * them, in sorted path order. Previous index contents are discarded.
     *
     * @param root The workspace directory.
     * @return The counts of the run.
     * @throws WorkspaceInitializationException if the root does not exist or is not a directory.
     */
    public IndexSummary discoverAndIndex(Path root) {
        if (root == null) {
            throw new WorkspaceInitializationException("No workspace root was given.");
        }
        Path normalizedRoot = fileIdentity(root);
        if (!Files.isDirectory(normalizedRoot)) {
            throw new WorkspaceInitializationException("Workspace root is not a directory: " + normalizedRoot);
        }

        int[] counts = new int[2];
        List<Path> discovered = new ArrayList<>();
        store.rebuild(sink -> {
            discovered.addAll(discoverFiles(normalizedRoot));
            for (Path file : discovered) {
                Optional<FileIndex> fileIndex = indexFile(file);
                if (fileIndex.isPresent()) {
                    sink.accept(fileIndex.get());
                    counts[0]++;
                } else {
                    counts[1]++;
                }
            }
        });

        IndexSummary summary = new IndexSummary(discovered.size(), counts[0], counts[1]);
        LOGGER.info("Indexed workspace {}: {} files discovered, {} indexed, {} skipped.",
                normalizedRoot, summary.discovered(), summary.indexed(), summary.skipped());
        return summary;
    }

    /**
     * Re-indexes one file from new content, replacing what it contributed before.
     * If the content does not parse, the previous contribution stays in place.
     *
     * @param file The file whose content changed.
     * @param newText The new content.
     * @return true if the file was re-indexed.
     */
    public boolean reindex(Path file, String newText) {
        Path identity = fileIdentity(file);
        Optional<FileIndex> fileIndex = parse(identity, newText);
        if (fileIndex.isEmpty()) {
            return false;
        }
        store.replaceFile(fileIndex.get());
        LOGGER.debug("Re-indexed {} (version {}).", identity, fileIndex.get().contentVersion());
        return true;
    }

    /**
     * Re-reads one file from disk and re-indexes it.
     *
     * @param file The file to refresh.
     * @return true if the file was read, parsed and re-indexed.
     */
    public boolean reindex(Path file) {
        Path identity = fileIdentity(file);
        try {
            return reindex(identity, SourceLoader.loadFile(identity));
        } catch (IOException e) {
            LOGGER.debug("Skipping re-index of unreadable file {}: {}", identity, e.getMessage());
            return false;
        }
    }

    /**
     * Drops a file from the index.
     *
     * @param file The file to forget.
     * @return true if the file was indexed.
     */
    public boolean remove(Path file) {
        return store.removeFile(fileIdentity(file));
    }

    /**
     * @param root The normalized workspace root.
     * @return Every regular file with the schema extension, sorted by path. Symbolic links
     *         to files and directories are followed; link cycles are skipped.
     */
    List<Path> discoverFiles(Path root) {
        List<Path> found = new ArrayList<>();
        try {
            Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && SourceLoader.hasExtension(file, options.fileExtension())) {
                        found.add(fileIdentity(file));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    LOGGER.debug("Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new WorkspaceInitializationException("Failed to walk workspace root " + root, e);
        }
        Collections.sort(found);
        return found;
    }

    private Optional<FileIndex> indexFile(Path file) {
        String source;
        try {
            source = SourceLoader.loadFile(file);
        } catch (IOException e) {
            LOGGER.debug("Skipping unreadable file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        return parse(file, source);
    }

    private Optional<FileIndex> parse(Path file, String source) {
        try {
            Specification specification = parser.parse(source, file.toString());
            return Optional.of(FileIndex.build(file, source, specification, versions.incrementAndGet()));
        } catch (SchemaParseException e) {
            LOGGER.debug("Skipping file that does not parse: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
