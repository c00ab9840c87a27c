package org.xdrls.index;

import org.xdrls.compiler.SchemaParser;
import org.xdrls.compiler.api.ISchemaParser;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Entry point to the index: builds it from a workspace directory and answers
 * "which name is under the cursor", "where is it defined" and "where is it used".
 * <p>
 * Safe for concurrent use. Queries issued while {@link #discoverAndIndex(Path)} runs
 * block until indexing has finished.
 */
public class SchemaIndex {

    private final IndexStore store;
    private final QueryEngine queries;
    private final WorkspaceIndexer indexer;

    /**
     * Creates an empty index with the default parser.
     * @param options File selection settings.
     */
    public SchemaIndex(IndexerOptions options) {
        this(new SchemaParser(), options);
    }

    /**
     * Creates an empty index.
     * @param parser Turns file contents into syntax trees.
     * @param options File selection settings.
     */
    public SchemaIndex(ISchemaParser parser, IndexerOptions options) {
        this.store = new IndexStore();
        this.queries = new QueryEngine(store);
        this.indexer = new WorkspaceIndexer(parser, store, options);
    }

    /**
     * Replaces the index with the schema files found below a directory.
     *
     * @param root The workspace directory.
     * @return The counts of the run.
     * @throws WorkspaceInitializationException if the root does not exist or is not a directory.
     */
    public WorkspaceIndexer.IndexSummary discoverAndIndex(Path root) {
        return indexer.discoverAndIndex(root);
    }

    /**
     * @param file Any path naming a schema file; it is normalized before lookup.
     * @param line The zero-based line.
     * @param column The zero-based column.
     * @return The identifier under the position, if any.
     */
    public Optional<String> identifierAt(Path file, int line, int column) {
        return queries.identifierAt(WorkspaceIndexer.fileIdentity(file), line, column);
    }

    /**
     * @param name An identifier.
     * @return The location of its definition, if any.
     */
    public Optional<SourceLocation> definitionOf(String name) {
        return queries.definitionOf(name);
    }

    /**
     * @param name An identifier.
     * @param includeDeclaration Whether to append the definition site.
     * @return The reference locations, or empty if the name was never referenced.
     * @see QueryEngine#referencesOf(String, boolean)
     */
    public Optional<List<SourceLocation>> referencesOf(String name, boolean includeDeclaration) {
        return queries.referencesOf(name, includeDeclaration);
    }

    /**
     * Re-indexes one file from new content.
     *
     * @param file The file whose content changed.
     * @param newText The new content.
     * @return true if the content parsed and replaced the file's previous contribution.
     */
    public boolean reindex(Path file, String newText) {
        return indexer.reindex(file, newText);
    }

    /**
     * Re-reads one file from disk and re-indexes it.
     *
     * @param file The file to refresh.
     * @return true if the file was read, parsed and re-indexed.
     */
    public boolean reindex(Path file) {
        return indexer.reindex(file);
    }

    /**
     * @param file The file to forget.
     * @return true if the file was indexed.
     */
    public boolean remove(Path file) {
        return indexer.remove(file);
    }
}
