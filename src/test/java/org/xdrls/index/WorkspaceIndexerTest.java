package org.xdrls.index;

import org.xdrls.compiler.SchemaParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for {@link WorkspaceIndexer} on a temporary directory tree.
 */
@Tag("integration")
class WorkspaceIndexerTest {

    @TempDir
    Path workspace;

    private IndexStore store;
    private WorkspaceIndexer indexer;

    @BeforeEach
    void setUp() {
        store = new IndexStore();
        indexer = new WorkspaceIndexer(new SchemaParser(), store, IndexerOptions.defaults());
    }

    private Path write(String relative, String content) throws IOException {
        Path file = workspace.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void indexesValidFilesAndSkipsBrokenOnes() throws IOException {
        write("a.x", "const MAX = 8;\n");
        write("nested/deep/b.x", "typedef int Values<MAX>;\n");
        write("broken.x", "struct {");
        write("notes.txt", "const IGNORED = 1;");

        WorkspaceIndexer.IndexSummary summary = indexer.discoverAndIndex(workspace);

        assertThat(summary).isEqualTo(new WorkspaceIndexer.IndexSummary(3, 2, 1));
        assertThat(store.definition("MAX")).isPresent();
        assertThat(store.definition("Values")).isPresent();
        assertThat(store.definition("IGNORED")).isEmpty();
        assertThat(store.references("MAX")).hasValueSatisfying(refs -> assertThat(refs).hasSize(1));
    }

    @Test
    void locationsUseNormalizedAbsolutePaths() throws IOException {
        Path file = write("a.x", "const MAX = 8;\n");

        indexer.discoverAndIndex(workspace.resolve("nested/..").resolve("."));

        assertThat(store.definition("MAX").orElseThrow().file())
                .isEqualTo(file.toAbsolutePath().normalize());
    }

    @Test
    void missingRootIsFatal() {
        Path missing = workspace.resolve("does-not-exist");

        assertThatThrownBy(() -> indexer.discoverAndIndex(missing))
                .isInstanceOf(WorkspaceInitializationException.class)
                .hasMessageContaining("not a directory");
    }

    @Test
    void fileRootIsFatal() throws IOException {
        Path file = write("a.x", "const MAX = 8;\n");

        assertThatThrownBy(() -> indexer.discoverAndIndex(file))
                .isInstanceOf(WorkspaceInitializationException.class);
    }

    @Test
    void reindexingTheSameTreeIsIdempotent() throws IOException {
        write("a.x", "const MAX = 8;\nstruct S { int v<MAX>; };\n");
        write("b.x", "typedef S *Next;\n");

        indexer.discoverAndIndex(workspace);
        Map<Path, Map<Integer, List<LineToken>>> tokens = store.tokensSnapshot();
        Map<String, SourceLocation> definitions = store.definitionsSnapshot();
        Map<String, List<SourceLocation>> references = store.referencesSnapshot();

        indexer.discoverAndIndex(workspace);

        assertThat(store.tokensSnapshot()).isEqualTo(tokens);
        assertThat(store.definitionsSnapshot()).isEqualTo(definitions);
        assertThat(store.referencesSnapshot()).isEqualTo(references);
    }

    @Test
    void conflictingDefinitionsResolveBySortedPathOrder() throws IOException {
        write("a.x", "const MAX = 1;\n");
        Path later = write("z/b.x", "const MAX = 2;\n");

        indexer.discoverAndIndex(workspace);

        assertThat(store.definition("MAX").orElseThrow().file()).isEqualTo(later.toAbsolutePath().normalize());
    }

    @Test
    void discoveredFilesAreSorted() throws IOException {
        write("m.x", "");
        write("b/c.x", "");
        write("a.x", "");

        assertThat(indexer.discoverFiles(workspace.toAbsolutePath().normalize()))
                .extracting(p -> workspace.toAbsolutePath().normalize().relativize(p).toString().replace('\\', '/'))
                .containsExactly("a.x", "b/c.x", "m.x");
    }

    @Test
    void reindexReplacesOneFile() throws IOException {
        Path file = write("a.x", "const MAX = 1;\n");
        write("b.x", "typedef int T<MAX>;\n");
        indexer.discoverAndIndex(workspace);
        long before = store.contentVersion(file.toAbsolutePath().normalize()).orElseThrow();

        assertThat(indexer.reindex(file, "const LIMIT = 1;\n")).isTrue();

        assertThat(store.definition("MAX")).isEmpty();
        assertThat(store.definition("LIMIT")).isPresent();
        assertThat(store.references("MAX")).isPresent();
        assertThat(store.contentVersion(file.toAbsolutePath().normalize()).orElseThrow()).isGreaterThan(before);
    }

    @Test
    void failedReindexKeepsPreviousContribution() throws IOException {
        Path file = write("a.x", "const MAX = 1;\n");
        indexer.discoverAndIndex(workspace);

        assertThat(indexer.reindex(file, "const = ;")).isFalse();

        assertThat(store.definition("MAX")).isPresent();
    }

    @Test
    void reindexFromDiskAndRemove() throws IOException {
        Path file = write("a.x", "const MAX = 1;\n");
        indexer.discoverAndIndex(workspace);
        Files.writeString(file, "const MIN = 0;\n");

        assertThat(indexer.reindex(file)).isTrue();
        assertThat(store.definition("MIN")).isPresent();
        assertThat(indexer.reindex(workspace.resolve("gone.x"))).isFalse();

        assertThat(indexer.remove(file)).isTrue();
        assertThat(store.indexedFiles()).isEmpty();
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void symbolicLinksToFilesAndDirectoriesAreFollowed() throws IOException {
        write("c.x", "const PLAIN = 1;\n");
        Path outside = Files.createTempDirectory("xdr-linked");
        try {
            Path linkedFile = Files.writeString(outside.resolve("b-target.x"), "const LINKED_FILE = 1;\n");
            Path linkedDir = Files.createDirectories(outside.resolve("dir"));
            Files.writeString(linkedDir.resolve("a.x"), "const LINKED_DIR = 1;\n");
            Files.createSymbolicLink(workspace.resolve("b.x"), linkedFile);
            Files.createSymbolicLink(workspace.resolve("sub"), linkedDir);
            // A link back to the root must not loop forever.
            Files.createSymbolicLink(linkedDir.resolve("loop"), workspace);

            WorkspaceIndexer.IndexSummary summary = indexer.discoverAndIndex(workspace);

            assertThat(summary.indexed()).isEqualTo(3);
            assertThat(store.definition("PLAIN")).isPresent();
            assertThat(store.definition("LINKED_FILE")).isPresent();
            assertThat(store.definition("LINKED_DIR")).hasValueSatisfying(location ->
                    assertThat(location.file()).isEqualTo(workspace.resolve("sub/a.x").toAbsolutePath().normalize()));
        } finally {
            Files.deleteIfExists(outside.resolve("dir/loop"));
            Files.deleteIfExists(outside.resolve("dir/a.x"));
            Files.deleteIfExists(outside.resolve("dir"));
            Files.deleteIfExists(outside.resolve("b-target.x"));
            Files.deleteIfExists(outside);
        }
    }

    @Test
    void customExtensionSelectsOtherFiles() throws IOException {
        write("a.x", "const A = 1;\n");
        write("b.xdr", "const B = 1;\n");
        WorkspaceIndexer custom = new WorkspaceIndexer(new SchemaParser(), store, new IndexerOptions("xdr", false));

        assertThat(custom.discoverAndIndex(workspace).indexed()).isEqualTo(1);
        assertThat(store.definition("B")).isPresent();
        assertThat(store.definition("A")).isEmpty();
    }
}
