package org.xdrls.index;

import org.xdrls.compiler.SchemaParser;
import org.xdrls.compiler.api.SchemaParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@Tag("unit")
class IndexStoreTest {

    private static final Path FIRST = Path.of("/ws/a.x").toAbsolutePath().normalize();
    private static final Path SECOND = Path.of("/ws/b.x").toAbsolutePath().normalize();

    private IndexStore store;
    private long version;

    @BeforeEach
    void setUp() {
        store = new IndexStore();
        version = 0;
    }

    private FileIndex fileIndex(Path file, String source) throws SchemaParseException {
        return FileIndex.build(file, source, new SchemaParser().parse(source, file.toString()), ++version);
    }

    @Test
    void lastIndexedDefinitionWins() throws SchemaParseException {
        FileIndex first = fileIndex(FIRST, "const MAX = 1;");
        FileIndex second = fileIndex(SECOND, "\nconst MAX = 2;");

        store.rebuild(sink -> {
            sink.accept(first);
            sink.accept(second);
        });

        assertThat(store.definition("MAX")).contains(new SourceLocation(SECOND, 1, 6, 1, 9));
        assertThat(store.indexedFiles()).containsExactly(FIRST, SECOND);
    }

    @Test
    void laterDefinitionInSameFileWins() throws SchemaParseException {
        FileIndex file = fileIndex(FIRST, "const MAX = 1;\nconst MAX = 2;");

        store.rebuild(sink -> sink.accept(file));

        assertThat(store.definition("MAX")).contains(new SourceLocation(FIRST, 1, 6, 1, 9));
    }

    @Test
    void replacingAFileFallsBackToRemainingDefinition() throws SchemaParseException {
        FileIndex first = fileIndex(FIRST, "const MAX = 1;");
        FileIndex second = fileIndex(SECOND, "\nconst MAX = 2;\ntypedef int T<MAX>;");
        store.rebuild(sink -> {
            sink.accept(first);
            sink.accept(second);
        });

        store.replaceFile(fileIndex(SECOND, "const OTHER = 3;"));

        assertThat(store.definition("MAX")).contains(new SourceLocation(FIRST, 0, 6, 0, 9));
        assertThat(store.definition("OTHER")).isPresent();
        assertThat(store.references("MAX")).isEmpty();
        assertThat(store.indexedFiles()).containsExactly(FIRST, SECOND);
        assertThat(store.contentVersion(SECOND)).hasValue(3);
    }

    @Test
    void removingAFileDropsItsContribution() throws SchemaParseException {
        FileIndex first = fileIndex(FIRST, "const MAX = 1;");
        FileIndex second = fileIndex(SECOND, "typedef int T<MAX>;");
        store.rebuild(sink -> {
            sink.accept(first);
            sink.accept(second);
        });
        assertThat(store.references("MAX")).hasValueSatisfying(refs -> assertThat(refs).hasSize(1));

        assertThat(store.removeFile(SECOND)).isTrue();
        assertThat(store.removeFile(SECOND)).isFalse();

        assertThat(store.references("MAX")).isEmpty();
        assertThat(store.definition("T")).isEmpty();
        assertThat(store.tokensOnLine(SECOND, 0)).isEmpty();
        assertThat(store.definition("MAX")).isPresent();
        assertThat(store.contentVersion(SECOND)).isEmpty();
    }

    @Test
    void rebuildDiscardsPreviousContents() throws SchemaParseException {
        FileIndex first = fileIndex(FIRST, "const MAX = 1;");
        FileIndex second = fileIndex(SECOND, "const MIN = 1;");
        store.rebuild(sink -> sink.accept(first));

        store.rebuild(sink -> sink.accept(second));

        assertThat(store.definitionsSnapshot()).containsOnlyKeys("MIN");
        assertThat(store.tokensSnapshot()).containsOnlyKeys(SECOND);
    }

    @Test
    void failedRebuildLeavesTablesEmpty() throws SchemaParseException {
        FileIndex first = fileIndex(FIRST, "const MAX = 1;\ntypedef int T<MAX>;");

        assertThatThrownBy(() -> store.rebuild(sink -> {
            sink.accept(first);
            throw new IllegalStateException("disk vanished");
        })).isInstanceOf(IllegalStateException.class).hasMessage("disk vanished");

        assertThat(store.tokensSnapshot()).isEmpty();
        assertThat(store.definitionsSnapshot()).isEmpty();
        assertThat(store.referencesSnapshot()).isEmpty();
        assertThat(store.indexedFiles()).isEmpty();
    }

    @Test
    void returnedReferenceListsAreCopies() throws SchemaParseException {
        FileIndex file = fileIndex(FIRST, "const MAX = 1;\ntypedef int T<MAX>;");
        store.rebuild(sink -> sink.accept(file));

        store.references("MAX").orElseThrow().clear();

        assertThat(store.references("MAX")).hasValueSatisfying(refs -> assertThat(refs).hasSize(1));
    }

    @Test
    void queriesBlockWhileRebuildIsRunning() throws Exception {
        FileIndex file = fileIndex(FIRST, "const MAX = 1;");
        CountDownLatch populating = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            CompletableFuture<Void> rebuild = CompletableFuture.runAsync(() -> store.rebuild(sink -> {
                sink.accept(file);
                populating.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }), executor);
            assertThat(populating.await(5, TimeUnit.SECONDS)).isTrue();

            CompletableFuture<Optional<SourceLocation>> query =
                    CompletableFuture.supplyAsync(() -> store.definition("MAX"), executor);
            Thread.sleep(100);
            assertThat(query).isNotDone();

            release.countDown();
            await().atMost(Duration.ofSeconds(5)).until(query::isDone);
            assertThat(query.get()).contains(new SourceLocation(FIRST, 0, 6, 0, 9));
            rebuild.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }
}
