package org.xdrls.index;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
class SchemaIndexTest {

    @TempDir
    Path workspace;

    @Test
    void answersQueriesForUnnormalizedPaths() throws IOException {
        Files.writeString(workspace.resolve("types.x"), "const MAX = 8;\n");
        Files.writeString(workspace.resolve("uses.x"), "struct S {\n    opaque data<MAX>;\n};\n");
        SchemaIndex index = new SchemaIndex(IndexerOptions.defaults());
        index.discoverAndIndex(workspace);

        Path uses = workspace.resolve("sub/../uses.x");
        assertThat(index.identifierAt(uses, 1, 16)).contains("MAX");

        SourceLocation definition = index.definitionOf("MAX").orElseThrow();
        assertThat(definition).isEqualTo(new SourceLocation(
                workspace.resolve("types.x").toAbsolutePath().normalize(), 0, 6, 0, 9));

        List<SourceLocation> references = index.referencesOf("MAX", true).orElseThrow();
        assertThat(references).hasSize(2).endsWith(definition);
    }
}
