package org.xdrls.index;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class IndexerOptionsTest {

    @Test
    void referenceConfigGivesDefaults() {
        IndexerOptions options = IndexerOptions.fromConfig(ConfigFactory.load());

        assertThat(options).isEqualTo(IndexerOptions.defaults());
        assertThat(options.fileExtension()).isEqualTo("x");
        assertThat(options.reindexOnSave()).isFalse();
    }

    @Test
    void emptyConfigGivesDefaults() {
        assertThat(IndexerOptions.fromConfig(ConfigFactory.empty())).isEqualTo(IndexerOptions.defaults());
    }

    @Test
    void valuesAreReadFromTheXdrBlock() {
        Config config = ConfigFactory.parseString("xdr { file-extension = \"xdr\", index.reindex-on-save = true }");

        IndexerOptions options = IndexerOptions.fromConfig(config);

        assertThat(options.fileExtension()).isEqualTo("xdr");
        assertThat(options.reindexOnSave()).isTrue();
    }

    @Test
    void extensionMustBeGivenWithoutDot() {
        assertThatThrownBy(() -> new IndexerOptions(".x", false)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new IndexerOptions(" ", false)).isInstanceOf(IllegalArgumentException.class);
    }
}
