package org.xdrls.index;

import com.typesafe.config.Config;

import java.util.Objects;

/**
 * Typed view of the {@code xdr} configuration block.
 *
 * <pre>
 * xdr {
 *   file-extension = "x"
 *   index.reindex-on-save = false
 * }
 * </pre>
 *
 * @param fileExtension Extension (without the dot) of the files to index.
 * @param reindexOnSave Whether saved documents are re-indexed in place.
 */
public record IndexerOptions(String fileExtension, boolean reindexOnSave) {

    /** The extension of XDR schema files. */
    public static final String DEFAULT_EXTENSION = "x";

    public IndexerOptions {
        Objects.requireNonNull(fileExtension, "fileExtension");
        if (fileExtension.isBlank() || fileExtension.startsWith(".")) {
            throw new IllegalArgumentException("File extension must be non-empty and given without a dot: '" + fileExtension + "'");
        }
    }

    /**
     * @return The options used when no configuration is given.
     */
    public static IndexerOptions defaults() {
        return new IndexerOptions(DEFAULT_EXTENSION, false);
    }

    /**
     * Reads the options from the {@code xdr} block. Missing keys take their defaults.
     *
     * @param config The application configuration.
     * @return The options.
     */
    public static IndexerOptions fromConfig(Config config) {
        String extension = config.hasPath("xdr.file-extension")
                ? config.getString("xdr.file-extension")
                : DEFAULT_EXTENSION;
        boolean reindexOnSave = config.hasPath("xdr.index.reindex-on-save")
                && config.getBoolean("xdr.index.reindex-on-save");
        return new IndexerOptions(extension, reindexOnSave);
    }
}
