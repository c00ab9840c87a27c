package org.xdrls.compiler.frontend.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Centralizes file loading for the indexer. Schema files are decoded as UTF-8;
 * malformed byte sequences are replaced rather than rejected.
 */
public final class SourceLoader {

    private SourceLoader() {}

    /**
     * Loads a schema file from the local filesystem.
     *
     * @param path The file to read.
     * @return The decoded file content.
     * @throws IOException If the file cannot be read.
     */
    public static String loadFile(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    /**
     * Checks whether a path names a schema file, by extension.
     *
     * @param path The path to check.
     * @param extension The extension without the dot, e.g. {@code x}.
     * @return true if the file name has a non-empty stem followed by {@code .extension}.
     */
    public static boolean hasExtension(Path path, String extension) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        return name.length() > extension.length() + 1 && name.endsWith("." + extension);
    }
}
