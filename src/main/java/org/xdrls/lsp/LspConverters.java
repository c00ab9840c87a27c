package org.xdrls.lsp;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.xdrls.index.SourceLocation;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Converts between protocol types and index types. Index columns are UTF-16 code units,
 * which is the protocol's default position encoding, so positions pass through unchanged.
 */
public final class LspConverters {

    private LspConverters() {}

    /**
     * Turns a document URI into a file identity.
     *
     * @param uri A {@code file:} URI.
     * @return The local path, or empty if the URI does not name a local file.
     */
    public static Optional<Path> toPath(String uri) {
        if (uri == null) {
            return Optional.empty();
        }
        try {
            URI parsed = URI.create(uri);
            if (!"file".equalsIgnoreCase(parsed.getScheme())) {
                return Optional.empty();
            }
            return Optional.of(Path.of(parsed).toAbsolutePath().normalize());
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * @param location An index location.
     * @return The protocol location.
     */
    public static Location toLocation(SourceLocation location) {
        return new Location(
                location.file().toUri().toString(),
                new Range(
                        new Position(location.startLine(), location.startColumn()),
                        new Position(location.endLine(), location.endColumn())));
    }

    /**
     * @param locations Index locations.
     * @return The protocol locations, in the same order.
     */
    public static List<Location> toLocations(List<SourceLocation> locations) {
        return locations.stream().map(LspConverters::toLocation).collect(Collectors.toList());
    }
}
