package tech.yump.audit.schema;

import java.util.Arrays;
import java.util.Optional;

/**
 * Decomposition of a hierarchical resource string such as {@code "databases/db1/collections/col1"}.
 * <p>
 * The last segment is the id, the one before it the type, and everything in front of those two the parent
 * ({@code null} when there is nothing in front). A resource with fewer than two non-empty segments cannot
 * be decomposed and yields {@link Optional#empty()}.
 */
public record ResourcePath(String parent, String type, String id) {

    public static Optional<ResourcePath> parse(String resource) {
        if (resource == null || resource.isBlank()) {
            return Optional.empty();
        }
        String[] segments = Arrays.stream(resource.split("/"))
                .filter(segment -> !segment.isEmpty())
                .toArray(String[]::new);
        if (segments.length < 2) {
            return Optional.empty();
        }
        String type = segments[segments.length - 2];
        String id = segments[segments.length - 1];
        String parent = segments.length > 2
                ? String.join("/", Arrays.copyOfRange(segments, 0, segments.length - 2))
                : null;
        return Optional.of(new ResourcePath(parent, type, id));
    }
}
