// file: core/src/main/java/io/hiermerge/core/ConflictException.java
package io.hiermerge.core;

import java.util.List;
import java.util.Objects;

/**
 * Two fragments claimed authority over the same key and neither may win.
 * <p>
 * Kinds:
 *  - VALUE:     same key, same hierarchy depth, existing value non-empty.
 *  - STRUCTURE: one fragment holds a mapping where another holds a value.
 */
public final class ConflictException extends HierMergeException {

    public enum Kind { VALUE, STRUCTURE }

    private final Kind kind;
    private final String keyPath;
    private final int depth;
    private final List<String> sourcePaths;

    private ConflictException(String message, Kind kind, String keyPath, int depth, List<String> sourcePaths) {
        super(message);
        this.kind = kind;
        this.keyPath = keyPath;
        this.depth = depth;
        this.sourcePaths = List.copyOf(sourcePaths);
    }

    /**
     * Same-level collision. Uses the single-file message when both values came
     * from the same source.
     */
    static ConflictException sameLevel(String keyPath, int depth, String incomingSource, String existingSource) {
        if (Objects.equals(incomingSource, existingSource)) {
            return new ConflictException(
                    "Merge Error: key %s was found multiple times at the same hierarchy level (level: %d) in file %s."
                            .formatted(keyPath, depth, incomingSource),
                    Kind.VALUE, keyPath, depth, List.of(String.valueOf(incomingSource)));
        }
        return new ConflictException(
                "Merge Error: key %s was found multiple times at the same hierarchy level (level: %d) in files %s and %s."
                        .formatted(keyPath, depth, incomingSource, existingSource),
                Kind.VALUE, keyPath, depth,
                List.of(String.valueOf(incomingSource), String.valueOf(existingSource)));
    }

    static ConflictException structure(String keyPath,
                                       String mappingSource, int mappingDepth,
                                       String valueSource, int valueDepth) {
        return new ConflictException(
                "Merge Error: key %s is a mapping in %s (level: %d) but a value in %s (level: %d)."
                        .formatted(keyPath, mappingSource, mappingDepth, valueSource, valueDepth),
                Kind.STRUCTURE, keyPath, Math.min(mappingDepth, valueDepth),
                List.of(String.valueOf(mappingSource), String.valueOf(valueSource)));
    }

    public Kind kind() { return kind; }

    /** Colon-joined path from the root to the contested key. */
    public String keyPath() { return keyPath; }

    public int depth() { return depth; }

    public List<String> sourcePaths() { return sourcePaths; }
}
