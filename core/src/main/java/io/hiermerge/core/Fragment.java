// file: core/src/main/java/io/hiermerge/core/Fragment.java
package io.hiermerge.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One unit of configuration to merge, plus where it came from.
 * <p>
 * Fields:
 *  - content:    mapping tree (string keys, lists, scalars), deep-copied and unmodifiable.
 *  - sourcePath: originating file or document, used in errors and provenance.
 *  - tags:       entities this fragment applies to.
 *  - weight:     explicit override priority, see {@link ProvenanceMerger}.
 *  - depth:      hierarchy level, 0 = closest to the target entity.
 */
public record Fragment(
        Map<String, Object> content,
        String sourcePath,
        Set<String> tags,
        int weight,
        int depth
) {
    public static final int DEFAULT_WEIGHT = 1000;

    public Fragment {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(tags, "tags");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
        content = Trees.immutableCopy(content);
        tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    /** Fragment at the default weight. */
    public static Fragment of(Map<String, ?> content, String sourcePath, int depth) {
        return new Fragment(Trees.immutableCopy(content), sourcePath, Set.of("all"), DEFAULT_WEIGHT, depth);
    }

    /** Same metadata, different content. */
    public Fragment withContent(Map<String, Object> newContent) {
        return new Fragment(newContent, sourcePath, tags, weight, depth);
    }
}
