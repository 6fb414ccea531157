// file: core/src/main/java/io/hiermerge/core/AnnotatedLeaf.java
package io.hiermerge.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A retained leaf value with the provenance of the fragment that supplied it.
 * <p>
 * The value is a scalar, or a list that no merge-key rule claimed (such lists
 * are replaced wholesale, never appended). Provenance fields are not
 * validated here; {@link ProvenanceStripper} rejects leaves that lack them.
 */
public record AnnotatedLeaf(
        Object value,
        String sourcePath,
        Set<String> tags,
        int depth,
        int weight
) implements Node {

    public AnnotatedLeaf {
        if (tags != null) tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    static AnnotatedLeaf from(Object value, Fragment fragment) {
        return new AnnotatedLeaf(value, fragment.sourcePath(), fragment.tags(), fragment.depth(), fragment.weight());
    }

    AnnotatedLeaf withValue(Object newValue) {
        return new AnnotatedLeaf(newValue, sourcePath, tags, depth, weight);
    }
}
