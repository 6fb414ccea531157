// file: core/src/main/java/io/hiermerge/core/MappingNode.java
package io.hiermerge.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Insertion-ordered mapping of key to child node. Immutable.
 * {@code keyed} marks a mapping built from a keyed list, which denormalizes
 * back to a {@link SequenceNode}.
 */
public record MappingNode(Map<String, Node> children, boolean keyed) implements Node {

    public MappingNode {
        Objects.requireNonNull(children, "children");
        children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
    }

    public MappingNode(Map<String, Node> children) {
        this(children, false);
    }

    public Node get(String key) { return children.get(key); }
}
