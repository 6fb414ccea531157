// file: core/src/main/java/io/hiermerge/core/SequenceNode.java
package io.hiermerge.core;

import java.util.List;

/** Re-expanded keyed list, in merge insertion order. Immutable. */
public record SequenceNode(List<Node> elements) implements Node {

    public SequenceNode {
        elements = List.copyOf(elements);
    }

    public Node get(int index) { return elements.get(index); }

    public int size() { return elements.size(); }
}
