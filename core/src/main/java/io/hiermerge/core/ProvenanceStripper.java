// file: core/src/main/java/io/hiermerge/core/ProvenanceStripper.java
package io.hiermerge.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Views of an annotated tree as plain data.
 * <p>
 *  - strip: each leaf becomes its bare value.
 *  - audit: each leaf becomes {value, filepath, tags, depth, weight}.
 * <p>
 * Both return mutable LinkedHashMap/ArrayList trees owned by the caller.
 */
public final class ProvenanceStripper {

    private ProvenanceStripper() {
        // utility
    }

    public static Map<String, Object> strip(MappingNode tree) {
        return mapping(tree, false);
    }

    public static Object strip(Node node) {
        return walk(node, false);
    }

    public static Map<String, Object> audit(MappingNode tree) {
        return mapping(tree, true);
    }

    private static Object walk(Node node, boolean audit) {
        if (node instanceof MappingNode m) return mapping(m, audit);
        if (node instanceof SequenceNode s) {
            var out = new ArrayList<Object>(s.size());
            for (Node element : s.elements()) out.add(walk(element, audit));
            return out;
        }
        var leaf = (AnnotatedLeaf) node;
        if (leaf.sourcePath() == null || leaf.tags() == null) {
            throw new MalformedAnnotationException("Annotated leaf without provenance: value=" + leaf.value());
        }
        return audit ? describe(leaf) : copyValue(leaf.value());
    }

    private static Map<String, Object> mapping(MappingNode node, boolean audit) {
        var out = new LinkedHashMap<String, Object>(node.children().size() * 2);
        node.children().forEach((key, child) -> out.put(key, walk(child, audit)));
        return out;
    }

    private static Map<String, Object> describe(AnnotatedLeaf leaf) {
        var out = new LinkedHashMap<String, Object>();
        out.put("value", copyValue(leaf.value()));
        out.put("filepath", leaf.sourcePath());
        out.put("tags", List.copyOf(leaf.tags()));
        out.put("depth", leaf.depth());
        out.put("weight", leaf.weight());
        return out;
    }

    // Opaque list leaves are shared with the fragment; hand out a copy.
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> m) {
            var out = new LinkedHashMap<String, Object>(m.size() * 2);
            m.forEach((k, v) -> out.put(String.valueOf(k), copyValue(v)));
            return out;
        }
        if (value instanceof List<?> l) {
            var out = new ArrayList<Object>(l.size());
            for (Object item : l) out.add(copyValue(item));
            return out;
        }
        return value;
    }
}
