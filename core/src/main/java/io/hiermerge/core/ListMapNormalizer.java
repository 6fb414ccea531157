// file: core/src/main/java/io/hiermerge/core/ListMapNormalizer.java
package io.hiermerge.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts keyed lists to mappings before a merge, and back afterwards.
 * <p>
 * normalize:
 *  - A list at path p that the resolver assigns a key field becomes a
 *    {@link KeyedMapping} from String.valueOf(element[keyField]) to the element.
 *    The element's own children then live at p + elementKey.
 *  - Any other list of mappings keeps its shape, but each element is walked at
 *    path p so keyed lists nested inside it are still converted.
 *  - Other lists are left untouched.
 * <p>
 * denormalize is the exact inverse: every {@link KeyedMapping} (or keyed
 * {@link MappingNode}) becomes the list of its values, in insertion order.
 * Ordinary mappings keep their shape even where a pattern matches their path.
 * <p>
 * normalize is not idempotent; apply it once per fragment.
 */
public final class ListMapNormalizer {

    private final PathPatternResolver resolver;

    public ListMapNormalizer(PathPatternResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    // ----------------- plain trees -----------------

    public Map<String, Object> normalize(Map<String, ?> tree) {
        return normalizeMapping(tree, List.of());
    }

    public Map<String, Object> denormalize(Map<String, ?> tree) {
        return denormalizeMapping(tree);
    }

    private Map<String, Object> normalizeMapping(Map<?, ?> mapping, List<String> path) {
        var out = new LinkedHashMap<String, Object>(mapping.size() * 2);
        for (var e : mapping.entrySet()) {
            String key = String.valueOf(e.getKey());
            out.put(key, normalizeValue(e.getValue(), Trees.append(path, key)));
        }
        return out;
    }

    private Object normalizeValue(Object value, List<String> path) {
        if (value instanceof Map<?, ?> m) return normalizeMapping(m, path);
        if (!(value instanceof List<?> list)) return value;

        Optional<String> keyField = resolver.resolve(path);
        if (keyField.isPresent()) return keyElements(list, path, keyField.get());

        if (allMappings(list)) {
            var out = new ArrayList<Object>(list.size());
            for (Object element : list) out.add(normalizeMapping((Map<?, ?>) element, path));
            return out;
        }
        return list;
    }

    private KeyedMapping keyElements(List<?> list, List<String> path, String keyField) {
        var keyed = new LinkedHashMap<String, Object>(list.size() * 2);
        for (int i = 0; i < list.size(); i++) {
            // A null key value counts as missing: "null" is never a usable identity.
            if (!(list.get(i) instanceof Map<?, ?> element) || element.get(keyField) == null) {
                throw new MissingMergeKeyException(Trees.join(path), i, keyField);
            }
            String key = String.valueOf(element.get(keyField));
            if (keyed.containsKey(key)) {
                throw new DuplicateMergeKeyException(Trees.join(path), keyField, key);
            }
            keyed.put(key, normalizeMapping(element, Trees.append(path, key)));
        }
        return new KeyedMapping(keyField, keyed);
    }

    private Map<String, Object> denormalizeMapping(Map<?, ?> mapping) {
        var out = new LinkedHashMap<String, Object>(mapping.size() * 2);
        for (var e : mapping.entrySet()) {
            out.put(String.valueOf(e.getKey()), denormalizeValue(e.getValue()));
        }
        return out;
    }

    private Object denormalizeValue(Object value) {
        if (value instanceof KeyedMapping keyed) {
            var elements = new ArrayList<Object>(keyed.size());
            for (Object element : keyed.values()) elements.add(denormalizeValue(element));
            return elements;
        }
        if (value instanceof Map<?, ?> m) return denormalizeMapping(m);
        if (value instanceof List<?> list && allMappings(list)) {
            var out = new ArrayList<Object>(list.size());
            for (Object element : list) out.add(denormalizeMapping((Map<?, ?>) element));
            return out;
        }
        return value;
    }

    private static boolean allMappings(List<?> list) {
        for (Object item : list) {
            if (!(item instanceof Map<?, ?>)) return false;
        }
        return true;
    }

    // ----------------- annotated trees -----------------

    /**
     * Denormalize a merged tree, keeping each leaf's annotation. Keyed mappings
     * become {@link SequenceNode}s; opaque list leaves get their nested keyed
     * content restored as well.
     */
    public MappingNode denormalize(MappingNode tree) {
        return denormalizeChildren(tree);
    }

    private MappingNode denormalizeChildren(MappingNode node) {
        var out = new LinkedHashMap<String, Node>(node.children().size() * 2);
        node.children().forEach((key, child) -> out.put(key, denormalizeNode(child)));
        return new MappingNode(out);
    }

    private Node denormalizeNode(Node node) {
        if (node instanceof MappingNode m) {
            if (!m.keyed()) return denormalizeChildren(m);

            var elements = new ArrayList<Node>(m.children().size());
            for (Node element : m.children().values()) elements.add(denormalizeNode(element));
            return new SequenceNode(elements);
        }
        if (node instanceof SequenceNode s) {
            var elements = new ArrayList<Node>(s.size());
            for (Node element : s.elements()) elements.add(denormalizeNode(element));
            return new SequenceNode(elements);
        }
        var leaf = (AnnotatedLeaf) node;
        if (leaf.value() instanceof List<?>) {
            return leaf.withValue(denormalizeValue(leaf.value()));
        }
        return leaf;
    }
}
