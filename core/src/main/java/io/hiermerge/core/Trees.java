// file: core/src/main/java/io/hiermerge/core/Trees.java
package io.hiermerge.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for plain configuration trees: mappings with string keys,
 * lists, and scalars ({@code String}, {@code Number}, {@code Boolean}, {@code null}).
 */
public final class Trees {

    /** Delimiter used when a structural path is matched or reported. */
    public static final String PATH_DELIMITER = ":";

    private Trees() {
        // utility
    }

    /**
     * Deep copy into unmodifiable, insertion-ordered collections.
     * Mapping keys are converted with {@link String#valueOf(Object)}; nested
     * {@link KeyedMapping}s keep their type.
     */
    public static Map<String, Object> immutableCopy(Map<?, ?> mapping) {
        var out = new LinkedHashMap<String, Object>(mapping.size() * 2);
        for (var e : mapping.entrySet()) {
            out.put(String.valueOf(e.getKey()), immutableCopyOf(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    private static Object immutableCopyOf(Object value) {
        if (value instanceof KeyedMapping k) return new KeyedMapping(k.keyField(), immutableCopy(k));
        if (value instanceof Map<?, ?> m) return immutableCopy(m);
        if (value instanceof List<?> l) {
            var out = new ArrayList<Object>(l.size());
            for (Object item : l) out.add(immutableCopyOf(item));
            return Collections.unmodifiableList(out);
        }
        return value;
    }

    /**
     * Empty means undefined for merge purposes: null, "", or an empty collection.
     * {@code false} and {@code 0} are defined values.
     */
    public static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof CharSequence s) return s.length() == 0;
        if (value instanceof Collection<?> c) return c.isEmpty();
        if (value instanceof Map<?, ?> m) return m.isEmpty();
        return false;
    }

    /** New path with {@code key} appended; the input is not modified. */
    static List<String> append(List<String> path, String key) {
        var out = new ArrayList<String>(path.size() + 1);
        out.addAll(path);
        out.add(key);
        return Collections.unmodifiableList(out);
    }

    public static String join(List<String> path) {
        return String.join(PATH_DELIMITER, path);
    }
}
