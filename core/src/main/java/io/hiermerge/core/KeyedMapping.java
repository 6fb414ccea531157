// file: core/src/main/java/io/hiermerge/core/KeyedMapping.java
package io.hiermerge.core;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A keyed list in its normalized form: element key to element, in list order.
 * <p>
 * Only mappings of this type are turned back into lists on denormalization,
 * so an ordinary mapping whose path happens to match a merge-key pattern keeps
 * its shape. Read-only; equals and hashCode follow {@link Map}.
 */
public final class KeyedMapping extends AbstractMap<String, Object> {
    private final String keyField;
    private final Map<String, Object> elements;

    public KeyedMapping(String keyField, Map<String, ?> elements) {
        this.keyField = Objects.requireNonNull(keyField, "keyField");
        this.elements = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(elements));
    }

    /** Field of each element that supplied its key. */
    public String keyField() { return keyField; }

    @Override
    public Set<Entry<String, Object>> entrySet() { return elements.entrySet(); }

    @Override
    public Object get(Object key) { return elements.get(key); }

    @Override
    public boolean containsKey(Object key) { return elements.containsKey(key); }

    @Override
    public int size() { return elements.size(); }
}
