// file: core/src/main/java/io/hiermerge/core/MissingMergeKeyException.java
package io.hiermerge.core;

/**
 * A list selected for keyed merging holds an element that is not a mapping,
 * or a mapping without the configured key field.
 */
public final class MissingMergeKeyException extends HierMergeException {
    private final String path;
    private final int index;
    private final String keyField;

    MissingMergeKeyException(String path, int index, String keyField) {
        super("Cannot find merge key '%s' in element %d of list %s".formatted(keyField, index, path));
        this.path = path;
        this.index = index;
        this.keyField = keyField;
    }

    public String path() { return path; }

    public int index() { return index; }

    public String keyField() { return keyField; }
}
