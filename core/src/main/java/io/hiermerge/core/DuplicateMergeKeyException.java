// file: core/src/main/java/io/hiermerge/core/DuplicateMergeKeyException.java
package io.hiermerge.core;

/** Two elements of the same keyed list share a key value. */
public final class DuplicateMergeKeyException extends HierMergeException {
    private final String path;
    private final String keyValue;

    DuplicateMergeKeyException(String path, String keyField, String keyValue) {
        super("Duplicate merge key %s='%s' in list %s".formatted(keyField, keyValue, path));
        this.path = path;
        this.keyValue = keyValue;
    }

    public String path() { return path; }

    public String keyValue() { return keyValue; }
}
