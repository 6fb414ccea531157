// file: core/src/main/java/io/hiermerge/core/MergeKeyRule.java
package io.hiermerge.core;

import java.util.Objects;

/**
 * One row of the merge-key table: lists whose structural path matches
 * {@code pattern} are keyed by the element field {@code keyField}.
 */
public record MergeKeyRule(String pattern, String keyField) {

    public MergeKeyRule {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(keyField, "keyField");
        if (keyField.isBlank()) throw new IllegalArgumentException("keyField must not be blank");
    }
}
