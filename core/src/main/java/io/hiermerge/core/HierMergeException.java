// file: core/src/main/java/io/hiermerge/core/HierMergeException.java
package io.hiermerge.core;

/**
 * Base type for every failure raised while combining configuration fragments.
 * <p>
 * Failures are deterministic: the inputs are fully resolved in memory, so
 * nothing in the engine retries. Callers get either a complete result or
 * one of these.
 */
public class HierMergeException extends RuntimeException {

    public HierMergeException(String message) {
        super(message);
    }

    public HierMergeException(String message, Throwable cause) {
        super(message, cause);
    }
}
