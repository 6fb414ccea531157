// file: core/src/main/java/io/hiermerge/core/MalformedAnnotationException.java
package io.hiermerge.core;

/**
 * An annotated leaf lacks provenance. Never caused by user input; it means
 * the merger produced a tree it should not have.
 */
public final class MalformedAnnotationException extends HierMergeException {

    MalformedAnnotationException(String message) {
        super(message);
    }
}
