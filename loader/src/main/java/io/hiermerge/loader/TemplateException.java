// file: loader/src/main/java/io/hiermerge/loader/TemplateException.java
package io.hiermerge.loader;

import io.hiermerge.core.HierMergeException;

/** Template text could not be rendered. */
public final class TemplateException extends HierMergeException {

    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
