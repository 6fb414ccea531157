// file: loader/src/main/java/io/hiermerge/loader/FragmentLoadException.java
package io.hiermerge.loader;

import io.hiermerge.core.HierMergeException;

/**
 * A fragment file could not be read, rendered or parsed. Fatal: no partial
 * fragment list is ever returned.
 */
public final class FragmentLoadException extends HierMergeException {
    private final String file;

    public FragmentLoadException(String file, String message) {
        super("An error occurred loading file %s: %s".formatted(file, message));
        this.file = file;
    }

    public FragmentLoadException(String file, String message, Throwable cause) {
        super("An error occurred loading file %s: %s".formatted(file, message), cause);
        this.file = file;
    }

    /** Offending file, or the directory when no single file is to blame. */
    public String file() { return file; }
}
