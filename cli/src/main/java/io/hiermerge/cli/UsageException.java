// file: cli/src/main/java/io/hiermerge/cli/UsageException.java
package io.hiermerge.cli;

/**
 * Command-line arguments that cannot be turned into a {@link CombineConfig}.
 */
public final class UsageException extends RuntimeException {
    public UsageException(String message) {
        super(message);
    }
}
