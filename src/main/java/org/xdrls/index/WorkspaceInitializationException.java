package org.xdrls.index;

/**
 * Thrown when the workspace root cannot be indexed at all, for example because it does not
 * exist or is not a directory. No partial index is served after this error.
 */
public class WorkspaceInitializationException extends RuntimeException {

    public WorkspaceInitializationException(String message) {
        super(message);
    }

    public WorkspaceInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
