package com.example.permissionscanner.source;

/**
 * Failure reported by a content or directory backend.
 */
public class SourceException extends Exception {
    private final boolean retryable;

    public SourceException(String message) {
        this(message, null, false);
    }

    public SourceException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public SourceException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * Whether repeating the same call may succeed.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
