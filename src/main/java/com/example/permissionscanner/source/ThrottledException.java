package com.example.permissionscanner.source;

/**
 * The backend asked the caller to slow down (HTTP 429/503 or equivalent).
 */
public class ThrottledException extends SourceException {
    public ThrottledException(String message) {
        super(message, null, true);
    }

    public ThrottledException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
