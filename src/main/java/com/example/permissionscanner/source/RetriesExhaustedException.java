package com.example.permissionscanner.source;

import com.example.permissionscanner.model.RetryAttempt;

import java.util.List;

/**
 * Raised when a retryable call still fails after the last allowed attempt.
 */
public class RetriesExhaustedException extends SourceException {
    private final List<RetryAttempt> attempts;

    public RetriesExhaustedException(String operation, List<RetryAttempt> attempts, SourceException last) {
        super(operation + " failed after " + attempts.size() + " attempts: " + last.getMessage(), last, false);
        this.attempts = List.copyOf(attempts);
    }

    public List<RetryAttempt> getAttempts() {
        return attempts;
    }
}
