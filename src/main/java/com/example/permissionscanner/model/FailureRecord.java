package com.example.permissionscanner.model;

import java.time.Instant;
import java.util.List;

/**
 * A target that could not be scanned, written to the failures listing.
 */
public class FailureRecord {
    private final int targetSequenceNumber;
    private final String reference;
    private final String phase;
    private final Instant failedAt;
    private final String error;
    private final List<RetryAttempt> retryAttempts;

    public FailureRecord(int targetSequenceNumber,
                         String reference,
                         String phase,
                         Instant failedAt,
                         String error,
                         List<RetryAttempt> retryAttempts) {
        this.targetSequenceNumber = targetSequenceNumber;
        this.reference = reference;
        this.phase = phase;
        this.failedAt = failedAt;
        this.error = error;
        this.retryAttempts = List.copyOf(retryAttempts);
    }

    public int getTargetSequenceNumber() {
        return targetSequenceNumber;
    }

    public String getReference() {
        return reference;
    }

    public String getPhase() {
        return phase;
    }

    public Instant getFailedAt() {
        return failedAt;
    }

    public String getError() {
        return error;
    }

    public List<RetryAttempt> getRetryAttempts() {
        return retryAttempts;
    }
}
