package com.example.permissionscanner.source;

import com.example.permissionscanner.model.RetryAttempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded retry for backend calls. Only {@link SourceException#isRetryable() retryable} failures are repeated.
 */
public final class RetryPolicy {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long baseDelayMillis;
    private final long maxDelayMillis;
    private final BackoffStrategy backoff;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long baseDelayMillis, long maxDelayMillis) {
        this(maxAttempts, baseDelayMillis, maxDelayMillis, BackoffStrategy.EXPONENTIAL_JITTER, Thread::sleep);
    }

    public RetryPolicy(int maxAttempts,
                       long baseDelayMillis,
                       long maxDelayMillis,
                       BackoffStrategy backoff,
                       Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMillis = baseDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    /**
     * Delay before retry number {@code retryCount}, capped at the configured maximum.
     */
    long delayFor(int retryCount) {
        return Math.min(backoff.calculateDelay(retryCount, baseDelayMillis), maxDelayMillis);
    }

    public <T> T execute(String operation, SourceCall<T> call) throws SourceException {
        List<RetryAttempt> attempts = new ArrayList<>();
        for (int attempt = 1; ; attempt++) {
            try {
                return call.call();
            } catch (SourceException ex) {
                if (!ex.isRetryable()) {
                    throw ex;
                }
                attempts.add(new RetryAttempt(attempt, Instant.now(), ex.getMessage()));
                if (attempt >= maxAttempts) {
                    throw new RetriesExhaustedException(operation, attempts, ex);
                }
                long delay = delayFor(attempt);
                LOGGER.warn("{} failed on attempt {}/{}; retrying in {} ms: {}",
                        operation, attempt, maxAttempts, delay, ex.getMessage());
                pause(operation, delay);
            }
        }
    }

    private void pause(String operation, long delay) throws SourceException {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SourceException("Interrupted while waiting to retry " + operation, ex);
        }
    }
}
