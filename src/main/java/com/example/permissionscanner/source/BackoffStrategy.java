package com.example.permissionscanner.source;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Computes the pause before a retry.
 */
@FunctionalInterface
public interface BackoffStrategy {
    /**
     * @param retryCount   retry number, starting at 1
     * @param baseInterval base interval in milliseconds
     * @return delay in milliseconds
     */
    long calculateDelay(int retryCount, long baseInterval);

    /**
     * baseInterval * 2^(retryCount-1).
     */
    BackoffStrategy EXPONENTIAL = (retryCount, baseInterval) -> {
        long delay = baseInterval * (1L << Math.min(retryCount - 1, 30));
        return delay > 0 ? delay : Long.MAX_VALUE;
    };

    /**
     * Exponential delay scaled by a random factor in [0.5, 1.5).
     */
    BackoffStrategy EXPONENTIAL_JITTER = (retryCount, baseInterval) -> {
        long baseDelay = EXPONENTIAL.calculateDelay(retryCount, baseInterval);
        if (baseDelay == Long.MAX_VALUE) {
            return baseDelay;
        }
        double jitter = 0.5 + ThreadLocalRandom.current().nextDouble();
        return (long) (baseDelay * jitter);
    };
}
