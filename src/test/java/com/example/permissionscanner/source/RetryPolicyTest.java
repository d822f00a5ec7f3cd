package com.example.permissionscanner.source;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {
    private final List<Long> sleeps = new ArrayList<>();

    @Test
    void retriesThrottledCallsUntilSuccess() throws Exception {
        RetryPolicy policy = new RetryPolicy(5, 100, 1_000, BackoffStrategy.EXPONENTIAL, sleeps::add);
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute("listItems", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new ThrottledException("429 Too Many Requests");
            }
            return "page";
        });

        assertEquals("page", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(100L, 200L), sleeps);
    }

    @Test
    void givesUpAfterMaxAttemptsWithHistory() {
        RetryPolicy policy = new RetryPolicy(3, 100, 1_000, BackoffStrategy.EXPONENTIAL, sleeps::add);

        RetriesExhaustedException ex = assertThrows(RetriesExhaustedException.class,
                () -> policy.execute("getGroupMembers 7", () -> {
                    throw new ThrottledException("503 Server Too Busy");
                }));

        assertEquals(3, ex.getAttempts().size());
        assertEquals(3, ex.getAttempts().get(2).attempt());
        assertEquals("503 Server Too Busy", ex.getAttempts().get(0).error());
        assertEquals(2, sleeps.size());
        assertTrue(ex.getMessage().startsWith("getGroupMembers 7 failed after 3 attempts"));
    }

    @Test
    void nonRetryableFailurePropagatesImmediately() {
        RetryPolicy policy = new RetryPolicy(5, 100, 1_000, BackoffStrategy.EXPONENTIAL, sleeps::add);
        AtomicInteger calls = new AtomicInteger();

        SourceException ex = assertThrows(SourceException.class, () -> policy.execute("connect", () -> {
            calls.incrementAndGet();
            throw new SourceException("404 Not Found");
        }));

        assertEquals("404 Not Found", ex.getMessage());
        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void jitteredDelayStaysWithinBoundsAndCap() {
        RetryPolicy policy = new RetryPolicy(10, 1_000, 60_000, BackoffStrategy.EXPONENTIAL_JITTER, sleeps::add);

        for (int i = 0; i < 50; i++) {
            long first = policy.delayFor(1);
            assertTrue(first >= 500 && first < 1_500, "delay " + first);
            long third = policy.delayFor(3);
            assertTrue(third >= 2_000 && third < 6_000, "delay " + third);
            assertTrue(policy.delayFor(12) <= 60_000);
        }
    }

    @Test
    void retryingDirectorySourceRetriesThrottling() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        DirectorySource flaky = groupId -> {
            if (calls.incrementAndGet() == 1) {
                throw new ThrottledException("429");
            }
            return List.of();
        };
        RetryPolicy policy = new RetryPolicy(2, 10, 10, BackoffStrategy.EXPONENTIAL, sleeps::add);

        assertTrue(new RetryingDirectorySource(flaky, policy).getGroupMembers("dg-1").isEmpty());
        assertEquals(2, calls.get());
        assertThrows(SourceException.class,
                () -> new RetryingDirectorySource(DirectorySource.unavailable(), policy).getGroupMembers("dg-1"));
    }
}
