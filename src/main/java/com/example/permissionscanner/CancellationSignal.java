package com.example.permissionscanner;

import java.util.concurrent.atomic.AtomicBoolean;

public interface CancellationSignal {
    /**
     * Returns true if the scan should stop after {@code processedCount} nodes.
     */
    boolean isCancelled(long processedCount);

    /**
     * Default signal used in production runs without an item limit (never cancels).
     */
    CancellationSignal NEVER = processedCount -> false;

    static CancellationSignal of(AtomicBoolean flag) {
        return processedCount -> flag.get();
    }

    static CancellationSignal afterNodes(long limit) {
        return processedCount -> processedCount >= limit;
    }

    default CancellationSignal or(CancellationSignal other) {
        return processedCount -> isCancelled(processedCount) || other.isCancelled(processedCount);
    }
}
