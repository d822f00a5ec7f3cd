package com.example.permissionscanner;

import java.nio.file.Path;

/**
 * Receives every batch file once it is fully written.
 */
@FunctionalInterface
public interface BatchFileSyncer extends AutoCloseable {
    void enqueue(Path path);

    @Override
    default void close() {
        // no-op
    }

    static BatchFileSyncer noop() {
        return path -> {
        };
    }
}
