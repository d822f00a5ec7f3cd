package com.example.permissionscanner;

import com.example.permissionscanner.model.RecordKind;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Destination of scan output. A batch is either written completely or the call fails; the orchestrator only
 * records a checkpoint after the batch was accepted.
 */
public interface OutputSink extends Closeable {
    void writeBatch(RecordKind kind, List<?> rows) throws IOException;

    @Override
    default void close() throws IOException {
        // no-op
    }
}
