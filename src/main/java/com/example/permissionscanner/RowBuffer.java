package com.example.permissionscanner;

import com.example.permissionscanner.model.RecordKind;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collects output rows per record kind until the batch threshold is reached. Single writer: only the
 * orchestrator thread touches it.
 */
final class RowBuffer {
    private final OutputSink sink;
    private final int threshold;
    private final Map<RecordKind, List<Object>> rows = new EnumMap<>(RecordKind.class);
    private int size;

    RowBuffer(OutputSink sink, int threshold) {
        this.sink = sink;
        this.threshold = threshold;
    }

    void add(RecordKind kind, Object row) {
        rows.computeIfAbsent(kind, ignored -> new ArrayList<>()).add(row);
        size++;
    }

    void addAll(RecordKind kind, List<?> batch) {
        for (Object row : batch) {
            add(kind, row);
        }
    }

    boolean isFull() {
        return size >= threshold;
    }

    int size() {
        return size;
    }

    /**
     * Hands every buffered kind to the sink in declaration order. Rows stay buffered if the sink fails.
     */
    void flush() throws IOException {
        if (size == 0) {
            return;
        }
        for (Map.Entry<RecordKind, List<Object>> entry : rows.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                sink.writeBatch(entry.getKey(), List.copyOf(entry.getValue()));
                size -= entry.getValue().size();
                entry.getValue().clear();
            }
        }
    }
}
