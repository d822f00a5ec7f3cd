package com.example.permissionscanner.model;

/**
 * Per-target progress row, the human-readable companion of {@link Checkpoint}.
 */
public record TargetSummary(
        int targetSequenceNumber,
        String url,
        TargetKind kind,
        int lastContainerIndex,
        long lastItemIndex,
        long itemsScanned,
        long brokenPermissionCount,
        long externalUsersFound,
        long itemsSharedWithEveryone,
        String outcome
) {
    public static TargetSummary of(ScanTarget target, Checkpoint checkpoint, String outcome) {
        return new TargetSummary(
                target.sequenceNumber(),
                target.url(),
                target.kind(),
                checkpoint.lastContainerIndex(),
                checkpoint.lastItemIndex(),
                checkpoint.itemsScanned(),
                checkpoint.brokenPermissionCount(),
                checkpoint.externalUsersFound(),
                checkpoint.itemsSharedWithEveryone(),
                outcome
        );
    }
}
