package com.example.permissionscanner.model;

/**
 * Serializable scan progress. Item index -1 points at the container node itself.
 */
public record Checkpoint(
        int targetSequenceNumber,
        int lastContainerIndex,
        long lastItemIndex,
        long itemsScanned,
        long brokenPermissionCount,
        long externalUsersFound,
        long itemsSharedWithEveryone
) {
    public static Checkpoint startOf(int targetSequenceNumber) {
        return new Checkpoint(targetSequenceNumber, 0, -1, 0, 0, 0, 0);
    }

    /**
     * True if {@code other} points at the same or an earlier position in the same target.
     */
    public boolean isAtOrAfter(Checkpoint other) {
        if (targetSequenceNumber != other.targetSequenceNumber) {
            return targetSequenceNumber > other.targetSequenceNumber;
        }
        if (lastContainerIndex != other.lastContainerIndex) {
            return lastContainerIndex > other.lastContainerIndex;
        }
        return lastItemIndex >= other.lastItemIndex;
    }
}
