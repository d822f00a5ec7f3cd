package com.example.permissionscanner.model;

/**
 * Marks whether an access entry names a concrete user or stands in for a group that was not expanded.
 */
public enum ResolutionStatus {
    RESOLVED,
    /** Group on the exclusion list, reported as-is. */
    OPAQUE,
    DEPTH_EXCEEDED,
    /** Membership could not be fetched. */
    UNRESOLVED
}
