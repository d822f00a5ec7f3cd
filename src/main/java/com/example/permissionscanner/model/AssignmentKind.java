package com.example.permissionscanner.model;

import java.util.List;

public enum AssignmentKind {
    DIRECT,
    VIA_GROUP,
    VIA_SHARING_LINK;

    /**
     * Derives the assignment kind from the groups a principal was reached through.
     */
    public static AssignmentKind forPath(List<AccessPathStep> path) {
        if (path.isEmpty()) {
            return DIRECT;
        }
        for (AccessPathStep step : path) {
            if (step.groupKind() == GroupKind.SHARING_LINK) {
                return VIA_SHARING_LINK;
            }
        }
        return VIA_GROUP;
    }
}
