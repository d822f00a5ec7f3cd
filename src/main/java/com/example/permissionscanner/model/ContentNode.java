package com.example.permissionscanner.model;

/**
 * A web, list, folder or item discovered during the walk.
 */
public record ContentNode(
        String id,
        NodeKind kind,
        String title,
        String path,
        boolean hasUniquePermissions
) {
}
