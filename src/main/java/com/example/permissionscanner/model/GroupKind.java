package com.example.permissionscanner.model;

/**
 * Kind of group recorded on an access path.
 */
public enum GroupKind {
    CONTAINER_GROUP,
    DIRECTORY_GROUP,
    SHARING_LINK
}
