package com.example.permissionscanner.model;

/**
 * Result of resolving a server-relative path to a folder inside a container.
 *
 * @param containerId id of the list or library holding the folder
 * @param path        server-relative path of the folder
 * @param parentPath  server-relative path of the folder's parent
 */
public record FolderLocation(
        String containerId,
        String path,
        String parentPath
) {
}
