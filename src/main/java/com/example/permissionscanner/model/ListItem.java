package com.example.permissionscanner.model;

/**
 * One row of an item listing page. Ids increase monotonically within a container.
 */
public record ListItem(
        long id,
        String title,
        String path,
        boolean folder,
        boolean hasUniquePermissions
) {
    public ContentNode toNode() {
        return new ContentNode(Long.toString(id), folder ? NodeKind.FOLDER : NodeKind.ITEM, title, path, hasUniquePermissions);
    }
}
