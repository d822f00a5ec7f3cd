package com.example.permissionscanner.model;

/**
 * A node whose permissions differ from its parent's.
 */
public record BrokenInheritanceItem(
        String id,
        NodeKind kind,
        String title,
        String path
) {
    public static BrokenInheritanceItem of(ContentNode node) {
        return new BrokenInheritanceItem(node.id(), node.kind(), node.title(), node.path());
    }
}
