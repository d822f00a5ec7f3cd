package com.example.permissionscanner.model;

/**
 * Output row pairing an access entry with the node it applies to.
 */
public record AccessRow(
        int targetSequenceNumber,
        String nodeId,
        NodeKind nodeKind,
        String nodePath,
        EffectiveAccessEntry access
) {
    public static AccessRow of(int targetSequenceNumber, ContentNode node, EffectiveAccessEntry access) {
        return new AccessRow(targetSequenceNumber, node.id(), node.kind(), node.path(), access);
    }
}
