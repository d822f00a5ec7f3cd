package com.example.permissionscanner;

import com.example.permissionscanner.model.ContentNode;
import com.example.permissionscanner.model.EffectiveAccessEntry;
import com.example.permissionscanner.model.NodeKind;

import java.util.List;

/**
 * One step of a container walk.
 *
 * @param containerIndex position of the walk unit the node belongs to
 * @param itemIndex      position of the item within its unit, -1 for the unit's own web or container node
 * @param node           the node visited
 * @param access         resolved access for nodes with unique permissions, empty otherwise
 * @param overview       listings of a subsite web node, null for every other node
 * @param error          why the node's permissions could not be read, null on success
 */
public record EnumeratedNode(
        int containerIndex,
        long itemIndex,
        ContentNode node,
        List<EffectiveAccessEntry> access,
        SiteOverview overview,
        String error
) {
    public boolean isItem() {
        return itemIndex >= 0;
    }

    public boolean isBroken() {
        return node.hasUniquePermissions();
    }

    public boolean isWeb() {
        return node.kind() == NodeKind.WEB;
    }
}
