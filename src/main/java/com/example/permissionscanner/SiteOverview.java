package com.example.permissionscanner;

import com.example.permissionscanner.model.ContainerRow;
import com.example.permissionscanner.model.ContentNode;
import com.example.permissionscanner.model.EffectiveAccessEntry;
import com.example.permissionscanner.model.PermissionGroup;

import java.util.List;

/**
 * Web-level listings: the containers, the groups holding permissions, and who has access to the web.
 */
public record SiteOverview(
        ContentNode web,
        List<ContainerRow> containers,
        List<PermissionGroup> permissionGroups,
        List<EffectiveAccessEntry> access
) {
}
