package com.example.permissionscanner.model;

import java.util.Locale;

/**
 * A container-scoped group that holds a permission level on the scanned web.
 */
public record PermissionGroup(
        String id,
        String roleName,
        String title,
        String assignedPermissionLevel,
        boolean ownerGroup,
        String ownerTitle
) {
    public static final String ROLE_OWNERS = "SiteOwners";
    public static final String ROLE_MEMBERS = "SiteMembers";
    public static final String ROLE_VISITORS = "SiteVisitors";
    public static final String ROLE_CUSTOM = "Custom";

    public static PermissionGroup of(SiteGroup group, String permissionLevel) {
        String role = roleFor(group.title());
        return new PermissionGroup(
                group.id(),
                role,
                group.title(),
                permissionLevel,
                ROLE_OWNERS.equals(role),
                group.ownerTitle()
        );
    }

    static String roleFor(String title) {
        String lower = title == null ? "" : title.toLowerCase(Locale.ROOT);
        if (lower.contains("owner")) {
            return ROLE_OWNERS;
        }
        if (lower.contains("member")) {
            return ROLE_MEMBERS;
        }
        if (lower.contains("visitor")) {
            return ROLE_VISITORS;
        }
        return ROLE_CUSTOM;
    }
}
