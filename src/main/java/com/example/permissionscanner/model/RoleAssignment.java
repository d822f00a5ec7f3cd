package com.example.permissionscanner.model;

import java.util.List;

/**
 * A principal bound to one or more permission levels on a securable node.
 */
public record RoleAssignment(
        Principal principal,
        List<String> permissionLevels
) {
    public RoleAssignment {
        permissionLevels = List.copyOf(permissionLevels);
    }
}
