package com.example.permissionscanner.source;

import com.example.permissionscanner.model.Principal;
import com.example.permissionscanner.model.RoleAssignment;

import java.util.List;

/**
 * Serialized export of a tenant's webs, containers, items, groups and role assignments.
 */
public record TenantSnapshot(
        List<Web> webs,
        List<DirectoryGroup> directoryGroups
) {
    public TenantSnapshot {
        webs = webs == null ? List.of() : List.copyOf(webs);
        directoryGroups = directoryGroups == null ? List.of() : List.copyOf(directoryGroups);
    }

    public record Web(
            String url,
            String id,
            String title,
            boolean hasUniquePermissions,
            List<RoleAssignment> roleAssignments,
            List<Group> siteGroups,
            List<Container> containers
    ) {
        public Web {
            roleAssignments = roleAssignments == null ? List.of() : List.copyOf(roleAssignments);
            siteGroups = siteGroups == null ? List.of() : List.copyOf(siteGroups);
            containers = containers == null ? List.of() : List.copyOf(containers);
        }
    }

    public record Group(
            String id,
            String title,
            String ownerTitle,
            List<Principal> members
    ) {
        public Group {
            members = members == null ? List.of() : List.copyOf(members);
        }
    }

    public record Container(
            String id,
            String title,
            String path,
            int baseTemplate,
            boolean hidden,
            boolean hasUniquePermissions,
            List<RoleAssignment> roleAssignments,
            List<Item> items
    ) {
        public Container {
            roleAssignments = roleAssignments == null ? List.of() : List.copyOf(roleAssignments);
            items = items == null ? List.of() : List.copyOf(items);
        }
    }

    public record Item(
            long id,
            String title,
            String path,
            boolean folder,
            boolean hasUniquePermissions,
            List<RoleAssignment> roleAssignments
    ) {
        public Item {
            roleAssignments = roleAssignments == null ? List.of() : List.copyOf(roleAssignments);
        }
    }

    public record DirectoryGroup(
            String id,
            List<Principal> members
    ) {
        public DirectoryGroup {
            members = members == null ? List.of() : List.copyOf(members);
        }
    }
}
