package com.example.permissionscanner.source;

import com.example.permissionscanner.model.Principal;

import java.util.List;

/**
 * Identity backend holding directory groups. Members may be users or further directory groups;
 * backends that flatten membership simply return users only.
 */
@FunctionalInterface
public interface DirectorySource {
    List<Principal> getGroupMembers(String groupId) throws SourceException;

    /**
     * Used when no identity backend is configured: every lookup fails and resolves to an unresolved entry.
     */
    static DirectorySource unavailable() {
        return groupId -> {
            throw new SourceException("No directory backend configured for group " + groupId);
        };
    }
}
