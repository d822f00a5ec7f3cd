package com.example.permissionscanner.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One principal's access to a node, together with the chain of groups it was granted through.
 * Entries with a status other than {@link ResolutionStatus#RESOLVED} describe a group that was
 * left unexpanded; their access path leads up to, but does not include, that group.
 */
public record EffectiveAccessEntry(
        String principalLogin,
        String displayName,
        String email,
        String permissionLevel,
        List<AccessPathStep> accessPath,
        int nestingDepth,
        AssignmentKind assignmentKind,
        ResolutionStatus status
) {
    public EffectiveAccessEntry {
        accessPath = List.copyOf(accessPath);
    }

    public static EffectiveAccessEntry resolved(Principal user, List<AccessPathStep> path, int maxDepth) {
        return of(user, path, maxDepth, ResolutionStatus.RESOLVED);
    }

    public static EffectiveAccessEntry sentinel(Principal group,
                                                ResolutionStatus status,
                                                List<AccessPathStep> path,
                                                int maxDepth) {
        return of(group, path, maxDepth, status);
    }

    private static EffectiveAccessEntry of(Principal principal,
                                           List<AccessPathStep> path,
                                           int maxDepth,
                                           ResolutionStatus status) {
        return new EffectiveAccessEntry(
                principal.loginName(),
                principal.displayName(),
                principal.email(),
                null,
                path,
                nestingDepthFor(path.size(), maxDepth),
                AssignmentKind.forPath(path),
                status
        );
    }

    static int nestingDepthFor(int pathLength, int maxDepth) {
        return Math.max(0, Math.min(pathLength - 1, maxDepth));
    }

    /**
     * Returns a copy reached through {@code prefix} ahead of the current path.
     */
    public EffectiveAccessEntry rebase(List<AccessPathStep> prefix, int maxDepth) {
        if (prefix.isEmpty()) {
            return this;
        }
        List<AccessPathStep> path = new ArrayList<>(prefix.size() + accessPath.size());
        path.addAll(prefix);
        path.addAll(accessPath);
        return new EffectiveAccessEntry(
                principalLogin,
                displayName,
                email,
                permissionLevel,
                path,
                nestingDepthFor(path.size(), maxDepth),
                AssignmentKind.forPath(path),
                status
        );
    }

    public EffectiveAccessEntry withPermissionLevel(String level) {
        return new EffectiveAccessEntry(
                principalLogin,
                displayName,
                email,
                level,
                accessPath,
                nestingDepth,
                assignmentKind,
                status
        );
    }

    /**
     * Id of the group that granted the access, or null for a direct assignment.
     */
    public String rootGroupId() {
        return accessPath.isEmpty() ? null : accessPath.get(0).groupId();
    }
}
