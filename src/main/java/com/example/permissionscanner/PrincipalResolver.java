package com.example.permissionscanner;

import com.example.permissionscanner.model.AccessPathStep;
import com.example.permissionscanner.model.EffectiveAccessEntry;
import com.example.permissionscanner.model.GroupKind;
import com.example.permissionscanner.model.Principal;
import com.example.permissionscanner.model.PrincipalKind;
import com.example.permissionscanner.model.ResolutionStatus;
import com.example.permissionscanner.source.DirectorySource;
import com.example.permissionscanner.source.SiteSession;
import com.example.permissionscanner.source.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Flattens principals into the users that hold access through them.
 *
 * <p>Each group is expanded relative to itself, cached in the {@link ResolutionContext}, and re-based onto
 * the path of the caller. Groups already being expanded on the current path are skipped, so membership
 * cycles terminate; groups deeper than the nesting limit are reported as a single
 * {@link ResolutionStatus#DEPTH_EXCEEDED} entry instead of being fetched.
 */
public final class PrincipalResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(PrincipalResolver.class);
    static final String SHARING_LINK_PREFIX = "SharingLinks.";

    private final DirectorySource directory;
    private final int maxDepth;
    private final Set<String> doNotResolve;
    private final ScannerConfig config;

    public PrincipalResolver(ScannerConfig config, DirectorySource directory) {
        this.config = config;
        this.directory = directory;
        this.maxDepth = config.maxGroupNestingLevel();
        this.doNotResolve = Set.copyOf(config.doNotResolveGroups());
    }

    public List<EffectiveAccessEntry> resolve(ResolutionContext context, SiteSession site, Principal principal) {
        return resolve(context, site, principal, 0, List.of());
    }

    /**
     * Resolves {@code principal} reached at {@code depth} through the groups in {@code path}.
     * Never throws for backend failures; those become {@link ResolutionStatus#UNRESOLVED} entries.
     */
    public List<EffectiveAccessEntry> resolve(ResolutionContext context,
                                              SiteSession site,
                                              Principal principal,
                                              int depth,
                                              List<AccessPathStep> path) {
        if (isExcluded(principal)) {
            LOGGER.debug("Not expanding excluded principal '{}'", principal.displayName());
            return List.of(EffectiveAccessEntry.sentinel(principal, ResolutionStatus.OPAQUE, path, maxDepth));
        }
        if (!principal.isGroup()) {
            return List.of(EffectiveAccessEntry.resolved(principal, path, maxDepth));
        }
        if (depth > maxDepth) {
            LOGGER.warn("Max nesting level ({}) reached for group '{}'", maxDepth, principal.displayName());
            return List.of(EffectiveAccessEntry.sentinel(principal, ResolutionStatus.DEPTH_EXCEEDED, path, maxDepth));
        }
        Deque<String> inProgress = new ArrayDeque<>();
        for (AccessPathStep step : path) {
            inProgress.push(step.groupId());
        }
        if (inProgress.contains(principal.id())) {
            LOGGER.debug("Group '{}' already on access path {}, skipping", principal.displayName(), path);
            return List.of();
        }

        GroupExpansion expansion = expand(context, site, principal, inProgress, maxDepth - depth);
        Set<EffectiveAccessEntry> entries = new LinkedHashSet<>();
        for (EffectiveAccessEntry entry : expansion.entries()) {
            entries.add(clip(entry.rebase(path, maxDepth)));
        }
        return List.copyOf(entries);
    }

    /**
     * Expands {@code group} relative to itself; nested groups may go {@code budget} levels deeper.
     */
    private GroupExpansion expand(ResolutionContext context,
                                  SiteSession site,
                                  Principal group,
                                  Deque<String> inProgress,
                                  int budget) {
        Optional<List<EffectiveAccessEntry>> cached = context.cached(group.kind(), group.id());
        if (cached.isPresent()) {
            LOGGER.debug("Using {} cached entries for group '{}'", cached.get().size(), group.displayName());
            return reuse(cached.get(), inProgress);
        }

        List<Principal> members;
        try {
            LOGGER.debug("Fetching members of {} '{}'", group.kind(), group.displayName());
            members = fetchMembers(site, group);
        } catch (SourceException ex) {
            LOGGER.warn("Failed to resolve members of group '{}' ({}): {}", group.displayName(), group.id(), ex.getMessage());
            return GroupExpansion.failed(EffectiveAccessEntry.sentinel(group, ResolutionStatus.UNRESOLVED, List.of(), maxDepth));
        }

        List<AccessPathStep> here = List.of(stepFor(group));
        Set<EffectiveAccessEntry> entries = new LinkedHashSet<>();
        Set<String> cuts = new HashSet<>();
        boolean failed = false;
        boolean truncated = false;
        inProgress.push(group.id());
        try {
            for (Principal member : members) {
                if (config.isIgnoredAccount(member.loginName())) {
                    continue;
                }
                if (isExcluded(member)) {
                    entries.add(EffectiveAccessEntry.sentinel(member, ResolutionStatus.OPAQUE, here, maxDepth));
                } else if (!member.isGroup()) {
                    entries.add(EffectiveAccessEntry.resolved(member, here, maxDepth));
                } else if (inProgress.contains(member.id())) {
                    LOGGER.debug("Membership cycle: '{}' contains '{}' which is already being expanded",
                            group.displayName(), member.displayName());
                    cuts.add(member.id());
                } else if (budget <= 0) {
                    entries.add(EffectiveAccessEntry.sentinel(member, ResolutionStatus.DEPTH_EXCEEDED, here, maxDepth));
                    truncated = true;
                } else {
                    GroupExpansion nested = expand(context, site, member, inProgress, budget - 1);
                    cuts.addAll(nested.cuts());
                    failed |= nested.failed();
                    truncated |= nested.truncated();
                    for (EffectiveAccessEntry entry : nested.entries()) {
                        entries.add(clip(entry.rebase(here, maxDepth)));
                    }
                }
            }
        } finally {
            inProgress.pop();
        }
        cuts.remove(group.id());

        List<EffectiveAccessEntry> result = List.copyOf(entries);
        // Only expansions that do not depend on the caller's path or a failed lookup are reusable.
        if (cuts.isEmpty() && !failed && (!truncated || budget == maxDepth)) {
            context.store(group.kind(), group.id(), result);
        }
        LOGGER.debug("{} entries resolved for group '{}'", result.size(), group.displayName());
        return new GroupExpansion(result, cuts, failed, truncated);
    }

    /**
     * Drops cached entries that lead back through a group currently being expanded; those ids count as cuts.
     */
    private static GroupExpansion reuse(List<EffectiveAccessEntry> cached, Deque<String> inProgress) {
        List<EffectiveAccessEntry> usable = new ArrayList<>(cached.size());
        Set<String> cuts = new HashSet<>();
        for (EffectiveAccessEntry entry : cached) {
            String revisited = null;
            for (AccessPathStep step : entry.accessPath()) {
                if (inProgress.contains(step.groupId())) {
                    revisited = step.groupId();
                    break;
                }
            }
            if (revisited == null) {
                usable.add(entry);
            } else {
                cuts.add(revisited);
            }
        }
        return new GroupExpansion(usable, cuts, false, false);
    }

    private List<Principal> fetchMembers(SiteSession site, Principal group) throws SourceException {
        if (group.kind() == PrincipalKind.DIRECTORY_GROUP) {
            return directory.getGroupMembers(group.id());
        }
        return site.getGroupMembers(group.id());
    }

    /**
     * Replaces an entry that lies below the nesting limit with a sentinel for the first group past the limit.
     */
    private EffectiveAccessEntry clip(EffectiveAccessEntry entry) {
        int limit = maxDepth + 1;
        List<AccessPathStep> path = entry.accessPath();
        if (path.size() <= limit) {
            return entry;
        }
        AccessPathStep hidden = path.get(limit);
        Principal group = new Principal(
                hidden.groupId(),
                hidden.groupKind() == GroupKind.DIRECTORY_GROUP ? PrincipalKind.DIRECTORY_GROUP : PrincipalKind.CONTAINER_GROUP,
                hidden.groupId(),
                hidden.groupTitle(),
                null
        );
        return EffectiveAccessEntry.sentinel(group, ResolutionStatus.DEPTH_EXCEEDED, path.subList(0, limit), maxDepth)
                .withPermissionLevel(entry.permissionLevel());
    }

    private AccessPathStep stepFor(Principal group) {
        GroupKind kind;
        if (group.kind() == PrincipalKind.DIRECTORY_GROUP) {
            kind = GroupKind.DIRECTORY_GROUP;
        } else if (group.displayName() != null && group.displayName().startsWith(SHARING_LINK_PREFIX)) {
            kind = GroupKind.SHARING_LINK;
        } else {
            kind = GroupKind.CONTAINER_GROUP;
        }
        return new AccessPathStep(group.id(), kind, group.displayName());
    }

    boolean isExcluded(Principal principal) {
        return matches(doNotResolve, principal.id())
                || matches(doNotResolve, principal.loginName())
                || matches(doNotResolve, principal.displayName());
    }

    private static boolean matches(Collection<String> values, String candidate) {
        return candidate != null && values.contains(candidate);
    }

    private record GroupExpansion(
            List<EffectiveAccessEntry> entries,
            Set<String> cuts,
            boolean failed,
            boolean truncated
    ) {
        static GroupExpansion failed(EffectiveAccessEntry sentinel) {
            return new GroupExpansion(List.of(sentinel), Set.of(), true, false);
        }
    }
}
