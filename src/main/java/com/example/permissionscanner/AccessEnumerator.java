package com.example.permissionscanner;

import com.example.permissionscanner.model.Checkpoint;
import com.example.permissionscanner.model.ContainerDescriptor;
import com.example.permissionscanner.model.ContainerRow;
import com.example.permissionscanner.model.ContentNode;
import com.example.permissionscanner.model.EffectiveAccessEntry;
import com.example.permissionscanner.model.PermissionGroup;
import com.example.permissionscanner.model.Principal;
import com.example.permissionscanner.model.PrincipalKind;
import com.example.permissionscanner.model.RoleAssignment;
import com.example.permissionscanner.model.ScanTarget;
import com.example.permissionscanner.model.SiteGroup;
import com.example.permissionscanner.model.TargetKind;
import com.example.permissionscanner.source.SecurableRef;
import com.example.permissionscanner.source.SiteConnector;
import com.example.permissionscanner.source.SiteSession;
import com.example.permissionscanner.source.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Walks the content of a classified target and computes effective access wherever inheritance is broken.
 */
public final class AccessEnumerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(AccessEnumerator.class);

    private final ScannerConfig config;
    private final SiteConnector connector;
    private final PrincipalResolver resolver;
    private final ExecutorService fetchPool;

    /**
     * @param fetchPool runs read-only role assignment lookups ahead of the walk
     */
    public AccessEnumerator(ScannerConfig config, SiteConnector connector, PrincipalResolver resolver, ExecutorService fetchPool) {
        this.config = config;
        this.connector = connector;
        this.resolver = resolver;
        this.fetchPool = fetchPool;
    }

    /**
     * Lists the web's containers and permission groups and resolves who has access to the web itself.
     */
    public SiteOverview describeSite(SiteSession session, ResolutionContext context) throws SourceException {
        ContentNode web = session.web();
        List<ContainerRow> containers = new ArrayList<>();
        for (ContainerDescriptor descriptor : includedContainers(session)) {
            ContentNode node = descriptor.node();
            containers.add(new ContainerRow(node.id(), descriptor.typeLabel(), node.title(), node.path()));
        }

        List<RoleAssignment> assignments = session.getRoleAssignments(SecurableRef.web());
        LOGGER.info("{}: {} containers, {} role assignments", session.webUrl(), containers.size(), assignments.size());
        Map<String, String> groupLevels = new LinkedHashMap<>();
        for (RoleAssignment assignment : assignments) {
            if (assignment.principal().kind() != PrincipalKind.CONTAINER_GROUP) {
                continue;
            }
            List<String> levels = effectiveLevels(assignment);
            if (!levels.isEmpty()) {
                groupLevels.put(assignment.principal().id(), String.join(", ", levels));
            }
        }
        List<PermissionGroup> groups = new ArrayList<>();
        for (SiteGroup group : session.listSiteGroups()) {
            String level = groupLevels.get(group.id());
            if (level == null || config.ignoreContainerGroups().contains(group.title())) {
                continue;
            }
            groups.add(PermissionGroup.of(group, level));
        }

        List<EffectiveAccessEntry> access = effectiveAccess(session, context, assignments);
        LOGGER.info("{}: {} permission groups, {} access entries", session.webUrl(), groups.size(), access.size());
        return new SiteOverview(web, List.copyOf(containers), List.copyOf(groups), access);
    }

    /**
     * Starts a lazy walk of {@code target}. Units and items before {@code resumeFrom} are skipped without
     * reading their permissions; the position itself is visited again.
     *
     * @param resumeFrom position to resume at, or null to walk from the beginning
     */
    public ContainerWalk enumerate(ScanTarget target,
                                   SiteSession root,
                                   ResolutionContext context,
                                   Checkpoint resumeFrom) throws SourceException {
        List<ContainerWalk.Unit> units = new ArrayList<>();
        List<SiteSession> opened = new ArrayList<>();
        try {
            if (target.isWebTarget()) {
                planWeb(root, units, opened, 0);
            } else if (target.kind() == TargetKind.LIBRARY) {
                units.add(ContainerWalk.Unit.container(root, findContainer(root, target.containerId()), null));
            } else if (target.kind() == TargetKind.FOLDER) {
                units.add(ContainerWalk.Unit.folder(root, target.containerId(), target.folderPath()));
            } else {
                throw new IllegalArgumentException("Cannot walk target of kind " + target.kind());
            }
        } catch (SourceException | RuntimeException ex) {
            opened.forEach(SiteSession::close);
            throw ex;
        }
        int startUnit = resumeFrom == null ? 0 : resumeFrom.lastContainerIndex();
        long startItem = resumeFrom == null ? -1 : resumeFrom.lastItemIndex();
        LOGGER.info("Target {}: {} walk units, starting at unit {} item {}", target.sequenceNumber(), units.size(), startUnit, startItem);
        return new ContainerWalk(this, context, units, opened, startUnit, startItem, config.pageSize(), fetchPool);
    }

    private void planWeb(SiteSession session, List<ContainerWalk.Unit> units, List<SiteSession> opened, int depth) throws SourceException {
        for (ContainerDescriptor descriptor : includedContainers(session)) {
            units.add(ContainerWalk.Unit.container(session, descriptor.node(), null));
        }
        if (!config.includeSubsites()) {
            return;
        }
        if (depth >= config.maxSubsiteDepth()) {
            LOGGER.warn("Max subsite depth ({}) reached below {}, skipping deeper subsites", config.maxSubsiteDepth(), session.webUrl());
            return;
        }
        for (ContentNode subsite : session.listSubsites()) {
            SiteSession child;
            try {
                child = connector.connect(subsite.path());
            } catch (SourceException ex) {
                LOGGER.error("Failed to connect to subsite '{}' ({}): {}", subsite.title(), subsite.path(), ex.getMessage());
                continue;
            }
            opened.add(child);
            units.add(ContainerWalk.Unit.web(child, subsite));
            planWeb(child, units, opened, depth + 1);
        }
    }

    private ContentNode findContainer(SiteSession session, String containerId) throws SourceException {
        for (ContainerDescriptor descriptor : session.listContainers()) {
            if (descriptor.node().id().equals(containerId)) {
                return descriptor.node();
            }
        }
        throw new SourceException("Container " + containerId + " not found in " + session.webUrl());
    }

    List<ContainerDescriptor> includedContainers(SiteSession session) throws SourceException {
        List<ContainerDescriptor> included = new ArrayList<>();
        for (ContainerDescriptor descriptor : session.listContainers()) {
            if (descriptor.hidden()
                    || !config.includedTemplates().contains(descriptor.baseTemplate())
                    || config.ignoreContainers().contains(descriptor.node().title())) {
                continue;
            }
            included.add(descriptor);
        }
        return included;
    }

    /**
     * Resolves every assignment into access entries, dropping ignored accounts, ignored container groups
     * and ignored permission levels.
     */
    List<EffectiveAccessEntry> effectiveAccess(SiteSession session, ResolutionContext context, List<RoleAssignment> assignments) {
        List<EffectiveAccessEntry> access = new ArrayList<>();
        for (RoleAssignment assignment : assignments) {
            Principal principal = assignment.principal();
            if (config.isIgnoredAccount(principal.loginName())) {
                continue;
            }
            if (principal.kind() == PrincipalKind.CONTAINER_GROUP && config.ignoreContainerGroups().contains(principal.displayName())) {
                continue;
            }
            List<String> levels = effectiveLevels(assignment);
            if (levels.isEmpty()) {
                continue;
            }
            List<EffectiveAccessEntry> resolved = resolver.resolve(context, session, principal);
            for (String level : levels) {
                for (EffectiveAccessEntry entry : resolved) {
                    access.add(entry.withPermissionLevel(level));
                }
            }
        }
        return List.copyOf(access);
    }

    private List<String> effectiveLevels(RoleAssignment assignment) {
        List<String> levels = new ArrayList<>();
        for (String level : assignment.permissionLevels()) {
            if (!config.isIgnoredPermissionLevel(level)) {
                levels.add(level);
            }
        }
        return levels;
    }
}
