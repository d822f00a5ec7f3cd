package com.example.permissionscanner;

import com.example.permissionscanner.model.ContentNode;
import com.example.permissionscanner.model.EffectiveAccessEntry;
import com.example.permissionscanner.model.ListItem;
import com.example.permissionscanner.model.RoleAssignment;
import com.example.permissionscanner.source.SecurableRef;
import com.example.permissionscanner.source.SiteSession;
import com.example.permissionscanner.source.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Lazy, single-pass walk over the units of one target. Items are listed one page at a time; role assignments
 * of the page's broken items are fetched ahead on the worker pool while access resolution stays on the
 * thread that calls {@link #next()}.
 */
public final class ContainerWalk implements Iterator<EnumeratedNode>, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ContainerWalk.class);

    enum UnitType {
        WEB,
        CONTAINER,
        FOLDER
    }

    /**
     * A subsite web, a whole container, or the items below one folder of a container.
     */
    record Unit(UnitType type, SiteSession session, ContentNode node, String containerId, String folderPath) {
        static Unit web(SiteSession session, ContentNode web) {
            return new Unit(UnitType.WEB, session, web, null, null);
        }

        static Unit container(SiteSession session, ContentNode container, String folderPath) {
            return new Unit(UnitType.CONTAINER, session, container, container.id(), folderPath);
        }

        static Unit folder(SiteSession session, String containerId, String folderPath) {
            return new Unit(UnitType.FOLDER, session, null, containerId, folderPath);
        }
    }

    private record PendingItem(long index, ListItem item, Future<List<RoleAssignment>> assignments) {
    }

    private final AccessEnumerator enumerator;
    private final ResolutionContext context;
    private final List<Unit> units;
    private final List<SiteSession> ownedSessions;
    private final int startUnit;
    private final long startItem;
    private final int pageSize;
    private final ExecutorService fetchPool;

    private final Deque<PendingItem> pending = new ArrayDeque<>();
    private EnumeratedNode nextNode;
    private int unitIndex = -1;
    private boolean listingDone = true;
    private long afterId;
    private long itemIndex;
    private int pagesRead;
    private boolean closed;

    ContainerWalk(AccessEnumerator enumerator,
                  ResolutionContext context,
                  List<Unit> units,
                  List<SiteSession> ownedSessions,
                  int startUnit,
                  long startItem,
                  int pageSize,
                  ExecutorService fetchPool) {
        this.enumerator = enumerator;
        this.context = context;
        this.units = List.copyOf(units);
        this.ownedSessions = List.copyOf(ownedSessions);
        this.startUnit = Math.max(0, startUnit);
        this.startItem = startItem;
        this.pageSize = pageSize;
        this.fetchPool = fetchPool;
    }

    public int unitCount() {
        return units.size();
    }

    public int pagesRead() {
        return pagesRead;
    }

    @Override
    public boolean hasNext() {
        if (nextNode == null && !closed) {
            nextNode = advance();
        }
        return nextNode != null;
    }

    @Override
    public EnumeratedNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        EnumeratedNode node = nextNode;
        nextNode = null;
        return node;
    }

    private EnumeratedNode advance() {
        while (true) {
            if (!pending.isEmpty()) {
                return visitItem(pending.poll());
            }
            if (!listingDone) {
                readPage();
                continue;
            }
            unitIndex++;
            if (unitIndex >= units.size()) {
                return null;
            }
            if (unitIndex < startUnit) {
                continue;
            }
            EnumeratedNode unitNode = openUnit(units.get(unitIndex));
            if (unitNode != null) {
                return unitNode;
            }
        }
    }

    /**
     * Prepares item listing for the unit and returns its own node, or null when the unit has none to report.
     */
    private EnumeratedNode openUnit(Unit unit) {
        afterId = 0;
        itemIndex = 0;
        listingDone = unit.type() == UnitType.WEB;
        boolean resumingInside = unitIndex == startUnit && startItem >= 0;
        return switch (unit.type()) {
            case WEB -> resumingInside ? null : visitWeb(unit);
            case CONTAINER -> resumingInside ? null : visitContainer(unit);
            case FOLDER -> null;
        };
    }

    private EnumeratedNode visitWeb(Unit unit) {
        ContentNode web = unit.node();
        try {
            SiteOverview overview = enumerator.describeSite(unit.session(), context);
            List<EffectiveAccessEntry> access = web.hasUniquePermissions() ? overview.access() : List.of();
            return new EnumeratedNode(unitIndex, -1, web, access, overview, null);
        } catch (SourceException ex) {
            LOGGER.error("Failed to describe subsite '{}' ({}): {}", web.title(), web.path(), ex.getMessage());
            return new EnumeratedNode(unitIndex, -1, web, List.of(), null, ex.getMessage());
        }
    }

    private EnumeratedNode visitContainer(Unit unit) {
        ContentNode container = unit.node();
        if (!container.hasUniquePermissions()) {
            return new EnumeratedNode(unitIndex, -1, container, List.of(), null, null);
        }
        try {
            List<RoleAssignment> assignments = unit.session().getRoleAssignments(SecurableRef.container(container.id()));
            List<EffectiveAccessEntry> access = enumerator.effectiveAccess(unit.session(), context, assignments);
            return new EnumeratedNode(unitIndex, -1, container, access, null, null);
        } catch (SourceException ex) {
            LOGGER.error("Failed to read permissions of container '{}': {}", container.title(), ex.getMessage());
            return new EnumeratedNode(unitIndex, -1, container, List.of(), null, ex.getMessage());
        }
    }

    private void readPage() {
        Unit unit = units.get(unitIndex);
        List<ListItem> page;
        try {
            page = unit.session().listItems(unit.containerId(), unit.folderPath(), afterId, pageSize);
            pagesRead++;
        } catch (SourceException ex) {
            LOGGER.error("Failed to list items of container {} after id {}: {}", unit.containerId(), afterId, ex.getMessage());
            listingDone = true;
            return;
        }
        LOGGER.debug("Container {}: page of {} items after id {}", unit.containerId(), page.size(), afterId);

        long lastSeen = afterId;
        for (ListItem item : page) {
            if (item.id() <= lastSeen) {
                continue;
            }
            lastSeen = item.id();
            long index = itemIndex++;
            if (unitIndex == startUnit && index < startItem) {
                continue;
            }
            pending.add(new PendingItem(index, item, prefetch(unit, item)));
        }
        if (page.size() < pageSize || lastSeen == afterId) {
            listingDone = true;
        }
        afterId = lastSeen;
    }

    private Future<List<RoleAssignment>> prefetch(Unit unit, ListItem item) {
        if (!item.hasUniquePermissions()) {
            return null;
        }
        SiteSession session = unit.session();
        String containerId = unit.containerId();
        return fetchPool.submit(() -> session.getRoleAssignments(SecurableRef.item(containerId, item.id())));
    }

    private EnumeratedNode visitItem(PendingItem pendingItem) {
        ContentNode node = pendingItem.item().toNode();
        if (pendingItem.assignments() == null) {
            return new EnumeratedNode(unitIndex, pendingItem.index(), node, List.of(), null, null);
        }
        try {
            List<RoleAssignment> assignments = pendingItem.assignments().get();
            List<EffectiveAccessEntry> access = enumerator.effectiveAccess(units.get(unitIndex).session(), context, assignments);
            return new EnumeratedNode(unitIndex, pendingItem.index(), node, access, null, null);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            LOGGER.error("Failed to read permissions of item {} ({}): {}", node.id(), node.path(), cause.getMessage());
            return new EnumeratedNode(unitIndex, pendingItem.index(), node, List.of(), null, cause.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return new EnumeratedNode(unitIndex, pendingItem.index(), node, List.of(), null, "Interrupted");
        }
    }

    /**
     * Cancels outstanding lookups and closes the subsite sessions opened for this walk.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (PendingItem item : pending) {
            if (item.assignments() != null) {
                item.assignments().cancel(true);
            }
        }
        pending.clear();
        ownedSessions.forEach(SiteSession::close);
    }
}
