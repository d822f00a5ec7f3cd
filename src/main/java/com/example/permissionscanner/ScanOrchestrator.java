package com.example.permissionscanner;

import com.example.permissionscanner.model.AccessRow;
import com.example.permissionscanner.model.BrokenInheritanceItem;
import com.example.permissionscanner.model.Checkpoint;
import com.example.permissionscanner.model.ContentNode;
import com.example.permissionscanner.model.EffectiveAccessEntry;
import com.example.permissionscanner.model.FailureRecord;
import com.example.permissionscanner.model.RecordKind;
import com.example.permissionscanner.model.ResolutionStatus;
import com.example.permissionscanner.model.RetryAttempt;
import com.example.permissionscanner.model.ScanTarget;
import com.example.permissionscanner.model.TargetKind;
import com.example.permissionscanner.model.TargetSummary;
import com.example.permissionscanner.source.DirectorySource;
import com.example.permissionscanner.source.RetriesExhaustedException;
import com.example.permissionscanner.source.SiteConnector;
import com.example.permissionscanner.source.SiteSession;
import com.example.permissionscanner.source.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Drives a scan run: classifies every target in input order, walks it, writes the rows in batches and records a
 * checkpoint after every accepted batch. A failing target is reported and skipped; the run continues with the
 * next one. A run that finishes every target clears its checkpoint.
 */
public final class ScanOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScanOrchestrator.class);

    private final ScannerConfig config;
    private final SiteConnector connector;
    private final TargetClassifier classifier;
    private final PrincipalResolver resolver;
    private final CheckpointManager checkpointManager;
    private final OutputSink sink;
    private final CancellationSignal cancellation;
    private final Optional<DirectoryGroupCache> directoryGroupCache;
    private final ResolutionContext context;

    private long processedNodes;
    private Checkpoint lastSaved;

    public ScanOrchestrator(ScannerConfig config,
                            SiteConnector connector,
                            DirectorySource directory,
                            CheckpointManager checkpointManager,
                            OutputSink sink) {
        this(config, connector, directory, checkpointManager, sink, CancellationSignal.NEVER);
    }

    public ScanOrchestrator(ScannerConfig config,
                            SiteConnector connector,
                            DirectorySource directory,
                            CheckpointManager checkpointManager,
                            OutputSink sink,
                            CancellationSignal cancellation) {
        this.config = config;
        this.connector = connector;
        this.classifier = new TargetClassifier(connector);
        this.resolver = new PrincipalResolver(config, directory);
        this.checkpointManager = checkpointManager;
        this.sink = sink;
        this.cancellation = cancellation;
        this.directoryGroupCache = config.directoryCacheDirectory().map(DirectoryGroupCache::new);
        this.context = new ResolutionContext(directoryGroupCache);
    }

    /**
     * Caches shared by every target of this orchestrator's runs.
     */
    public ResolutionContext resolutionContext() {
        return context;
    }

    public ScanReport run(List<String> references) throws IOException {
        LOGGER.info("{}: {} targets", ScanPhase.INIT, references.size());
        if (config.deleteDirectoryCache() && directoryGroupCache.isPresent()) {
            directoryGroupCache.get().clear();
        }
        Checkpoint resume = checkpointManager.load()
                .filter(checkpoint -> isUsable(checkpoint, references.size()))
                .orElse(null);
        int firstTarget = resume == null ? 0 : resume.targetSequenceNumber();
        if (resume != null) {
            LOGGER.info("Resuming at target {} unit {} item {} ({} nodes already scanned)",
                    resume.targetSequenceNumber(), resume.lastContainerIndex(), resume.lastItemIndex(), resume.itemsScanned());
        }

        processedNodes = 0;
        lastSaved = resume;
        RowBuffer buffer = new RowBuffer(sink, config.batchSize());
        List<TargetOutcome> outcomes = new ArrayList<>();
        boolean cancelled = false;
        ExecutorService fetchPool = Executors.newFixedThreadPool(config.fetchThreads());
        try {
            AccessEnumerator enumerator = new AccessEnumerator(config, connector, resolver, fetchPool);
            for (int i = firstTarget; i < references.size(); i++) {
                if (cancellation.isCancelled(processedNodes)) {
                    cancelled = true;
                    break;
                }
                Checkpoint from = resume != null && i == resume.targetSequenceNumber() ? resume : null;
                TargetOutcome outcome = scanTarget(enumerator, references.get(i), i, from, buffer);
                outcomes.add(outcome);
                if (!outcome.isDone() && !outcome.isFailed()) {
                    cancelled = true;
                    break;
                }
            }
        } finally {
            fetchPool.shutdownNow();
            awaitTermination(fetchPool);
        }

        if (cancelled) {
            LOGGER.info("Scan cancelled after {} nodes; checkpoint kept at {}", processedNodes, checkpointManager.path());
        } else {
            buffer.flush();
            checkpointManager.clear();
            LOGGER.info("{}: all {} targets processed", ScanPhase.DONE, references.size());
        }
        LOGGER.info("Group cache: {} directory groups, {} hits, {} misses", context.directoryCacheSize(), context.hits(), context.misses());
        return new ScanReport(outcomes, cancelled);
    }

    private TargetOutcome scanTarget(AccessEnumerator enumerator,
                                     String reference,
                                     int sequence,
                                     Checkpoint from,
                                     RowBuffer buffer) throws IOException {
        context.beginTarget();
        ScanPhase phase = enter(sequence, ScanPhase.CLASSIFYING, reference);
        ScanTarget target = classifier.classify(reference, sequence);
        if (target.kind() == TargetKind.ERROR) {
            return fail(target, phase, "Reference could not be classified", List.of(), buffer);
        }

        boolean fresh = from == null || from.itemsScanned() == 0;
        Checkpoint progress = fresh ? Checkpoint.startOf(sequence) : from;
        TargetStats stats = new TargetStats();
        try (SiteSession session = connector.connect(target.webUrl())) {
            phase = enter(sequence, ScanPhase.CONNECTED, target.kind() + " " + target.webUrl());
            if (fresh && target.isWebTarget()) {
                SiteOverview overview = enumerator.describeSite(session, context);
                progress = recordSiteRoot(target, overview, progress, stats, buffer);
            }

            phase = enter(sequence, ScanPhase.ENUMERATING, target.url());
            try (ContainerWalk walk = enumerator.enumerate(target, session, context, fresh ? null : from)) {
                while (walk.hasNext()) {
                    progress = record(target, walk.next(), progress, stats, buffer);
                    processedNodes++;
                    if (buffer.isFull()) {
                        flushAndCheckpoint(buffer, progress);
                    }
                    if (cancellation.isCancelled(processedNodes)) {
                        buffer.add(RecordKind.TARGET_SUMMARY, TargetSummary.of(target, progress, "CANCELLED"));
                        flushAndCheckpoint(buffer, progress);
                        return new TargetOutcome(target, phase, progress, null);
                    }
                }
                LOGGER.info("Target {}: {} pages read across {} walk units", sequence, walk.pagesRead(), walk.unitCount());
            }
        } catch (SourceException ex) {
            LOGGER.error("Target {} '{}' failed while {}: {}", sequence, reference, phase, ex.getMessage());
            List<RetryAttempt> attempts = ex instanceof RetriesExhaustedException exhausted ? exhausted.getAttempts() : List.of();
            return fail(target, phase, ex.getMessage(), attempts, buffer);
        }

        enter(sequence, ScanPhase.FLUSHING, progress.itemsScanned() + " nodes, " + progress.brokenPermissionCount() + " broken");
        buffer.add(RecordKind.TARGET_SUMMARY, TargetSummary.of(target, progress, ScanPhase.DONE.name()));
        flushAndCheckpoint(buffer, Checkpoint.startOf(sequence + 1));
        enter(sequence, ScanPhase.DONE, target.url());
        return new TargetOutcome(target, ScanPhase.DONE, progress, null);
    }

    private Checkpoint recordSiteRoot(ScanTarget target,
                                      SiteOverview overview,
                                      Checkpoint progress,
                                      TargetStats stats,
                                      RowBuffer buffer) {
        ContentNode web = overview.web();
        buffer.addAll(RecordKind.CONTAINERS, overview.containers());
        buffer.addAll(RecordKind.PERMISSION_GROUPS, overview.permissionGroups());
        addAccess(RecordKind.CONTAINER_ACCESS, target, web, overview.access(), buffer);
        long broken = progress.brokenPermissionCount();
        long shared = progress.itemsSharedWithEveryone();
        if (target.kind() == TargetKind.SUBSITE && web.hasUniquePermissions()) {
            buffer.add(RecordKind.BROKEN_ITEMS, BrokenInheritanceItem.of(web));
            broken++;
            if (stats.markSharedWithEveryone(web.path(), overview.access())) {
                shared++;
            }
        }
        return new Checkpoint(target.sequenceNumber(), progress.lastContainerIndex(), progress.lastItemIndex(),
                progress.itemsScanned(), broken,
                progress.externalUsersFound() + stats.addExternalUsers(overview.access()), shared);
    }

    private Checkpoint record(ScanTarget target, EnumeratedNode node, Checkpoint progress, TargetStats stats, RowBuffer buffer) {
        long broken = progress.brokenPermissionCount();
        long shared = progress.itemsSharedWithEveryone();
        if (node.overview() != null) {
            buffer.addAll(RecordKind.CONTAINERS, node.overview().containers());
            buffer.addAll(RecordKind.PERMISSION_GROUPS, node.overview().permissionGroups());
        }
        if (node.isBroken()) {
            buffer.add(RecordKind.BROKEN_ITEMS, BrokenInheritanceItem.of(node.node()));
            broken++;
            if (stats.markSharedWithEveryone(node.node().path(), node.access())) {
                shared++;
            }
        }
        addAccess(node.isItem() ? RecordKind.ITEM_ACCESS : RecordKind.CONTAINER_ACCESS, target, node.node(), node.access(), buffer);
        if (node.error() != null) {
            buffer.add(RecordKind.FAILURES, new FailureRecord(target.sequenceNumber(), node.node().path(),
                    ScanPhase.ENUMERATING.name(), Instant.now(), node.error(), List.of()));
        }
        return new Checkpoint(target.sequenceNumber(), node.containerIndex(), node.itemIndex(), progress.itemsScanned() + 1,
                broken, progress.externalUsersFound() + stats.addExternalUsers(node.access()), shared);
    }

    private static void addAccess(RecordKind kind, ScanTarget target, ContentNode node, List<EffectiveAccessEntry> access, RowBuffer buffer) {
        for (EffectiveAccessEntry entry : access) {
            buffer.add(kind, AccessRow.of(target.sequenceNumber(), node, entry));
        }
    }

    private TargetOutcome fail(ScanTarget target,
                               ScanPhase phase,
                               String error,
                               List<RetryAttempt> attempts,
                               RowBuffer buffer) throws IOException {
        enter(target.sequenceNumber(), ScanPhase.ERROR, error);
        Checkpoint progress = Checkpoint.startOf(target.sequenceNumber());
        buffer.add(RecordKind.FAILURES, new FailureRecord(target.sequenceNumber(), target.url(), phase.name(), Instant.now(), error, attempts));
        buffer.add(RecordKind.TARGET_SUMMARY, TargetSummary.of(target, progress, ScanPhase.ERROR.name()));
        flushAndCheckpoint(buffer, Checkpoint.startOf(target.sequenceNumber() + 1));
        return new TargetOutcome(target, ScanPhase.ERROR, progress, error);
    }

    /**
     * Writes everything buffered, then records {@code checkpoint}. The checkpoint never points at rows the sink
     * has not accepted.
     */
    private void flushAndCheckpoint(RowBuffer buffer, Checkpoint checkpoint) throws IOException {
        if (lastSaved != null && !checkpoint.isAtOrAfter(lastSaved)) {
            throw new IllegalStateException("Checkpoint would move backwards from " + lastSaved + " to " + checkpoint);
        }
        buffer.flush();
        checkpointManager.save(checkpoint);
        lastSaved = checkpoint;
    }

    private static boolean isUsable(Checkpoint checkpoint, int targetCount) {
        if (checkpoint.targetSequenceNumber() < 0 || checkpoint.targetSequenceNumber() >= targetCount) {
            LOGGER.warn("Checkpoint points at target {} but only {} targets are configured; starting over",
                    checkpoint.targetSequenceNumber(), targetCount);
            return false;
        }
        return true;
    }

    private static ScanPhase enter(int sequence, ScanPhase phase, String detail) {
        LOGGER.info("Target {} {}: {}", sequence, phase, detail);
        return phase;
    }

    private static void awaitTermination(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                LOGGER.warn("Permission fetch workers did not stop within 30 seconds");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while stopping permission fetch workers", ex);
        }
    }

    /**
     * Distinct external users and broken nodes open to everyone, seen so far in one target.
     * Starts empty on resume, so a user seen both before and after the resume point counts twice.
     */
    private static final class TargetStats {
        private static final String EXTERNAL_MARKER = "#ext#";

        private final Set<String> externalLogins = new HashSet<>();
        private final Set<String> sharedNodes = new HashSet<>();

        int addExternalUsers(List<EffectiveAccessEntry> access) {
            int added = 0;
            for (EffectiveAccessEntry entry : access) {
                String login = entry.principalLogin() == null ? "" : entry.principalLogin().toLowerCase(Locale.ROOT);
                if (login.contains(EXTERNAL_MARKER) && externalLogins.add(login)) {
                    added++;
                }
            }
            return added;
        }

        boolean markSharedWithEveryone(String nodePath, List<EffectiveAccessEntry> access) {
            return access.stream().anyMatch(TargetStats::isEveryone) && sharedNodes.add(nodePath);
        }

        // Org-wide principals are never expanded, so they surface as opaque entries.
        private static boolean isEveryone(EffectiveAccessEntry entry) {
            return entry.status() == ResolutionStatus.OPAQUE
                    || entry.displayName() != null && entry.displayName().toLowerCase(Locale.ROOT).startsWith("everyone");
        }
    }
}
