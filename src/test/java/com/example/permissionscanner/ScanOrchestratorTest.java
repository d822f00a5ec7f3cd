package com.example.permissionscanner;

import com.example.permissionscanner.model.Checkpoint;
import com.example.permissionscanner.model.Principal;
import com.example.permissionscanner.model.RecordKind;
import com.example.permissionscanner.model.TargetKind;
import com.example.permissionscanner.source.SnapshotSource;
import com.example.permissionscanner.source.TenantSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.example.permissionscanner.Fixtures.assign;
import static com.example.permissionscanner.Fixtures.documents;
import static com.example.permissionscanner.Fixtures.item;
import static com.example.permissionscanner.Fixtures.site;
import static com.example.permissionscanner.Fixtures.siteGroup;
import static com.example.permissionscanner.Fixtures.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScanOrchestratorTest {
    private static final Principal MEMBERS = Principal.containerGroup("4", "HR Members");
    private static final Principal FINANCE = Principal.directoryGroup("dg-fin", "c:0t.c|tenant|dg-fin", "Finance");

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void completeRunWritesAllRecordKindsAndClearsCheckpoint() throws Exception {
        Path output = Files.createTempDirectory("scan-output");
        ScannerConfig config = Fixtures.config(output, "\"batchSize\": 4");
        SnapshotSource source = new SnapshotSource(tenant(10));
        CheckpointManager checkpoints = new CheckpointManager(config.resolvedCheckpointFile());

        ScanReport report;
        try (JsonFileSink sink = new JsonFileSink(output)) {
            report = new ScanOrchestrator(config, source, source, checkpoints, sink).run(config.targets());
        }

        assertFalse(report.cancelled());
        assertEquals(1, report.outcomes().size());
        assertEquals(TargetKind.SITE, report.outcomes().get(0).target().kind());
        assertEquals(11, report.itemsScanned());
        assertEquals(2, report.brokenPermissionCount());
        assertFalse(Files.exists(checkpoints.path()));

        assertEquals(1, rows(output, RecordKind.CONTAINERS).size());
        assertEquals(1, rows(output, RecordKind.PERMISSION_GROUPS).size());
        assertEquals(2, rows(output, RecordKind.CONTAINER_ACCESS).size());
        assertEquals(2, rows(output, RecordKind.BROKEN_ITEMS).size());
        List<JsonNode> itemAccess = rows(output, RecordKind.ITEM_ACCESS);
        assertEquals(4, itemAccess.size());
        assertTrue(itemAccess.stream().allMatch(row -> row.get("access").get("nestingDepth").asInt() <= 5));
        List<JsonNode> summaries = rows(output, RecordKind.TARGET_SUMMARY);
        assertEquals(1, summaries.size());
        assertEquals("DONE", summaries.get(0).get("outcome").asText());
        assertEquals(11, summaries.get(0).get("itemsScanned").asLong());
    }

    @Test
    void resumedRunMatchesUninterruptedRunWithinOneItem() throws Exception {
        Path reference = Files.createTempDirectory("scan-reference");
        ScannerConfig referenceConfig = Fixtures.config(reference, "\"batchSize\": 3", "\"pageSize\": 4");
        SnapshotSource referenceSource = new SnapshotSource(tenant(10));
        ScanReport uninterrupted;
        try (JsonFileSink sink = new JsonFileSink(reference)) {
            uninterrupted = new ScanOrchestrator(referenceConfig, referenceSource, referenceSource,
                    new CheckpointManager(referenceConfig.resolvedCheckpointFile()), sink).run(referenceConfig.targets());
        }

        Path output = Files.createTempDirectory("scan-output");
        ScannerConfig config = Fixtures.config(output, "\"batchSize\": 3", "\"pageSize\": 4");
        SnapshotSource source = new SnapshotSource(tenant(10));
        CheckpointManager checkpoints = new CheckpointManager(config.resolvedCheckpointFile());

        ScanReport paused;
        try (JsonFileSink sink = new JsonFileSink(output)) {
            paused = new ScanOrchestrator(config, source, source, checkpoints, sink, CancellationSignal.afterNodes(5))
                    .run(config.targets());
        }
        assertTrue(paused.cancelled());
        Optional<Checkpoint> saved = checkpoints.load();
        assertTrue(saved.isPresent());
        assertEquals(new Checkpoint(0, 0, 3, 5, saved.get().brokenPermissionCount(), 0, 0), saved.get());

        ScanReport resumed;
        try (JsonFileSink sink = new JsonFileSink(output)) {
            resumed = new ScanOrchestrator(config, source, source, checkpoints, sink).run(config.targets());
        }

        assertFalse(resumed.cancelled());
        long expected = uninterrupted.itemsScanned();
        long actual = resumed.itemsScanned();
        assertTrue(actual >= expected && actual <= expected + 1, "items scanned " + actual + " vs " + expected);
        assertEquals(brokenIds(reference), brokenIds(output));
        assertEquals(1, rows(output, RecordKind.CONTAINERS).size());
        assertFalse(Files.exists(checkpoints.path()));
    }

    @Test
    void failedTargetIsRecordedAndRunContinues() throws Exception {
        Path output = Files.createTempDirectory("scan-output");
        ScannerConfig config = Fixtures.config(output);
        SnapshotSource source = new SnapshotSource(tenant(3));
        List<String> targets = List.of("https://contoso.sharepoint.com/sites/legal/Contracts", Fixtures.SITE);

        ScanReport report;
        try (JsonFileSink sink = new JsonFileSink(output)) {
            report = new ScanOrchestrator(config, source, source, new CheckpointManager(config.resolvedCheckpointFile()), sink)
                    .run(targets);
        }

        assertEquals(2, report.outcomes().size());
        assertTrue(report.outcomes().get(0).isFailed());
        assertTrue(report.outcomes().get(1).isDone());
        assertEquals(1, report.failedTargets());
        List<JsonNode> failures = rows(output, RecordKind.FAILURES);
        assertEquals(1, failures.size());
        assertEquals(0, failures.get(0).get("targetSequenceNumber").asInt());
        assertEquals("CLASSIFYING", failures.get(0).get("phase").asText());
        assertEquals(2, rows(output, RecordKind.TARGET_SUMMARY).size());
    }

    @Test
    void containerGroupsAreRefetchedPerTargetDirectoryGroupsAreNot() throws Exception {
        Path output = Files.createTempDirectory("scan-output");
        ScannerConfig config = Fixtures.config(output);
        SnapshotSource source = new SnapshotSource(tenant(3));
        List<String> targets = List.of(Fixtures.SITE, Fixtures.SITE + "/Shared%20Documents");

        ScanOrchestrator orchestrator;
        try (JsonFileSink sink = new JsonFileSink(output)) {
            orchestrator = new ScanOrchestrator(config, source, source, new CheckpointManager(config.resolvedCheckpointFile()), sink);
            ScanReport report = orchestrator.run(targets);
            assertEquals(TargetKind.LIBRARY, report.outcomes().get(1).target().kind());
        }

        assertEquals(2, source.membershipFetches("4"));
        assertEquals(1, source.membershipFetches("dg-fin"));
        assertEquals(1, orchestrator.resolutionContext().directoryCacheSize());
    }

    @Test
    void checkpointBeyondConfiguredTargetsStartsOver() throws Exception {
        Path output = Files.createTempDirectory("scan-output");
        ScannerConfig config = Fixtures.config(output);
        CheckpointManager checkpoints = new CheckpointManager(config.resolvedCheckpointFile());
        checkpoints.save(new Checkpoint(7, 2, 10, 40, 1, 0, 0));
        SnapshotSource source = new SnapshotSource(tenant(2));

        ScanReport report;
        try (JsonFileSink sink = new JsonFileSink(output)) {
            report = new ScanOrchestrator(config, source, source, checkpoints, sink).run(config.targets());
        }

        assertEquals(1, report.outcomes().size());
        assertEquals(3, report.itemsScanned());
    }

    @Test
    void siteWithoutBrokenInheritanceListsStandardGroupsOnly() throws Exception {
        Path output = Files.createTempDirectory("scan-output");
        ScannerConfig config = Fixtures.config(output);
        Principal owners = Principal.containerGroup("3", "HR Owners");
        Principal visitors = Principal.containerGroup("5", "HR Visitors");
        TenantSnapshot.Web web = site(
                List.of(assign(owners, "Full Control"), assign(MEMBERS, "Edit"), assign(visitors, "Read")),
                List.of(siteGroup("3", "HR Owners", user("olga")),
                        siteGroup("4", "HR Members", user("alice")),
                        siteGroup("5", "HR Visitors", user("vera"))),
                List.of(documents(Fixtures.items(20))));
        SnapshotSource source = new SnapshotSource(Fixtures.tenant(web));

        ScanReport report;
        try (JsonFileSink sink = new JsonFileSink(output)) {
            report = new ScanOrchestrator(config, source, source, new CheckpointManager(config.resolvedCheckpointFile()), sink)
                    .run(config.targets());
        }

        assertEquals(0, report.brokenPermissionCount());
        assertTrue(rows(output, RecordKind.BROKEN_ITEMS).isEmpty());
        assertTrue(rows(output, RecordKind.ITEM_ACCESS).isEmpty());
        List<JsonNode> groups = rows(output, RecordKind.PERMISSION_GROUPS);
        assertEquals(List.of("SiteOwners", "SiteMembers", "SiteVisitors"),
                groups.stream().map(row -> row.get("roleName").asText()).toList());
        assertEquals(3, rows(output, RecordKind.CONTAINER_ACCESS).size());
    }

    @Test
    void nestedDirectoryGroupAccessKeepsOuterGroupAsRootOnEveryBrokenItem() throws Exception {
        Path output = Files.createTempDirectory("scan-output");
        ScannerConfig config = Fixtures.config(output, "\"batchSize\": 7", "\"pageSize\": 20");
        Principal team = Principal.directoryGroup("dg-team", "c:0t.c|tenant|dg-team", "Project Team");
        Principal contractors = Principal.directoryGroup("dg-sub", "c:0t.c|tenant|dg-sub", "Contractors");
        List<TenantSnapshot.Item> items = new ArrayList<>();
        for (int i = 1; i <= 50; i++) {
            items.add(i % 5 == 0 ? item(i, true, assign(team, "Contribute")) : item(i, false));
        }
        TenantSnapshot tenant = new TenantSnapshot(
                List.of(site(List.of(), List.of(), List.of(documents(items)))),
                List.of(Fixtures.directoryGroup("dg-team", user("uma"), contractors),
                        Fixtures.directoryGroup("dg-sub", user("vic"))));
        SnapshotSource source = new SnapshotSource(tenant);

        ScanReport report;
        try (JsonFileSink sink = new JsonFileSink(output)) {
            report = new ScanOrchestrator(config, source, source, new CheckpointManager(config.resolvedCheckpointFile()), sink)
                    .run(config.targets());
        }

        assertEquals(51, report.itemsScanned());
        assertEquals(10, rows(output, RecordKind.BROKEN_ITEMS).size());
        Map<String, List<JsonNode>> accessByItem = rows(output, RecordKind.ITEM_ACCESS).stream()
                .collect(Collectors.groupingBy(row -> row.get("nodeId").asText()));
        assertEquals(brokenIds(output), accessByItem.keySet());
        for (List<JsonNode> access : accessByItem.values()) {
            assertEquals(2, access.size());
            assertEquals(Set.of(0, 1), access.stream().map(row -> row.get("access").get("nestingDepth").asInt()).collect(Collectors.toSet()));
            assertEquals(Set.of("dg-team"), access.stream()
                    .map(row -> row.get("access").get("accessPath").get(0).get("groupId").asText())
                    .collect(Collectors.toSet()));
        }
        assertEquals(1, source.membershipFetches("dg-team"));
        assertEquals(1, source.membershipFetches("dg-sub"));
    }

    @Test
    void directoryGroupsCachedOnDiskAreNotFetchedOnNextRun() throws Exception {
        Path cache = Files.createTempDirectory("group-cache");
        String cacheSetting = "\"directoryCacheDirectory\": \"" + cache + "\"";

        SnapshotSource first = new SnapshotSource(tenant(3));
        Path firstOutput = scan(first, cacheSetting);
        assertEquals(1, first.membershipFetches("dg-fin"));
        assertTrue(Files.exists(cache.resolve("dg-fin.json")));

        SnapshotSource second = new SnapshotSource(tenant(3));
        Path secondOutput = scan(second, cacheSetting);
        assertEquals(0, second.membershipFetches("dg-fin"));
        assertEquals(1, second.membershipFetches("4"));
        assertEquals(accessLogins(firstOutput), accessLogins(secondOutput));
        assertTrue(accessLogins(secondOutput).contains("i:0#.f|membership|carl@contoso.com"));

        SnapshotSource third = new SnapshotSource(tenant(3));
        scan(third, cacheSetting, "\"deleteDirectoryCache\": true");
        assertEquals(1, third.membershipFetches("dg-fin"));
    }

    @Test
    void summaryCountsExternalUsersAndItemsSharedWithEveryone() throws Exception {
        Path output = Files.createTempDirectory("scan-output");
        ScannerConfig config = Fixtures.config(output);
        Principal everyone = Principal.user("c:0(.s|true", "c:0(.s|true", "Everyone", null);
        Principal everyoneExceptExternal = Principal.directoryGroup("dg-spo-grid", "c:0-.f|rolemanager|spo-grid-all-users",
                "Everyone except external users");
        Principal guest = Principal.user("u-guest", "i:0#.f|membership|guest_fabrikam.com#ext#@contoso.onmicrosoft.com", "Guest", null);
        Principal sameGuest = Principal.user("u-guest", "i:0#.f|membership|guest_fabrikam.com#EXT#@contoso.onmicrosoft.com", "Guest", null);
        Principal auditor = Principal.user("u-audit", "i:0#.f|membership|audit_kpmg.com#EXT#@contoso.onmicrosoft.com", "Auditor", null);
        Principal partners = Principal.directoryGroup("dg-partners", "c:0t.c|tenant|dg-partners", "Partners");
        Principal reviewers = Principal.directoryGroup("dg-review", "c:0t.c|tenant|dg-review", "Reviewers");
        List<TenantSnapshot.Item> items = List.of(
                item(1, true, assign(everyone, "Read"), assign(guest, "Read")),
                item(2, true, assign(partners, "Edit")),
                item(3, true, assign(reviewers, "Read")),
                item(4, false));
        TenantSnapshot tenant = new TenantSnapshot(
                List.of(site(List.of(), List.of(), List.of(documents(items)))),
                List.of(Fixtures.directoryGroup("dg-partners", sameGuest, user("paul")),
                        Fixtures.directoryGroup("dg-review", auditor, everyoneExceptExternal)));
        SnapshotSource source = new SnapshotSource(tenant);

        ScanReport report;
        try (JsonFileSink sink = new JsonFileSink(output)) {
            report = new ScanOrchestrator(config, source, source, new CheckpointManager(config.resolvedCheckpointFile()), sink)
                    .run(config.targets());
        }

        assertEquals(3, report.brokenPermissionCount());
        assertEquals(2, report.externalUsersFound());
        assertEquals(2, report.itemsSharedWithEveryone());
        JsonNode summary = rows(output, RecordKind.TARGET_SUMMARY).get(0);
        assertEquals(2, summary.get("externalUsersFound").asLong());
        assertEquals(2, summary.get("itemsSharedWithEveryone").asLong());
        assertEquals(0, source.membershipFetches("dg-spo-grid"));
    }

    private Path scan(SnapshotSource source, String... settings) throws Exception {
        Path output = Files.createTempDirectory("scan-output");
        ScannerConfig config = Fixtures.config(output, settings);
        try (JsonFileSink sink = new JsonFileSink(output)) {
            new ScanOrchestrator(config, source, source, new CheckpointManager(config.resolvedCheckpointFile()), sink)
                    .run(config.targets());
        }
        return output;
    }

    private Set<String> accessLogins(Path output) throws Exception {
        Set<String> logins = new TreeSet<>();
        for (JsonNode row : rows(output, RecordKind.ITEM_ACCESS)) {
            logins.add(row.get("access").get("principalLogin").asText());
        }
        return logins;
    }

    /**
     * One site whose library holds {@code itemCount} items; items 2 and 7 (when present) have unique permissions.
     */
    private static TenantSnapshot tenant(int itemCount) {
        List<TenantSnapshot.Item> items = new ArrayList<>();
        for (int i = 1; i <= itemCount; i++) {
            if (i == 2) {
                items.add(item(i, true, assign(MEMBERS, "Edit"), assign(FINANCE, "Read")));
            } else if (i == 7) {
                items.add(item(i, true, assign(user("sam"), "Read", "Limited Access")));
            } else {
                items.add(item(i, false));
            }
        }
        TenantSnapshot.Web web = site(
                List.of(assign(MEMBERS, "Full Control")),
                List.of(siteGroup("4", "HR Members", user("alice"), user("bob"))),
                List.of(documents(items)));
        return new TenantSnapshot(List.of(web), List.of(Fixtures.directoryGroup("dg-fin", user("carl"))));
    }

    private Set<String> brokenIds(Path output) throws Exception {
        Set<String> ids = new HashSet<>();
        for (JsonNode row : rows(output, RecordKind.BROKEN_ITEMS)) {
            ids.add(row.get("id").asText());
        }
        return ids;
    }

    private List<JsonNode> rows(Path output, RecordKind kind) throws Exception {
        List<JsonNode> rows = new ArrayList<>();
        try (Stream<Path> files = Files.list(output)) {
            for (Path file : files.filter(path -> path.getFileName().toString().startsWith(kind.filePrefix())).sorted().toList()) {
                mapper.readTree(file.toFile()).forEach(rows::add);
            }
        }
        return rows;
    }
}
