package com.example.permissionscanner;

import com.example.permissionscanner.source.RetryPolicy;
import com.example.permissionscanner.source.RetryingDirectorySource;
import com.example.permissionscanner.source.RetryingSiteConnector;
import com.example.permissionscanner.source.SnapshotSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar permission-scanner.jar <config.json>");
            System.exit(1);
        }
        ScannerConfig config;
        try {
            config = new ConfigLoader().load(Path.of(args[0]));
        } catch (IllegalArgumentException ex) {
            LOGGER.error("Invalid configuration {}: {}", args[0], ex.getMessage());
            System.exit(2);
            return;
        }
        if (config.snapshotFile().isEmpty()) {
            LOGGER.error("Config must name a snapshotFile to scan");
            System.exit(2);
            return;
        }

        SnapshotSource source = SnapshotSource.load(config.snapshotFile().get());
        RetryPolicy retryPolicy = new RetryPolicy(config.retryAttempts(), config.retryBaseDelayMillis(), config.retryMaxDelayMillis());

        BatchFileSyncer syncer = BatchFileSyncer.noop();
        if (config.s3SyncEnabled()) {
            syncer = new S3SyncService(
                    config.outputDirectory(),
                    config.s3Bucket().orElseThrow(),
                    config.s3Prefix().orElse(""),
                    config.s3Region()
            );
        }

        // Ctrl-C stops the walk between nodes; the scan then flushes and checkpoints before the JVM exits.
        AtomicBoolean stopRequested = new AtomicBoolean();
        CountDownLatch finished = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            stopRequested.set(true);
            try {
                finished.await(60, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "scan-shutdown"));
        CancellationSignal cancellation = CancellationSignal.of(stopRequested);
        if (config.maxItems().isPresent()) {
            cancellation = cancellation.or(CancellationSignal.afterNodes(config.maxItems().get()));
        }

        CheckpointManager checkpointManager = new CheckpointManager(config.resolvedCheckpointFile());
        try (JsonFileSink sink = new JsonFileSink(config.outputDirectory(), syncer)) {
            ScanOrchestrator orchestrator = new ScanOrchestrator(
                    config,
                    new RetryingSiteConnector(source, retryPolicy),
                    new RetryingDirectorySource(source, retryPolicy),
                    checkpointManager,
                    sink,
                    cancellation
            );
            ScanReport report = orchestrator.run(config.targets());
            LOGGER.info("Scan {}: {} targets, {} failed, {} nodes scanned, {} with broken inheritance",
                    report.cancelled() ? "paused" : "completed",
                    report.outcomes().size(),
                    report.failedTargets(),
                    report.itemsScanned(),
                    report.brokenPermissionCount());
            LOGGER.info("{} external users found, {} broken nodes shared with everyone",
                    report.externalUsersFound(),
                    report.itemsSharedWithEveryone());
        } finally {
            finished.countDown();
        }
    }
}
