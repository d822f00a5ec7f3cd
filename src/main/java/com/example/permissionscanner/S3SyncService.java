package com.example.permissionscanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mirrors finished batch files to S3 on a background thread. Upload failures are logged and counted; the scan
 * itself never waits on S3 except when closing.
 */
public final class S3SyncService implements BatchFileSyncer {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3SyncService.class);
    private static final String JSON_CONTENT_TYPE = "application/json";

    private final BlockingQueue<UploadTask> queue = new LinkedBlockingQueue<>();
    private final S3Client s3Client;
    private final Thread worker;
    private final Path outputDirectory;
    private final String bucket;
    private final String keyPrefix;
    private final AtomicInteger uploaded = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private volatile boolean closed;

    public S3SyncService(Path outputDirectory, String bucket, String keyPrefix, Optional<String> region) {
        this(outputDirectory, bucket, keyPrefix, region
                .map(Region::of)
                .map(r -> S3Client.builder().region(r).build())
                .orElseGet(() -> S3Client.builder().build()));
    }

    S3SyncService(Path outputDirectory, String bucket, String keyPrefix, S3Client s3Client) {
        this.outputDirectory = outputDirectory.toAbsolutePath().normalize();
        this.bucket = bucket;
        this.keyPrefix = normalizePrefix(keyPrefix);
        this.s3Client = s3Client;
        this.worker = new Thread(this::run, "s3-batch-sync");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    @Override
    public void enqueue(Path path) {
        if (closed) {
            LOGGER.warn("Not mirroring {} to S3: sync service already closed", path);
            return;
        }
        queue.offer(new UploadTask(path));
    }

    /**
     * Drains the queue, then releases the client.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        queue.offer(UploadTask.poisonPill());
        try {
            worker.join();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for S3 uploads to finish", ex);
        } finally {
            s3Client.close();
        }
        LOGGER.info("S3 sync finished: {} batch files uploaded, {} failed", uploaded.get(), failed.get());
    }

    private void run() {
        try {
            while (true) {
                UploadTask task = queue.take();
                if (task.poison()) {
                    return;
                }
                upload(task.path());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("S3 sync worker interrupted; {} batch files not uploaded", queue.size(), ex);
        }
    }

    private void upload(Path path) {
        String key = keyFor(path);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(JSON_CONTENT_TYPE)
                    .build();
            s3Client.putObject(request, RequestBody.fromFile(path));
            uploaded.incrementAndGet();
            LOGGER.info("Uploaded {} to s3://{}/{}", path.getFileName(), bucket, key);
        } catch (SdkException ex) {
            failed.incrementAndGet();
            LOGGER.warn("Failed to upload {} to s3://{}/{}", path, bucket, key, ex);
        }
    }

    String keyFor(Path path) {
        Path relative = outputDirectory.relativize(path.toAbsolutePath().normalize());
        String name = relative.toString().replace("\\", "/");
        return keyPrefix.isEmpty() ? name : keyPrefix + "/" + name;
    }

    private static String normalizePrefix(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replaceAll("/+$", "");
    }

    private record UploadTask(Path path, boolean poison) {
        private UploadTask(Path path) {
            this(path, false);
        }

        private static UploadTask poisonPill() {
            return new UploadTask(null, true);
        }
    }
}
