package com.example.permissionscanner;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Immutable runtime settings for a scan run.
 */
public record ScannerConfig(
        List<String> targets,
        Path outputDirectory,
        int batchSize,
        Optional<Path> checkpointFile,
        int fetchThreads,
        int pageSize,
        int maxGroupNestingLevel,
        boolean includeSubsites,
        int maxSubsiteDepth,
        List<Integer> includedTemplates,
        List<String> ignoreContainers,
        List<String> ignorePermissionLevels,
        List<String> ignoreAccounts,
        List<String> ignoreContainerGroups,
        List<String> doNotResolveGroups,
        int retryAttempts,
        long retryBaseDelayMillis,
        long retryMaxDelayMillis,
        Optional<Path> snapshotFile,
        Optional<Long> maxItems,
        Optional<Path> directoryCacheDirectory,
        boolean deleteDirectoryCache,
        boolean s3SyncEnabled,
        Optional<String> s3Bucket,
        Optional<String> s3Prefix,
        Optional<String> s3Region
) {
    public Path resolvedCheckpointFile() {
        return checkpointFile.orElse(outputDirectory.resolve("checkpoint.json"));
    }

    public boolean isIgnoredAccount(String loginName) {
        if (loginName == null || loginName.isEmpty()) {
            return false;
        }
        for (String ignored : ignoreAccounts) {
            if (loginName.contains(ignored)) {
                return true;
            }
        }
        return false;
    }

    public boolean isIgnoredPermissionLevel(String level) {
        return ignorePermissionLevels.contains(level);
    }
}
