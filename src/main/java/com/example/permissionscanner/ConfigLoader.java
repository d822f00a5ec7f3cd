package com.example.permissionscanner;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ConfigLoader {
    static final int DEFAULT_BATCH_SIZE = 1000;
    static final int DEFAULT_PAGE_SIZE = 5000;
    static final int MAX_PAGE_SIZE = 5000;
    static final int DEFAULT_MAX_NESTING_LEVEL = 5;
    static final int MAX_NESTING_LEVEL_LIMIT = 20;
    static final int DEFAULT_MAX_SUBSITE_DEPTH = 5;
    static final int DEFAULT_FETCH_THREADS = 4;
    static final int DEFAULT_RETRY_ATTEMPTS = 5;
    static final long DEFAULT_RETRY_BASE_DELAY_MILLIS = 1_000L;
    static final long DEFAULT_RETRY_MAX_DELAY_MILLIS = 60_000L;
    private static final List<Integer> DEFAULT_INCLUDED_TEMPLATES = List.of(100, 101, 119);
    private static final List<String> DEFAULT_IGNORE_CONTAINERS = List.of(
            "Style Library",
            "Form Templates",
            "Site Assets",
            "Preservation Hold Library",
            "appdata",
            "appfiles",
            "TaxonomyHiddenList",
            "User Information List"
    );
    private static final List<String> DEFAULT_IGNORE_PERMISSION_LEVELS = List.of("Limited Access");
    private static final List<String> DEFAULT_IGNORE_ACCOUNTS = List.of(
            "SHAREPOINT\\system",
            "app@sharepoint"
    );
    private static final List<String> DEFAULT_DO_NOT_RESOLVE = List.of(
            "Everyone",
            "Everyone except external users",
            "c:0(.s|true"
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ScannerConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);
        Path base = path.toAbsolutePath().getParent();
        return build(raw, base);
    }

    /**
     * Parses a configuration document; relative paths resolve against the working directory.
     */
    public ScannerConfig parse(String json) throws IOException {
        return build(mapper.readValue(json, RawConfig.class), null);
    }

    private ScannerConfig build(RawConfig raw, Path base) throws IOException {
        List<String> targets = new ArrayList<>();
        if (raw.targets != null) {
            raw.targets.stream().filter(value -> value != null && !value.isBlank()).map(String::trim).forEach(targets::add);
        }
        if (raw.targetsFile != null && !raw.targetsFile.isBlank()) {
            targets.addAll(readTargetsFile(resolve(base, raw.targetsFile)));
        }
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("Config must include at least one target.");
        }

        int maxNesting = raw.maxGroupNestingLevel == null ? DEFAULT_MAX_NESTING_LEVEL : raw.maxGroupNestingLevel;
        if (maxNesting < 0 || maxNesting > MAX_NESTING_LEVEL_LIMIT) {
            throw new IllegalArgumentException("maxGroupNestingLevel must be between 0 and " + MAX_NESTING_LEVEL_LIMIT + ", was " + maxNesting);
        }
        int pageSize = raw.pageSize == null ? DEFAULT_PAGE_SIZE : raw.pageSize;
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + MAX_PAGE_SIZE + ", was " + pageSize);
        }

        Path outputDirectory = resolve(base, optionalString(raw.outputDirectory, "output"));
        int batchSize = positiveOr(raw.batchSize, DEFAULT_BATCH_SIZE);
        int fetchThreads = positiveOr(raw.fetchThreads, DEFAULT_FETCH_THREADS);
        int maxSubsiteDepth = raw.maxSubsiteDepth != null && raw.maxSubsiteDepth >= 0
                ? raw.maxSubsiteDepth
                : DEFAULT_MAX_SUBSITE_DEPTH;
        boolean includeSubsites = raw.includeSubsites != null && raw.includeSubsites;
        int retryAttempts = positiveOr(raw.retryAttempts, DEFAULT_RETRY_ATTEMPTS);
        long retryBaseDelay = raw.retryBaseDelayMillis != null && raw.retryBaseDelayMillis >= 0
                ? raw.retryBaseDelayMillis
                : DEFAULT_RETRY_BASE_DELAY_MILLIS;
        long retryMaxDelay = raw.retryMaxDelayMillis != null && raw.retryMaxDelayMillis >= retryBaseDelay
                ? raw.retryMaxDelayMillis
                : Math.max(retryBaseDelay, DEFAULT_RETRY_MAX_DELAY_MILLIS);

        Optional<Path> checkpointFile = Optional.ofNullable(raw.checkpointFile)
                .filter(value -> !value.isBlank())
                .map(value -> resolve(base, value));
        Optional<Path> snapshotFile = Optional.ofNullable(raw.snapshotFile)
                .filter(value -> !value.isBlank())
                .map(value -> resolve(base, value));
        Optional<Long> maxItems = Optional.ofNullable(raw.maxItems).filter(value -> value > 0);
        Optional<Path> directoryCacheDirectory = Optional.ofNullable(raw.directoryCacheDirectory)
                .filter(value -> !value.isBlank())
                .map(value -> resolve(base, value));
        boolean deleteDirectoryCache = raw.deleteDirectoryCache != null && raw.deleteDirectoryCache;

        boolean s3SyncEnabled = raw.s3SyncEnabled != null && raw.s3SyncEnabled;
        Optional<String> s3Bucket = Optional.ofNullable(raw.s3Bucket).filter(value -> !value.isBlank());
        Optional<String> s3Prefix = Optional.ofNullable(raw.s3Prefix).filter(value -> !value.isBlank());
        Optional<String> s3Region = Optional.ofNullable(raw.s3Region).filter(value -> !value.isBlank());
        if (s3SyncEnabled && s3Bucket.isEmpty()) {
            throw new IllegalArgumentException("s3Bucket is required when s3SyncEnabled is true.");
        }

        List<Integer> templates = raw.includedTemplates == null || raw.includedTemplates.isEmpty()
                ? DEFAULT_INCLUDED_TEMPLATES
                : List.copyOf(raw.includedTemplates);

        return new ScannerConfig(
                List.copyOf(targets),
                outputDirectory,
                batchSize,
                checkpointFile,
                fetchThreads,
                pageSize,
                maxNesting,
                includeSubsites,
                maxSubsiteDepth,
                templates,
                mergePatterns(DEFAULT_IGNORE_CONTAINERS, raw.ignoreContainers),
                replaceOrDefault(DEFAULT_IGNORE_PERMISSION_LEVELS, raw.ignorePermissionLevels),
                mergePatterns(DEFAULT_IGNORE_ACCOUNTS, raw.ignoreAccounts),
                mergePatterns(List.of(), raw.ignoreContainerGroups),
                replaceOrDefault(DEFAULT_DO_NOT_RESOLVE, raw.doNotResolveGroups),
                retryAttempts,
                retryBaseDelay,
                retryMaxDelay,
                snapshotFile,
                maxItems,
                directoryCacheDirectory,
                deleteDirectoryCache,
                s3SyncEnabled,
                s3Bucket,
                s3Prefix,
                s3Region
        );
    }

    private List<String> readTargetsFile(Path file) throws IOException {
        List<String> targets = new ArrayList<>();
        for (String line : Files.readAllLines(file)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            targets.add(trimmed);
        }
        return targets;
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    // An explicit list, even an empty one, replaces the defaults.
    private List<String> replaceOrDefault(List<String> defaults, List<String> overrides) {
        if (overrides == null) {
            return defaults;
        }
        return overrides.stream().filter(value -> value != null && !value.isBlank()).toList();
    }

    private int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private Path resolve(Path base, String value) {
        Path path = Path.of(value);
        return base == null || path.isAbsolute() ? path : base.resolve(path);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public List<String> targets = new ArrayList<>();
        public String targetsFile;
        public String outputDirectory;
        public Integer batchSize;
        public String checkpointFile;
        public Integer fetchThreads;
        public Integer pageSize;
        public Integer maxGroupNestingLevel;
        public Boolean includeSubsites;
        public Integer maxSubsiteDepth;
        public List<Integer> includedTemplates;
        public List<String> ignoreContainers;
        public List<String> ignorePermissionLevels;
        public List<String> ignoreAccounts;
        public List<String> ignoreContainerGroups;
        public List<String> doNotResolveGroups;
        public Integer retryAttempts;
        public Long retryBaseDelayMillis;
        public Long retryMaxDelayMillis;
        public String snapshotFile;
        public Long maxItems;
        public String directoryCacheDirectory;
        public Boolean deleteDirectoryCache;
        public Boolean s3SyncEnabled;
        public String s3Bucket;
        public String s3Prefix;
        public String s3Region;
    }
}
