package com.example.permissionscanner;

import com.example.permissionscanner.model.EffectiveAccessEntry;
import com.example.permissionscanner.model.PrincipalKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the two group caches of a scan run. Directory groups are cached for the whole run; container
 * groups only until the next target begins. Values are group expansions relative to the group itself.
 * With a {@link DirectoryGroupCache}, directory groups are also read from and written to disk, so later
 * runs reuse them. Not thread-safe: only the orchestrator thread reads or writes it.
 */
public final class ResolutionContext {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResolutionContext.class);

    private final Map<String, List<EffectiveAccessEntry>> directoryCache = new HashMap<>();
    private final Map<String, List<EffectiveAccessEntry>> scopedCache = new HashMap<>();
    private final Optional<DirectoryGroupCache> persistent;
    private long hits;
    private long misses;

    public ResolutionContext() {
        this(Optional.empty());
    }

    public ResolutionContext(Optional<DirectoryGroupCache> persistent) {
        this.persistent = persistent;
    }

    public Optional<List<EffectiveAccessEntry>> cached(PrincipalKind kind, String groupId) {
        Map<String, List<EffectiveAccessEntry>> cache = cacheFor(kind);
        List<EffectiveAccessEntry> entries = cache.get(groupId);
        if (entries == null && kind == PrincipalKind.DIRECTORY_GROUP && persistent.isPresent()) {
            entries = persistent.get().load(groupId).orElse(null);
            if (entries != null) {
                cache.put(groupId, entries);
            }
        }
        if (entries == null) {
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(entries);
    }

    public void store(PrincipalKind kind, String groupId, List<EffectiveAccessEntry> expansion) {
        List<EffectiveAccessEntry> entries = List.copyOf(expansion);
        cacheFor(kind).put(groupId, entries);
        if (kind == PrincipalKind.DIRECTORY_GROUP && persistent.isPresent()) {
            try {
                persistent.get().save(groupId, entries);
            } catch (IOException ex) {
                LOGGER.warn("Could not write group {} to {}; it stays cached for this run only: {}",
                        groupId, persistent.get().directory(), ex.getMessage());
            }
        }
    }

    /**
     * Drops container-group expansions; called before each target.
     */
    public void beginTarget() {
        scopedCache.clear();
    }

    public int directoryCacheSize() {
        return directoryCache.size();
    }

    public int scopedCacheSize() {
        return scopedCache.size();
    }

    public long hits() {
        return hits;
    }

    public long misses() {
        return misses;
    }

    private Map<String, List<EffectiveAccessEntry>> cacheFor(PrincipalKind kind) {
        return switch (kind) {
            case DIRECTORY_GROUP -> directoryCache;
            case CONTAINER_GROUP -> scopedCache;
            case USER -> throw new IllegalArgumentException("Users are not cached");
        };
    }
}
