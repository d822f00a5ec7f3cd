package com.example.permissionscanner;

import com.example.permissionscanner.model.EffectiveAccessEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Keeps directory-group expansions on disk between runs, one JSON file per group id.
 */
public final class DirectoryGroupCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryGroupCache.class);
    private static final TypeReference<List<EffectiveAccessEntry>> ENTRIES = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final Path directory;

    public DirectoryGroupCache(Path directory) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.directory = directory;
    }

    /**
     * A missing file loads as empty; so does an unreadable one, with a warning.
     */
    public Optional<List<EffectiveAccessEntry>> load(String groupId) {
        Path file = fileFor(groupId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(List.copyOf(mapper.readValue(file.toFile(), ENTRIES)));
        } catch (IOException ex) {
            LOGGER.warn("Ignoring unreadable group cache file {}: {}", file, ex.getMessage());
            return Optional.empty();
        }
    }

    public void save(String groupId, List<EffectiveAccessEntry> entries) throws IOException {
        Files.createDirectories(directory);
        mapper.writerWithDefaultPrettyPrinter().writeValue(fileFor(groupId).toFile(), entries);
    }

    /**
     * Deletes every cached group file and returns how many were removed.
     */
    public int clear() throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        int deleted = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                Files.delete(file);
                deleted++;
            }
        }
        LOGGER.info("Deleted {} cached directory group(s) from {}", deleted, directory);
        return deleted;
    }

    public Path directory() {
        return directory;
    }

    Path fileFor(String groupId) {
        return directory.resolve(groupId.replaceAll("[^A-Za-z0-9._-]", "_") + ".json");
    }
}
