package com.example.permissionscanner;

import com.example.permissionscanner.model.Checkpoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

public final class CheckpointManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(CheckpointManager.class);

    private final ObjectMapper mapper;
    private final Path checkpointPath;

    /**
     * Manages persistence of scan checkpoints to a single JSON file.
     */
    public CheckpointManager(Path checkpointPath) {
        this.mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        this.checkpointPath = checkpointPath;
    }

    /**
     * Returns the last saved checkpoint. A missing file loads as empty; so does an unreadable one, with a warning.
     */
    public Optional<Checkpoint> load() {
        if (!Files.exists(checkpointPath)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(checkpointPath.toFile(), Checkpoint.class));
        } catch (IOException ex) {
            LOGGER.warn("Ignoring unreadable checkpoint {}; starting from the beginning: {}", checkpointPath, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes the checkpoint to a temporary sibling and moves it over the previous one, so a crash leaves either
     * the old or the new checkpoint on disk.
     */
    public void save(Checkpoint checkpoint) throws IOException {
        Path parent = checkpointPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = parent.resolve(checkpointPath.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), checkpoint);
        try {
            Files.move(temp, checkpointPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            LOGGER.debug("Atomic move not supported for {}, replacing", checkpointPath);
            Files.move(temp, checkpointPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public void clear() throws IOException {
        Files.deleteIfExists(checkpointPath);
    }

    /**
     * Exposes the underlying checkpoint file path.
     */
    public Path path() {
        return checkpointPath;
    }
}
