package com.example.permissionscanner;

import com.example.permissionscanner.model.RecordKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Writes each batch to its own sequential JSON file, {@code <kind prefix><sequence>.json}. Numbering continues
 * after the files already present in the output directory, so a resumed run never overwrites earlier batches.
 */
public final class JsonFileSink implements OutputSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileSink.class);
    private static final Pattern SEQUENCE = Pattern.compile("(\\d{6,})\\.json$");

    private final ObjectMapper mapper;
    private final Path outputDirectory;
    private final BatchFileSyncer syncer;
    private final Map<RecordKind, Integer> nextSequence = new EnumMap<>(RecordKind.class);

    public JsonFileSink(Path outputDirectory) throws IOException {
        this(outputDirectory, BatchFileSyncer.noop());
    }

    public JsonFileSink(Path outputDirectory, BatchFileSyncer syncer) throws IOException {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.outputDirectory = outputDirectory;
        this.syncer = syncer == null ? BatchFileSyncer.noop() : syncer;
        Files.createDirectories(outputDirectory);
        for (RecordKind kind : RecordKind.values()) {
            nextSequence.put(kind, highestSequence(kind) + 1);
        }
    }

    @Override
    public synchronized void writeBatch(RecordKind kind, List<?> rows) throws IOException {
        if (rows.isEmpty()) {
            return;
        }
        int sequence = nextSequence.get(kind);
        Path file = outputDirectory.resolve(String.format("%s%06d.json", kind.filePrefix(), sequence));
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), rows);
        nextSequence.put(kind, sequence + 1);
        LOGGER.debug("Wrote {} {} rows to {}", rows.size(), kind, file.getFileName());
        syncer.enqueue(file);
    }

    /**
     * Sequence number the next batch of {@code kind} will be written under.
     */
    public synchronized int nextSequence(RecordKind kind) {
        return nextSequence.get(kind);
    }

    @Override
    public void close() {
        syncer.close();
    }

    private int highestSequence(RecordKind kind) throws IOException {
        int highest = 0;
        try (Stream<Path> files = Files.list(outputDirectory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                String name = file.getFileName().toString();
                if (!name.startsWith(kind.filePrefix())) {
                    continue;
                }
                Matcher matcher = SEQUENCE.matcher(name.substring(kind.filePrefix().length()));
                if (matcher.matches()) {
                    highest = Math.max(highest, Integer.parseInt(matcher.group(1)));
                }
            }
        }
        return highest;
    }
}
