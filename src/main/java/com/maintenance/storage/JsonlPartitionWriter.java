package com.maintenance.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Writes raw events into hour partitions, one JSON object per line.
 *
 * Each call creates a new file so concurrent writers never append to the same file.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonlPartitionWriter {

    private final PartitionLayout layout;
    private final ObjectMapper objectMapper;

    /**
     * @param hour   partition hour (truncated by the caller)
     * @param kind   file name prefix, e.g. {@code telemetry} or {@code failure}
     * @param events objects to serialize
     * @return the written file
     */
    public Path write(Instant hour, String kind, List<?> events) {
        Path directory = layout.hourDirectory(hour);
        Path file = directory.resolve(kind + "_" + hour.toEpochMilli() + "_" + UUID.randomUUID() + PartitionLayout.FILE_SUFFIX);
        try {
            Files.createDirectories(directory);
            Files.write(file, toLines(events), StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
        log.debug("Wrote {} events to {}", events.size(), file);
        return file;
    }

    private List<String> toLines(List<?> events) throws JsonProcessingException {
        List<String> lines = new ArrayList<>(events.size());
        for (Object event : events) {
            lines.add(objectMapper.writeValueAsString(event));
        }
        return lines;
    }
}
