package com.maintenance.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maintenance.domain.RawEvent;
import com.maintenance.dto.TelemetryEventDTO;
import com.maintenance.exception.ExtractionException;
import com.maintenance.port.EventReader;
import com.maintenance.transform.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads raw events from the hour-partitioned JSONL layout.
 *
 * Every hour partition overlapping the requested range is scanned; events
 * whose timestamp parses but lies outside the range are filtered out, events
 * with unusable timestamps are passed through for the assembler to drop.
 * Lines that are not valid UTF-8 or not valid JSON are logged and skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PartitionedEventReader implements EventReader {

    private final PartitionLayout layout;
    private final ObjectMapper objectMapper;
    private final IoRetry retry;

    @Override
    public List<RawEvent> fetch(Instant start, Instant end) {
        List<RawEvent> events = new ArrayList<>();
        for (Instant hour : PartitionLayout.hoursCovering(start, end)) {
            Path directory = layout.hourDirectory(hour);
            if (!Files.isDirectory(directory)) {
                log.debug("No partition at {}", directory);
                continue;
            }
            log.info("Reading partition {}", directory);
            try {
                for (Path file : retry.execute("List " + directory, () -> listFiles(directory))) {
                    byte[] content = retry.execute("Read " + file, () -> Files.readAllBytes(file));
                    parse(file, content, start, end, events);
                }
            } catch (IOException e) {
                throw new ExtractionException("Failed to read partition " + directory, e);
            }
        }
        log.info("Found {} events in [{}, {})", events.size(), start, end);
        return events;
    }

    private List<Path> listFiles(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(f -> f.getFileName().toString().endsWith(PartitionLayout.FILE_SUFFIX))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    /**
     * Splits {@code content} on line feeds and decodes each line on its own, so
     * a line that is not valid UTF-8 or not valid JSON only costs that line.
     */
    private void parse(Path file, byte[] content, Instant start, Instant end, List<RawEvent> out) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        int lineNumber = 0;
        int lineStart = 0;
        for (int i = 0; i <= content.length; i++) {
            if (i < content.length && content[i] != '\n') {
                continue;
            }
            lineNumber++;
            int lineEnd = i > lineStart && content[i - 1] == '\r' ? i - 1 : i;
            int length = lineEnd - lineStart;
            int offset = lineStart;
            lineStart = i + 1;

            String line;
            try {
                line = decoder.decode(ByteBuffer.wrap(content, offset, length)).toString();
            } catch (CharacterCodingException e) {
                log.warn("Skipping line {} in {}: not valid UTF-8", lineNumber, file);
                continue;
            }
            if (line.isBlank()) {
                continue;
            }
            TelemetryEventDTO dto;
            try {
                dto = objectMapper.readValue(line, TelemetryEventDTO.class);
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed line {} in {}: {}", lineNumber, file, e.getOriginalMessage());
                continue;
            }
            RawEvent event = dto.toRawEvent();
            if (inRange(event, start, end)) {
                out.add(event);
            }
        }
    }

    private boolean inRange(RawEvent event, Instant start, Instant end) {
        if (event.getTimestamp() == null) {
            return true;
        }
        Instant timestamp;
        try {
            timestamp = Timestamps.parse(event.getTimestamp());
        } catch (RuntimeException e) {
            return true;
        }
        return !timestamp.isBefore(start) && timestamp.isBefore(end);
    }
}
