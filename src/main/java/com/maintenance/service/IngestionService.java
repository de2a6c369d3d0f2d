package com.maintenance.service;

import com.maintenance.dto.BatchIngestResponse;
import com.maintenance.dto.FailureEventDTO;
import com.maintenance.dto.TelemetryEventDTO;
import com.maintenance.model.FailureHistoryEntry;
import com.maintenance.repository.FailureHistoryRepository;
import com.maintenance.storage.JsonlPartitionWriter;
import com.maintenance.storage.PartitionLayout;
import com.maintenance.transform.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes incoming telemetry and failure labels where the pipeline reads them.
 *
 * Telemetry goes to the hour partition of its event time so a feature window
 * finds every event it covers. Failures are stored in the failure history and
 * also written to the raw partitions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    private static final Duration MAX_FUTURE_SKEW = Duration.ofMinutes(15);

    private final JsonlPartitionWriter partitionWriter;
    private final PartitionLayout layout;
    private final FailureHistoryRepository failureRepository;
    private final Clock clock;

    /**
     * Validates a telemetry batch and writes the accepted events.
     *
     * Rules:
     * - machine_id is required
     * - timestamp_utc must be ISO-8601 and not more than 15 minutes in the future
     * - exactly one of temperature_celsius, vibration_rms, failure_code
     */
    public BatchIngestResponse ingestTelemetry(List<TelemetryEventDTO> events) {
        BatchIngestResponse response = BatchIngestResponse.builder().build();
        if (events == null || events.isEmpty()) {
            return response;
        }

        Instant now = clock.instant();
        Map<Instant, List<TelemetryEventDTO>> byHour = new TreeMap<>();

        for (int i = 0; i < events.size(); i++) {
            TelemetryEventDTO event = events.get(i);
            String error = validateTelemetry(event, now);
            if (error != null) {
                response.getRejections().add(BatchIngestResponse.RejectionDetail.builder()
                    .index(i)
                    .machineId(event.getMachineId())
                    .reason(error)
                    .build());
                continue;
            }
            Instant hour = Timestamps.truncateToHour(Timestamps.parse(event.getTimestamp()));
            byHour.computeIfAbsent(hour, h -> new ArrayList<>()).add(event);
        }

        int accepted = 0;
        for (Map.Entry<Instant, List<TelemetryEventDTO>> entry : byHour.entrySet()) {
            Path file = partitionWriter.write(entry.getKey(), "telemetry", entry.getValue());
            response.getFiles().add(layout.bucketRoot().relativize(file).toString());
            accepted += entry.getValue().size();
        }
        response.setAccepted(accepted);
        response.setRejected(response.getRejections().size());

        log.info("Telemetry batch: {} accepted into {} partitions, {} rejected",
            accepted, byHour.size(), response.getRejected());
        return response;
    }

    /**
     * Records a failure label.
     *
     * @throws IllegalArgumentException if the timestamp is not ISO-8601
     */
    @Transactional
    public FailureHistoryEntry recordFailure(FailureEventDTO failure) {
        Instant eventTime;
        try {
            eventTime = Timestamps.parse(failure.getTimestamp());
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("INVALID_EVENT_TIME: " + failure.getTimestamp(), e);
        }

        FailureHistoryEntry saved = failureRepository.save(FailureHistoryEntry.builder()
            .machineId(failure.getMachineId())
            .eventTime(eventTime)
            .failureCode(failure.getFailureCode())
            .measuredValue(failure.getMeasuredValue())
            .receivedTime(clock.instant())
            .build());

        TelemetryEventDTO raw = TelemetryEventDTO.builder()
            .machineId(failure.getMachineId())
            .timestamp(failure.getTimestamp())
            .failureCode(failure.getFailureCode())
            .build();
        partitionWriter.write(Timestamps.truncateToHour(eventTime), "failure", List.of(raw));

        log.warn("Failure {} recorded for machine {} at {}", failure.getFailureCode(), failure.getMachineId(), eventTime);
        return saved;
    }

    /**
     * @return error message if invalid, null if valid
     */
    private String validateTelemetry(TelemetryEventDTO event, Instant now) {
        if (event.getMachineId() == null || event.getMachineId().isBlank()) {
            return "MISSING_MACHINE_ID: machine_id is required";
        }
        if (event.getTimestamp() == null || event.getTimestamp().isBlank()) {
            return "INVALID_EVENT_TIME: timestamp_utc is required";
        }
        Instant timestamp;
        try {
            timestamp = Timestamps.parse(event.getTimestamp());
        } catch (RuntimeException e) {
            return "INVALID_EVENT_TIME: timestamp_utc is not ISO-8601";
        }
        if (timestamp.isAfter(now.plus(MAX_FUTURE_SKEW))) {
            return "INVALID_EVENT_TIME: timestamp_utc is more than 15 minutes in the future";
        }
        if (event.readingCount() != 1) {
            return "INVALID_READING: exactly one of temperature_celsius, vibration_rms, failure_code is required";
        }
        return null;
    }
}
