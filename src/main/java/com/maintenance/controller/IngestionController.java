package com.maintenance.controller;

import com.maintenance.dto.BatchIngestResponse;
import com.maintenance.dto.FailureEventDTO;
import com.maintenance.dto.TelemetryEventDTO;
import com.maintenance.model.FailureHistoryEntry;
import com.maintenance.service.IngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Ingestion endpoints.
 *
 * 1. POST /telemetry/batch - Raw sensor events into the data lake
 * 2. POST /failures - Failure labels into the failure history
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class IngestionController {

    private final IngestionService ingestionService;

    /**
     * Request body: JSON array of events, e.g.
     * {@code [{"machine_id":"PUMP-A01","timestamp_utc":"2025-01-15T10:00:15Z","vibration_rms":3.2}]}
     */
    @PostMapping("/telemetry/batch")
    public ResponseEntity<BatchIngestResponse> ingestTelemetry(@RequestBody List<TelemetryEventDTO> events) {
        log.info("Received telemetry batch of {} events", events.size());
        return ResponseEntity.ok(ingestionService.ingestTelemetry(events));
    }

    @PostMapping("/failures")
    public ResponseEntity<FailureHistoryEntry> recordFailure(@Valid @RequestBody FailureEventDTO failure) {
        log.info("Received failure {} for machine {}", failure.getFailureCode(), failure.getMachineId());
        return ResponseEntity.status(HttpStatus.CREATED).body(ingestionService.recordFailure(failure));
    }
}
