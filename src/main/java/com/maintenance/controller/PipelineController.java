package com.maintenance.controller;

import com.maintenance.pipeline.FeaturePipeline;
import com.maintenance.pipeline.PipelineRunResult;
import com.maintenance.pipeline.RunOutcome;
import com.maintenance.port.CheckpointStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Pipeline operations.
 *
 * 1. POST /pipeline/run - Run the pipeline once
 * 2. GET /pipeline/checkpoint - Current checkpoint
 * 3. PUT /pipeline/checkpoint?value=2025-01-15T00:00:00Z - Reset the checkpoint for replay
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class PipelineController {

    private final FeaturePipeline pipeline;
    private final CheckpointStore checkpointStore;

    @PostMapping("/pipeline/run")
    public ResponseEntity<PipelineRunResult> run() {
        log.info("Manual pipeline run requested");
        PipelineRunResult result = pipeline.run();
        if (result.getOutcome() == RunOutcome.SKIPPED_CONCURRENT_RUN) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(result);
        }
        if (result.getOutcome() == RunOutcome.FAILED) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/pipeline/checkpoint")
    public ResponseEntity<Map<String, Instant>> getCheckpoint() {
        return ResponseEntity.ok(Map.of("checkpoint", checkpointStore.get()));
    }

    @PutMapping("/pipeline/checkpoint")
    public ResponseEntity<Map<String, Instant>> resetCheckpoint(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant value) {
        log.warn("Checkpoint reset to {} requested", value);
        checkpointStore.reset(value);
        return ResponseEntity.ok(Map.of("checkpoint", value));
    }
}
