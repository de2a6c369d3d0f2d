package com.maintenance.controller;

import com.maintenance.dto.FeatureResponse;
import com.maintenance.model.TrainingFeature;
import com.maintenance.service.FeatureQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Serving reads of the latest features per machine.
 */
@RestController
@RequiredArgsConstructor
public class FeatureController {

    private final FeatureQueryService featureQueryService;

    @GetMapping("/features")
    public ResponseEntity<List<FeatureResponse>> listFeatures() {
        return ResponseEntity.ok(featureQueryService.listLatest());
    }

    /**
     * GET /features/PUMP-A01 - 404 when the machine has never been processed.
     */
    @GetMapping("/features/{machineId}")
    public ResponseEntity<FeatureResponse> getFeatures(@PathVariable String machineId) {
        return featureQueryService.getLatest(machineId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/features/{machineId}/history")
    public ResponseEntity<List<TrainingFeature>> getHistory(@PathVariable String machineId) {
        return ResponseEntity.ok(featureQueryService.getHistory(machineId));
    }
}
