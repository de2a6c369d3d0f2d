package com.maintenance.pipeline;

import com.maintenance.domain.FeatureRecord;
import com.maintenance.domain.PipelineWindows;
import com.maintenance.transform.DropReason;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary of one pipeline run.
 */
@Value
@Builder
public class PipelineRunResult {

    String runId;
    RunOutcome outcome;
    PipelineState finalState;
    PipelineWindows windows;
    Instant checkpointBefore;
    Instant checkpointAfter;

    int rawEvents;
    @Builder.Default
    Map<DropReason, Integer> droppedEvents = Map.of();
    int windowCount;
    int failureEvents;
    int positiveLabels;
    @Builder.Default
    List<FeatureRecord> records = List.of();

    String failureType;
    String failureMessage;

    public boolean isSuccess() {
        return outcome.isSuccess();
    }
}
