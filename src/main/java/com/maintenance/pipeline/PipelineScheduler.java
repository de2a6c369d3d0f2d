package com.maintenance.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers the feature pipeline on {@code pipeline.schedule.cron}.
 */
@Component
@ConditionalOnProperty(prefix = "pipeline.schedule", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PipelineScheduler {

    private final FeaturePipeline pipeline;

    @Scheduled(cron = "${pipeline.schedule.cron:0 5 * * * *}", zone = "UTC")
    public void runScheduled() {
        log.info("--- Scheduled feature pipeline run starting ---");
        PipelineRunResult result = pipeline.run();
        if (result.isSuccess()) {
            log.info("--- Scheduled run finished: {} ---", result.getOutcome());
        } else {
            log.error("--- Scheduled run finished: {} ({}: {}) ---",
                result.getOutcome(), result.getFailureType(), result.getFailureMessage());
        }
    }
}
