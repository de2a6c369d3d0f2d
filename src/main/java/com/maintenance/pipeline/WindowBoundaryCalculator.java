package com.maintenance.pipeline;

import com.maintenance.domain.PipelineWindows;
import com.maintenance.exception.PipelineConfigurationException;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Derives a run's feature and label windows from the checkpoint.
 *
 * cutoff = now - processingLag. Nothing is processable while the checkpoint is
 * at or past the cutoff. Otherwise the feature window starts at the checkpoint
 * and spans timeWindow, clipped to the cutoff, and the label window covers
 * predictionHorizon right after it.
 */
@Getter
public class WindowBoundaryCalculator {

    private final Duration timeWindow;
    private final Duration predictionHorizon;
    private final Duration processingLag;

    public WindowBoundaryCalculator(Duration timeWindow, Duration predictionHorizon, Duration processingLag) {
        requirePositive("pipeline.time-window", timeWindow);
        requirePositive("pipeline.prediction-horizon", predictionHorizon);
        if (processingLag == null || processingLag.isNegative()) {
            throw new PipelineConfigurationException("pipeline.processing-lag must not be negative: " + processingLag);
        }
        this.timeWindow = timeWindow;
        this.predictionHorizon = predictionHorizon;
        this.processingLag = processingLag;
    }

    public Instant cutoff(Instant now) {
        return now.minus(processingLag);
    }

    /**
     * @return the run's windows, or empty when the checkpoint has caught up with the cutoff
     */
    public Optional<PipelineWindows> compute(Instant lastProcessed, Instant now) {
        Instant cutoff = cutoff(now);
        if (!lastProcessed.isBefore(cutoff)) {
            return Optional.empty();
        }
        Instant featuresStart = lastProcessed;
        Instant candidateEnd = featuresStart.plus(timeWindow);
        Instant featuresEnd = candidateEnd.isBefore(cutoff) ? candidateEnd : cutoff;
        return Optional.of(new PipelineWindows(
            featuresStart,
            featuresEnd,
            featuresEnd,
            featuresEnd.plus(predictionHorizon)));
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new PipelineConfigurationException(name + " must be positive: " + value);
        }
    }
}
