package com.maintenance.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.Instant;

/**
 * Settings for the feature pipeline, bound from {@code pipeline.*}.
 *
 * Durations accept Spring's formats ({@code 1h}, {@code PT25H}, ...).
 * Missing or invalid values fail the application context at startup.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /**
     * Root directory acting as the data-lake bucket.
     */
    @NotBlank
    private String bucket;

    /**
     * Prefix under the bucket holding the hour-partitioned raw events.
     */
    @NotBlank
    private String rawPrefix = "raw";

    /**
     * Width of the feature window processed by a single run.
     */
    @NotNull
    private Duration timeWindow = Duration.ofHours(1);

    /**
     * Look-ahead after the feature window in which a failure sets the label.
     */
    @NotNull
    private Duration predictionHorizon = Duration.ofHours(24);

    /**
     * Safety margin subtracted from "now" so extraction never reads data still arriving.
     */
    @NotNull
    private Duration processingLag = Duration.ofHours(25);

    /**
     * Checkpoint used when the store holds none yet. Without it the first run fails.
     */
    private Instant initialCheckpoint;

    /**
     * Re-derive each machine's EMA / rolling max from its previous serving record.
     * When false every run starts from cold state.
     */
    private boolean carryState = true;

    @Valid
    private final Retry retry = new Retry();

    @Valid
    private final Schedule schedule = new Schedule();

    @Data
    public static class Retry {

        @Min(1)
        @Max(10)
        private int maxAttempts = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(200);
    }

    @Data
    public static class Schedule {

        private boolean enabled = true;

        @NotBlank
        private String cron = "0 5 * * * *";
    }

    /**
     * The horizon appears in the label name in hours, so it must be a whole number of them.
     */
    @AssertTrue(message = "pipeline.prediction-horizon must be a positive whole number of hours")
    public boolean isPredictionHorizonInWholeHours() {
        return predictionHorizon == null
            || (!predictionHorizon.isNegative() && !predictionHorizon.isZero()
                && predictionHorizon.equals(Duration.ofHours(predictionHorizon.toHours())));
    }

    /**
     * Prediction horizon in whole hours, as used in the label name.
     */
    public long predictionHorizonHours() {
        return predictionHorizon.toHours();
    }
}
