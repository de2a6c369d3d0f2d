package com.maintenance.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.maintenance.domain.FeatureRecord;
import com.maintenance.model.ServingFeature;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Serving view of a machine's latest features.
 *
 * The label is exposed under its horizon-specific name, e.g. {@code label_failure_in_24h}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureResponse {

    @JsonProperty("machine_id")
    private String machineId;

    @JsonProperty("timestamp_processed")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'", timezone = "UTC")
    private Instant timestampProcessed;

    @JsonProperty("window_start")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'", timezone = "UTC")
    private Instant windowStart;

    @JsonProperty("window_end")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'", timezone = "UTC")
    private Instant windowEnd;

    @JsonProperty("vib_media_5h")
    private double vibMedia5h;

    @JsonProperty("temp_max_24h")
    private double tempMax24h;

    @JsonIgnore
    private long labelHorizonHours;

    @JsonIgnore
    private int labelFailure;

    @JsonAnyGetter
    public Map<String, Object> label() {
        return Map.of(FeatureRecord.labelName(labelHorizonHours), labelFailure);
    }

    public static FeatureResponse from(ServingFeature feature) {
        return FeatureResponse.builder()
            .machineId(feature.getMachineId())
            .timestampProcessed(feature.getTimestampProcessed())
            .windowStart(feature.getWindowStart())
            .windowEnd(feature.getWindowEnd())
            .vibMedia5h(feature.getVibMedia5h())
            .tempMax24h(feature.getTempMax24h())
            .labelHorizonHours(feature.getLabelHorizonHours())
            .labelFailure(feature.getLabelFailure())
            .build();
    }
}
