package com.maintenance.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.maintenance.domain.RawEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire form of a raw telemetry event, one JSON object per line in the data lake
 * and the element type of the ingestion endpoint.
 *
 * Unknown attributes (sensor_type, mqtt_topic, ingestion_timestamp, ...) are ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelemetryEventDTO {

    @JsonProperty("machine_id")
    private String machineId;

    @JsonProperty("timestamp_utc")
    @JsonAlias({"timestamp", "timestamp_registro"})
    private String timestamp;

    @JsonProperty("temperature_celsius")
    private Double temperatureCelsius;

    @JsonProperty("vibration_rms")
    private Double vibrationRms;

    @JsonProperty("failure_code")
    @JsonAlias("codigo_evento")
    private String failureCode;

    /**
     * Number of readings carried by this event.
     */
    public int readingCount() {
        int count = 0;
        if (temperatureCelsius != null) count++;
        if (vibrationRms != null) count++;
        if (failureCode != null) count++;
        return count;
    }

    /**
     * Converts to a raw event keeping a single reading: temperature, then vibration, then failure code.
     */
    public RawEvent toRawEvent() {
        RawEvent.RawEventBuilder builder = RawEvent.builder()
            .machineId(machineId)
            .timestamp(timestamp);
        if (temperatureCelsius != null) {
            builder.temperatureCelsius(temperatureCelsius);
        } else if (vibrationRms != null) {
            builder.vibrationRms(vibrationRms);
        } else if (failureCode != null) {
            builder.failureCode(failureCode);
        }
        return builder.build();
    }
}
