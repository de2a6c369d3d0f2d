package com.maintenance.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Failure label reported for a machine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FailureEventDTO {

    @NotBlank(message = "machine_id is required")
    @JsonProperty("machine_id")
    private String machineId;

    @NotBlank(message = "timestamp_utc is required")
    @JsonProperty("timestamp_utc")
    @JsonAlias("timestamp")
    private String timestamp;

    @NotBlank(message = "failure_code is required")
    @JsonProperty("failure_code")
    @JsonAlias("codigo_evento")
    private String failureCode;

    @JsonProperty("measured_value")
    @JsonAlias("valor_medido")
    private Double measuredValue;
}
