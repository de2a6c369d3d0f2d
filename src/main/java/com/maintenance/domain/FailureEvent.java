package com.maintenance.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class FailureEvent {

    String machineId;
    Instant timestamp;
    String failureCode;
    Double measuredValue;
}
