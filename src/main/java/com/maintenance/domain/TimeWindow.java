package com.maintenance.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Sensor channels of one machine aligned on one minute.
 * Absent readings are null.
 */
@Value
@Builder
@With
public class TimeWindow {

    WindowKey key;
    Double temperature;
    Double vibration;
    String failureCode;

    public static TimeWindow empty(WindowKey key) {
        return TimeWindow.builder().key(key).build();
    }

    public String getMachineId() {
        return key.getMachineId();
    }

    public Instant getMinute() {
        return key.getMinute();
    }

    public boolean hasVibration() {
        return vibration != null;
    }

    public boolean hasTemperature() {
        return temperature != null;
    }
}
