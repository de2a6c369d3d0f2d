package com.maintenance.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Features emitted for one machine by one pipeline run.
 *
 * {@code vibMedia5h} is an exponential moving average (rounded to 4 places) despite its name;
 * {@code tempMax24h} is rounded to 2 places. {@code state} holds the unrounded values
 * the next run continues from. {@code labelFailure} stays null until the labeler runs.
 */
@Value
@Builder(toBuilder = true)
@With
public class FeatureRecord {

    String machineId;
    Instant windowStart;
    Instant windowEnd;
    Instant timestampProcessed;
    double vibMedia5h;
    double tempMax24h;
    long labelHorizonHours;
    Integer labelFailure;
    MachineFeatureState state;

    public static String labelName(long horizonHours) {
        return "label_failure_in_" + horizonHours + "h";
    }
}
