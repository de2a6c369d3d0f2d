package com.maintenance.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A single raw telemetry event as read from the data lake.
 *
 * The timestamp is kept as the original text; parsing and validation happen
 * in the window assembler so malformed events can be counted instead of failing a read.
 * At most one of the reading fields is populated.
 */
@Value
@Builder
public class RawEvent {

    String machineId;
    String timestamp;
    Double temperatureCelsius;
    Double vibrationRms;
    String failureCode;
}
