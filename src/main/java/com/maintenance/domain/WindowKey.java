package com.maintenance.domain;

import lombok.Value;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;

/**
 * Identity of a one-minute window: machine plus the UTC minute it covers.
 * Ordered by minute first so iteration follows time.
 */
@Value
public class WindowKey implements Comparable<WindowKey> {

    private static final DateTimeFormatter MINUTE_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx").withZone(ZoneOffset.UTC);

    private static final Comparator<WindowKey> ORDER = Comparator
        .comparing(WindowKey::getMinute)
        .thenComparing(WindowKey::getMachineId);

    String machineId;
    Instant minute;

    /**
     * Minute rendered with an explicit {@code +00:00} offset, e.g. {@code 2025-01-15T10:00:00+00:00}.
     */
    public String minuteIso() {
        return MINUTE_FORMAT.format(minute);
    }

    @Override
    public int compareTo(WindowKey other) {
        return ORDER.compare(this, other);
    }
}
