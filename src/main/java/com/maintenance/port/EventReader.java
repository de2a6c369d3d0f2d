package com.maintenance.port;

import com.maintenance.domain.RawEvent;

import java.time.Instant;
import java.util.List;

/**
 * Source of raw telemetry events.
 */
public interface EventReader {

    /**
     * Returns the raw events of {@code [start, end)}. Hours without data yield nothing.
     *
     * @throws com.maintenance.exception.ExtractionException if the store cannot be read
     */
    List<RawEvent> fetch(Instant start, Instant end);
}
