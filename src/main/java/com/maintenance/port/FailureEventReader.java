package com.maintenance.port;

import com.maintenance.domain.FailureEvent;

import java.time.Instant;
import java.util.List;

/**
 * Source of recorded machine failures, used for labeling.
 */
public interface FailureEventReader {

    /**
     * Returns the failures recorded in {@code [start, end)}.
     *
     * @throws com.maintenance.exception.ExtractionException if the store cannot be read
     */
    List<FailureEvent> fetch(Instant start, Instant end);
}
