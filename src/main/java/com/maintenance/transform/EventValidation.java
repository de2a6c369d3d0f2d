package com.maintenance.transform;

import com.maintenance.domain.RawEvent;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * Outcome of validating one raw event: either the event with its parsed
 * timestamp, or the reason it was dropped.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class EventValidation {

    private final RawEvent event;
    private final Instant timestamp;
    private final DropReason dropReason;

    public static EventValidation valid(RawEvent event, Instant timestamp) {
        return new EventValidation(event, timestamp, null);
    }

    public static EventValidation dropped(RawEvent event, DropReason reason) {
        return new EventValidation(event, null, reason);
    }

    public boolean isValid() {
        return dropReason == null;
    }

    /**
     * Validates machine id and timestamp. Never throws.
     */
    public static EventValidation of(RawEvent event) {
        if (event.getMachineId() == null || event.getMachineId().isBlank()) {
            return dropped(event, DropReason.MISSING_MACHINE_ID);
        }
        if (event.getTimestamp() == null || event.getTimestamp().isBlank()) {
            return dropped(event, DropReason.MISSING_TIMESTAMP);
        }
        try {
            return valid(event, Timestamps.parse(event.getTimestamp()));
        } catch (RuntimeException e) {
            return dropped(event, DropReason.MALFORMED_TIMESTAMP);
        }
    }
}
