package com.maintenance.transform;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;

/**
 * ISO-8601 parsing for event timestamps.
 *
 * Accepts a trailing {@code Z}, an explicit offset, or no zone at all (read as UTC).
 */
public final class Timestamps {

    private Timestamps() {
    }

    /**
     * @throws java.time.format.DateTimeParseException if the text is not an ISO date-time
     */
    public static Instant parse(String text) {
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parse(text.trim());
        if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            return OffsetDateTime.from(parsed).toInstant();
        }
        return LocalDateTime.from(parsed).toInstant(ZoneOffset.UTC);
    }

    public static Instant truncateToMinute(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MINUTES);
    }

    public static Instant truncateToHour(Instant instant) {
        return instant.truncatedTo(ChronoUnit.HOURS);
    }
}
