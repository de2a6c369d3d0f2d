package com.maintenance.storage;

import com.maintenance.config.PipelineProperties;
import com.maintenance.transform.Timestamps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Hive-style hour partitioning of raw events:
 * {@code <bucket>/<prefix>/year=YYYY/month=MM/day=DD/hour=HH/*.jsonl}.
 */
@Component
@RequiredArgsConstructor
public class PartitionLayout {

    static final String FILE_SUFFIX = ".jsonl";

    private final PipelineProperties properties;

    public Path bucketRoot() {
        return Paths.get(properties.getBucket());
    }

    public Path hourDirectory(Instant hour) {
        ZonedDateTime utc = hour.atZone(ZoneOffset.UTC);
        return bucketRoot()
            .resolve(properties.getRawPrefix())
            .resolve(String.format("year=%04d", utc.getYear()))
            .resolve(String.format("month=%02d", utc.getMonthValue()))
            .resolve(String.format("day=%02d", utc.getDayOfMonth()))
            .resolve(String.format("hour=%02d", utc.getHour()));
    }

    /**
     * Start of every hour that overlaps {@code [start, end)}.
     */
    public static List<Instant> hoursCovering(Instant start, Instant end) {
        List<Instant> hours = new ArrayList<>();
        Instant hour = Timestamps.truncateToHour(start);
        while (hour.isBefore(end)) {
            hours.add(hour);
            hour = hour.plusSeconds(3600);
        }
        return hours;
    }
}
