package com.maintenance.transform;

import com.maintenance.domain.RawEvent;
import com.maintenance.domain.TimeWindow;
import com.maintenance.domain.WindowKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Groups raw events into one-minute windows per machine.
 *
 * Each event fills at most one channel of its window; a later event for the
 * same channel overwrites the earlier value. Events without a machine id or a
 * usable timestamp are dropped and counted, never thrown.
 */
@Component
@Slf4j
public class WindowAssembler {

    public AssemblyResult assemble(Collection<RawEvent> events) {
        SortedMap<WindowKey, TimeWindow> windows = new TreeMap<>();
        Map<DropReason, Integer> dropped = new EnumMap<>(DropReason.class);

        for (RawEvent event : events) {
            EventValidation validation = EventValidation.of(event);
            if (!validation.isValid()) {
                dropped.merge(validation.getDropReason(), 1, Integer::sum);
                log.debug("Dropping event {}: {}", event, validation.getDropReason());
                continue;
            }

            WindowKey key = new WindowKey(event.getMachineId(), Timestamps.truncateToMinute(validation.getTimestamp()));
            TimeWindow window = windows.getOrDefault(key, TimeWindow.empty(key));
            windows.put(key, merge(window, event));
        }

        AssemblyResult result = new AssemblyResult(Collections.unmodifiableSortedMap(windows), Collections.unmodifiableMap(dropped));
        if (result.droppedCount() > 0) {
            log.warn("Dropped {} malformed events while windowing: {}", result.droppedCount(), dropped);
        }
        log.info("Merged {} events into {} windows", events.size(), windows.size());
        return result;
    }

    private TimeWindow merge(TimeWindow window, RawEvent event) {
        if (event.getTemperatureCelsius() != null) {
            return window.withTemperature(event.getTemperatureCelsius());
        }
        if (event.getVibrationRms() != null) {
            return window.withVibration(event.getVibrationRms());
        }
        if (event.getFailureCode() != null) {
            return window.withFailureCode(event.getFailureCode());
        }
        return window;
    }
}
