package com.maintenance.transform;

import com.maintenance.domain.RawEvent;
import com.maintenance.domain.TimeWindow;
import com.maintenance.domain.WindowKey;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for minute windowing of raw events.
 */
class WindowAssemblerTest {

    private final WindowAssembler assembler = new WindowAssembler();

    /**
     * Vibration and temperature of the same machine within one minute share one window.
     */
    @Test
    void testEventsOfSameMinuteMergeIntoOneWindow() {
        List<RawEvent> events = List.of(
            RawEvent.builder().machineId("A").timestamp("2025-01-15T10:00:15Z").vibrationRms(2.0).build(),
            RawEvent.builder().machineId("A").timestamp("2025-01-15T10:00:45Z").temperatureCelsius(50.0).build()
        );

        AssemblyResult result = assembler.assemble(events);

        assertEquals(1, result.getWindows().size());
        WindowKey key = result.getWindows().firstKey();
        assertEquals("A", key.getMachineId());
        assertEquals("2025-01-15T10:00:00+00:00", key.minuteIso());

        TimeWindow window = result.getWindows().get(key);
        assertEquals(2.0, window.getVibration());
        assertEquals(50.0, window.getTemperature());
        assertNull(window.getFailureCode());
    }

    /**
     * A later event for the same channel overwrites only that channel.
     */
    @Test
    void testLastWriteWinsPerField() {
        List<RawEvent> events = List.of(
            RawEvent.builder().machineId("A").timestamp("2025-01-15T10:00:01Z").vibrationRms(1.0).build(),
            RawEvent.builder().machineId("A").timestamp("2025-01-15T10:00:02Z").temperatureCelsius(40.0).build(),
            RawEvent.builder().machineId("A").timestamp("2025-01-15T10:00:03Z").vibrationRms(3.5).build(),
            RawEvent.builder().machineId("A").timestamp("2025-01-15T10:00:04Z").failureCode("FAILURE_DETECTED").build()
        );

        TimeWindow window = assembler.assemble(events).orderedWindows().iterator().next();

        assertEquals(3.5, window.getVibration());
        assertEquals(40.0, window.getTemperature());
        assertEquals("FAILURE_DETECTED", window.getFailureCode());
    }

    /**
     * Events without machine id or with unusable timestamps are dropped and counted, not thrown.
     */
    @Test
    void testMalformedEventsAreDroppedAndCounted() {
        List<RawEvent> events = new ArrayList<>();
        events.add(RawEvent.builder().timestamp("2025-01-15T10:00:15Z").vibrationRms(2.0).build());
        events.add(RawEvent.builder().machineId(" ").timestamp("2025-01-15T10:00:15Z").vibrationRms(2.0).build());
        events.add(RawEvent.builder().machineId("A").vibrationRms(2.0).build());
        events.add(RawEvent.builder().machineId("A").timestamp("yesterday").vibrationRms(2.0).build());
        events.add(RawEvent.builder().machineId("A").timestamp("2025-01-15T10:01:00Z").vibrationRms(2.0).build());

        AssemblyResult result = assembler.assemble(events);

        assertEquals(1, result.getWindows().size());
        assertEquals(4, result.droppedCount());
        assertEquals(2, result.getDropped().get(DropReason.MISSING_MACHINE_ID));
        assertEquals(1, result.getDropped().get(DropReason.MISSING_TIMESTAMP));
        assertEquals(1, result.getDropped().get(DropReason.MALFORMED_TIMESTAMP));
    }

    /**
     * Offsets are converted to UTC before truncation; timestamps without zone are read as UTC.
     */
    @Test
    void testTimestampsNormalizedToUtc() {
        List<RawEvent> events = List.of(
            RawEvent.builder().machineId("A").timestamp("2025-01-15T12:00:30+02:00").vibrationRms(1.0).build(),
            RawEvent.builder().machineId("A").timestamp("2025-01-15T10:00:59.999").temperatureCelsius(61.5).build(),
            RawEvent.builder().machineId("B").timestamp("2025-01-15T10:00:00.123456+00:00").temperatureCelsius(70.0).build()
        );

        AssemblyResult result = assembler.assemble(events);

        assertEquals(2, result.getWindows().size());
        TimeWindow a = result.getWindows().get(new WindowKey("A", Instant.parse("2025-01-15T10:00:00Z")));
        assertNotNull(a);
        assertEquals(1.0, a.getVibration());
        assertEquals(61.5, a.getTemperature());
        assertNotNull(result.getWindows().get(new WindowKey("B", Instant.parse("2025-01-15T10:00:00Z"))));
    }

    /**
     * Windows come out ordered by minute, then machine, whatever the input order.
     */
    @Test
    void testWindowsOrderedByMinuteThenMachine() {
        List<RawEvent> events = List.of(
            RawEvent.builder().machineId("B").timestamp("2025-01-15T10:02:00Z").vibrationRms(1.0).build(),
            RawEvent.builder().machineId("A").timestamp("2025-01-15T10:02:10Z").vibrationRms(1.0).build(),
            RawEvent.builder().machineId("B").timestamp("2025-01-15T10:00:00Z").vibrationRms(1.0).build(),
            RawEvent.builder().machineId("A").timestamp("2025-01-15T10:01:00Z").vibrationRms(1.0).build()
        );

        List<String> order = new ArrayList<>();
        assembler.assemble(events).orderedWindows()
            .forEach(w -> order.add(w.getMachineId() + "@" + w.getKey().minuteIso().substring(11, 16)));

        assertEquals(List.of("B@10:00", "A@10:01", "A@10:02", "B@10:02"), order);
    }

    /**
     * An event with no reading still opens its window.
     */
    @Test
    void testEventWithoutReadingOpensEmptyWindow() {
        AssemblyResult result = assembler.assemble(List.of(
            RawEvent.builder().machineId("A").timestamp("2025-01-15T10:00:15Z").build()));

        TimeWindow window = result.orderedWindows().iterator().next();
        assertFalse(window.hasVibration());
        assertFalse(window.hasTemperature());
        assertEquals(0, result.droppedCount());
    }
}
