package com.maintenance.pipeline;

import com.maintenance.config.PipelineProperties;
import com.maintenance.domain.FailureEvent;
import com.maintenance.domain.FeatureRecord;
import com.maintenance.domain.MachineFeatureState;
import com.maintenance.domain.PipelineWindows;
import com.maintenance.domain.RawEvent;
import com.maintenance.domain.TimeWindow;
import com.maintenance.exception.ExtractionException;
import com.maintenance.exception.PipelineConfigurationException;
import com.maintenance.exception.TransformException;
import com.maintenance.port.CheckpointStore;
import com.maintenance.port.EventReader;
import com.maintenance.port.FailureEventReader;
import com.maintenance.port.FeatureSink;
import com.maintenance.port.MachineStateSource;
import com.maintenance.transform.FeatureCalculator;
import com.maintenance.transform.PredictiveLabeler;
import com.maintenance.transform.WindowAssembler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Orchestration tests with in-memory collaborators.
 *
 * Clock is fixed at 2025-01-17T12:00Z; with the default 25h lag the cutoff is
 * 2025-01-16T11:00Z and a checkpoint of 2025-01-15T10:00Z yields the feature
 * window [10:00, 11:00) and label window [11:00, 2025-01-16T11:00).
 */
class FeaturePipelineTest {

    private static final Instant NOW = Instant.parse("2025-01-17T12:00:00Z");
    private static final Instant CHECKPOINT = Instant.parse("2025-01-15T10:00:00Z");
    private static final Instant FEATURES_END = Instant.parse("2025-01-15T11:00:00Z");

    private InMemoryEventReader eventReader;
    private InMemoryFailureReader failureReader;
    private InMemoryCheckpointStore checkpointStore;
    private InMemoryFeatureStore featureStore;
    private PipelineProperties properties;

    @BeforeEach
    void setUp() {
        eventReader = new InMemoryEventReader();
        failureReader = new InMemoryFailureReader();
        checkpointStore = new InMemoryCheckpointStore(CHECKPOINT);
        featureStore = new InMemoryFeatureStore();
        properties = new PipelineProperties();
        properties.setBucket("unused");
    }

    private FeaturePipeline pipeline() {
        return pipeline(new FeatureCalculator());
    }

    private FeaturePipeline pipeline(FeatureCalculator calculator) {
        return new FeaturePipeline(eventReader, failureReader, checkpointStore, featureStore, featureStore,
            new WindowAssembler(), calculator, new PredictiveLabeler(), properties,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static RawEvent vibration(String machineId, String timestamp, double value) {
        return RawEvent.builder().machineId(machineId).timestamp(timestamp).vibrationRms(value).build();
    }

    private static RawEvent temperature(String machineId, String timestamp, double value) {
        return RawEvent.builder().machineId(machineId).timestamp(timestamp).temperatureCelsius(value).build();
    }

    private void addSampleEvents() {
        eventReader.events.add(vibration("PUMP-A01", "2025-01-15T10:00:15Z", 3.0));
        eventReader.events.add(temperature("PUMP-A01", "2025-01-15T10:00:45Z", 61.2));
        eventReader.events.add(vibration("PUMP-A01", "2025-01-15T10:01:15Z", 5.0));
        eventReader.events.add(temperature("FAN-B01", "2025-01-15T10:30:00Z", 55.55));
        eventReader.events.add(vibration("FAN-B01", "2025-01-15T10:30:10Z", 2.5));
    }

    /**
     * Checkpoint at or past the cutoff: successful no-op, readers untouched.
     */
    @Test
    void testUpToDateRunDoesNotReadEvents() {
        checkpointStore.value = Instant.parse("2025-01-16T11:00:00Z");

        PipelineRunResult result = pipeline().run();

        assertEquals(RunOutcome.UP_TO_DATE, result.getOutcome());
        assertTrue(result.isSuccess());
        assertEquals(0, eventReader.calls);
        assertEquals(0, failureReader.calls);
        assertEquals(0, checkpointStore.writes);
    }

    /**
     * No sensor events: nothing is written but the checkpoint still moves past the window.
     */
    @Test
    void testEmptyWindowAdvancesCheckpoint() {
        PipelineRunResult result = pipeline().run();

        assertEquals(RunOutcome.NO_SENSOR_EVENTS, result.getOutcome());
        assertEquals(PipelineState.CHECKPOINT_ADVANCED, result.getFinalState());
        assertEquals(FEATURES_END, checkpointStore.value);
        assertEquals(0, featureStore.writeCalls);
        assertEquals(0, featureStore.upsertCalls);
    }

    /**
     * Full run: features per machine, labels from the forward window, checkpoint at the window end.
     */
    @Test
    void testCompletedRunWritesFeaturesAndAdvancesCheckpoint() {
        addSampleEvents();
        failureReader.failures.add(FailureEvent.builder()
            .machineId("PUMP-A01")
            .timestamp(Instant.parse("2025-01-15T20:00:00Z"))
            .failureCode("FAILURE_DETECTED")
            .build());

        PipelineRunResult result = pipeline().run();

        assertEquals(RunOutcome.COMPLETED, result.getOutcome());
        assertEquals(PipelineState.CHECKPOINT_ADVANCED, result.getFinalState());
        assertEquals(FEATURES_END, checkpointStore.value);
        assertEquals(FEATURES_END, result.getCheckpointAfter());
        assertEquals(5, result.getRawEvents());
        assertEquals(3, result.getWindowCount());
        assertEquals(1, result.getPositiveLabels());

        assertEquals(CHECKPOINT, eventReader.lastStart);
        assertEquals(FEATURES_END, eventReader.lastEnd);
        assertEquals(FEATURES_END, failureReader.lastStart);
        assertEquals(Instant.parse("2025-01-16T11:00:00Z"), failureReader.lastEnd);

        FeatureRecord pump = featureStore.serving.get("PUMP-A01");
        assertEquals(3.02, pump.getVibMedia5h());
        assertEquals(61.2, pump.getTempMax24h());
        assertEquals(1, pump.getLabelFailure());
        assertEquals(NOW, pump.getTimestampProcessed());

        FeatureRecord fan = featureStore.serving.get("FAN-B01");
        assertEquals(2.5, fan.getVibMedia5h());
        assertEquals(55.55, fan.getTempMax24h());
        assertEquals(0, fan.getLabelFailure());

        assertEquals(2, featureStore.training.size());
    }

    /**
     * A serving failure after the training write leaves the checkpoint alone,
     * and the retry recomputes the same boundaries.
     */
    @Test
    void testLoadFailureKeepsCheckpointAndReplaysSameWindow() {
        addSampleEvents();
        featureStore.failUpserts = true;

        PipelineRunResult failed = pipeline().run();

        assertEquals(RunOutcome.FAILED, failed.getOutcome());
        assertEquals(PipelineState.FAILED, failed.getFinalState());
        assertEquals("LoadException", failed.getFailureType());
        assertTrue(failed.getFailureMessage().contains(FEATURES_END.toString()));
        assertEquals(CHECKPOINT, checkpointStore.value);
        assertEquals(0, checkpointStore.writes);

        featureStore.failUpserts = false;
        PipelineRunResult retried = pipeline().run();

        assertEquals(RunOutcome.COMPLETED, retried.getOutcome());
        assertEquals(failed.getWindows(), retried.getWindows());
        assertEquals(FEATURES_END, checkpointStore.value);
        assertEquals(2, featureStore.training.size());
    }

    /**
     * An unreadable store fails the run during extraction without touching the checkpoint.
     */
    @Test
    void testExtractionFailureKeepsCheckpoint() {
        eventReader.failure = new ExtractionException("disk unavailable", null);

        PipelineRunResult result = pipeline().run();

        assertEquals(RunOutcome.FAILED, result.getOutcome());
        assertEquals("ExtractionException", result.getFailureType());
        assertEquals(CHECKPOINT, checkpointStore.value);
        assertEquals(0, featureStore.writeCalls);
    }

    /**
     * An exception inside the feature math aborts the run before any write.
     */
    @Test
    void testTransformFailureKeepsCheckpoint() {
        addSampleEvents();
        FeatureCalculator broken = new FeatureCalculator() {
            @Override
            public SortedMap<String, FeatureRecord> calculate(Collection<TimeWindow> windows,
                                                              Map<String, MachineFeatureState> priorStates,
                                                              PipelineWindows runWindows,
                                                              Instant processedAt,
                                                              long horizonHours) {
                throw new TransformException("boom", "PUMP-A01");
            }
        };

        PipelineRunResult result = pipeline(broken).run();

        assertEquals(RunOutcome.FAILED, result.getOutcome());
        assertEquals("TransformException", result.getFailureType());
        assertTrue(result.getFailureMessage().contains("PUMP-A01"));
        assertEquals(CHECKPOINT, checkpointStore.value);
        assertEquals(0, featureStore.writeCalls);
    }

    /**
     * Without a stored or configured checkpoint the run cannot start.
     */
    @Test
    void testMissingCheckpointIsConfigurationError() {
        checkpointStore.value = null;

        assertThrows(PipelineConfigurationException.class, () -> pipeline().run());
        assertEquals(0, eventReader.calls);
    }

    /**
     * Re-running a window after resetting the checkpoint yields identical records.
     */
    @Test
    void testRerunAfterCheckpointResetIsIdentical() {
        addSampleEvents();
        FeaturePipeline pipeline = pipeline();

        PipelineRunResult first = pipeline.run();
        checkpointStore.reset(CHECKPOINT);
        PipelineRunResult second = pipeline.run();

        assertEquals(RunOutcome.COMPLETED, second.getOutcome());
        assertEquals(first.getRecords(), second.getRecords());
        assertEquals(first.getRecords().toString(), second.getRecords().toString());
        assertEquals(2, featureStore.training.size());
    }

    /**
     * A checkpoint store that cannot be read fails the run instead of throwing.
     */
    @Test
    void testCheckpointReadFailureEndsRunFailed() {
        checkpointStore.readFailure = new IllegalStateException("checkpoint table unavailable");

        PipelineRunResult result = pipeline().run();

        assertEquals(RunOutcome.FAILED, result.getOutcome());
        assertEquals(PipelineState.FAILED, result.getFinalState());
        assertEquals("ExtractionException", result.getFailureType());
        assertTrue(result.getFailureMessage().contains("checkpoint"));
        assertEquals(0, eventReader.calls);
        assertEquals(0, featureStore.writeCalls);
    }

    /**
     * Replaying a second window after its checkpoint write was lost continues
     * from the first window's state again, not from a cold start.
     */
    @Test
    void testReplayOfWarmWindowIsIdentical() {
        addSampleEvents();
        eventReader.events.add(vibration("PUMP-A01", "2025-01-15T11:10:00Z", 13.02));
        eventReader.events.add(temperature("PUMP-A01", "2025-01-15T11:10:30Z", 20.0));
        FeaturePipeline pipeline = pipeline();
        pipeline.run();
        PipelineRunResult second = pipeline.run();

        checkpointStore.reset(FEATURES_END);
        PipelineRunResult replay = pipeline.run();

        assertEquals(RunOutcome.COMPLETED, replay.getOutcome());
        assertEquals(second.getWindows(), replay.getWindows());
        assertEquals(second.getRecords(), replay.getRecords());
        FeatureRecord pump = replay.getRecords().get(0);
        assertEquals("PUMP-A01", pump.getMachineId());
        assertEquals(3.12, pump.getVibMedia5h());
        assertEquals(61.2, pump.getTempMax24h());
    }

    /**
     * The next window continues from the state the previous run emitted.
     */
    @Test
    void testStateCarriedIntoNextWindow() {
        addSampleEvents();
        FeaturePipeline pipeline = pipeline();
        pipeline.run();

        eventReader.events.clear();
        eventReader.events.add(vibration("PUMP-A01", "2025-01-15T11:10:00Z", 13.02));
        PipelineRunResult next = pipeline.run();

        FeatureRecord pump = next.getRecords().get(0);
        assertEquals("PUMP-A01", pump.getMachineId());
        // 0.01 * 13.02 + 0.99 * 3.02
        assertEquals(3.12, pump.getVibMedia5h());
        assertEquals(61.2, pump.getTempMax24h());
        assertEquals(Instant.parse("2025-01-15T12:00:00Z"), checkpointStore.value);
    }

    /**
     * With state carrying disabled every run starts cold.
     */
    @Test
    void testColdStartWhenStateCarryingDisabled() {
        properties.setCarryState(false);
        addSampleEvents();
        FeaturePipeline pipeline = pipeline();
        pipeline.run();

        eventReader.events.clear();
        eventReader.events.add(vibration("PUMP-A01", "2025-01-15T11:10:00Z", 13.02));
        PipelineRunResult next = pipeline.run();

        assertEquals(13.02, next.getRecords().get(0).getVibMedia5h());
        assertEquals(0, featureStore.stateLoads);
    }

    static class InMemoryEventReader implements EventReader {
        final List<RawEvent> events = new ArrayList<>();
        RuntimeException failure;
        int calls;
        Instant lastStart;
        Instant lastEnd;

        @Override
        public List<RawEvent> fetch(Instant start, Instant end) {
            calls++;
            lastStart = start;
            lastEnd = end;
            if (failure != null) {
                throw failure;
            }
            List<RawEvent> inRange = new ArrayList<>();
            for (RawEvent event : events) {
                Instant ts = Instant.parse(event.getTimestamp());
                if (!ts.isBefore(start) && ts.isBefore(end)) {
                    inRange.add(event);
                }
            }
            return inRange;
        }
    }

    static class InMemoryFailureReader implements FailureEventReader {
        final List<FailureEvent> failures = new ArrayList<>();
        int calls;
        Instant lastStart;
        Instant lastEnd;

        @Override
        public List<FailureEvent> fetch(Instant start, Instant end) {
            calls++;
            lastStart = start;
            lastEnd = end;
            List<FailureEvent> inRange = new ArrayList<>();
            for (FailureEvent failure : failures) {
                if (!failure.getTimestamp().isBefore(start) && failure.getTimestamp().isBefore(end)) {
                    inRange.add(failure);
                }
            }
            return inRange;
        }
    }

    static class InMemoryCheckpointStore implements CheckpointStore {
        Instant value;
        RuntimeException readFailure;
        int writes;

        InMemoryCheckpointStore(Instant initial) {
            this.value = initial;
        }

        @Override
        public Instant get() {
            if (readFailure != null) {
                throw readFailure;
            }
            if (value == null) {
                throw new PipelineConfigurationException("no checkpoint");
            }
            return value;
        }

        @Override
        public void set(Instant checkpoint) {
            if (checkpoint.isBefore(value)) {
                throw new IllegalStateException("backwards");
            }
            writes++;
            value = checkpoint;
        }

        @Override
        public void reset(Instant checkpoint) {
            value = checkpoint;
        }
    }

    /**
     * Training rows keyed by machine and window, serving rows keyed by machine.
     */
    static class InMemoryFeatureStore implements FeatureSink, MachineStateSource {
        final Map<String, FeatureRecord> training = new HashMap<>();
        final Map<String, FeatureRecord> serving = new HashMap<>();
        boolean failUpserts;
        int writeCalls;
        int upsertCalls;
        int stateLoads;

        @Override
        public void writeBatch(List<FeatureRecord> records) {
            writeCalls++;
            records.forEach(r -> training.put(r.getMachineId() + "|" + r.getWindowStart() + "|" + r.getWindowEnd(), r));
        }

        @Override
        public void upsertBatch(List<FeatureRecord> records) {
            upsertCalls++;
            if (failUpserts) {
                throw new IllegalStateException("serving store unavailable");
            }
            records.forEach(r -> serving.put(r.getMachineId(), r));
        }

        @Override
        public Map<String, MachineFeatureState> loadStates(Collection<String> machineIds, Instant notAfter) {
            stateLoads++;
            Map<String, FeatureRecord> latest = new HashMap<>();
            for (FeatureRecord record : training.values()) {
                if (!machineIds.contains(record.getMachineId()) || record.getWindowEnd().isAfter(notAfter)) {
                    continue;
                }
                latest.merge(record.getMachineId(), record,
                    (a, b) -> a.getWindowEnd().isAfter(b.getWindowEnd()) ? a : b);
            }
            Map<String, MachineFeatureState> states = new HashMap<>();
            latest.forEach((machineId, record) -> states.put(machineId, record.getState()));
            return states;
        }
    }
}
