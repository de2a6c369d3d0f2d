package com.maintenance.pipeline;

import com.maintenance.config.PipelineProperties;
import com.maintenance.domain.FailureEvent;
import com.maintenance.domain.FeatureRecord;
import com.maintenance.domain.MachineFeatureState;
import com.maintenance.domain.PipelineWindows;
import com.maintenance.domain.RawEvent;
import com.maintenance.exception.ExtractionException;
import com.maintenance.exception.LoadException;
import com.maintenance.exception.PipelineConfigurationException;
import com.maintenance.exception.PipelineException;
import com.maintenance.exception.TransformException;
import com.maintenance.port.CheckpointStore;
import com.maintenance.port.EventReader;
import com.maintenance.port.FailureEventReader;
import com.maintenance.port.FeatureSink;
import com.maintenance.port.MachineStateSource;
import com.maintenance.transform.AssemblyResult;
import com.maintenance.transform.FeatureCalculator;
import com.maintenance.transform.PredictiveLabeler;
import com.maintenance.transform.WindowAssembler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates one incremental feature run.
 *
 * Flow:
 * 1. Compute feature/label windows from the checkpoint; stop if caught up
 * 2. Read sensor events of the feature window and failures of the label window
 * 3. Assemble minute windows, compute features from prior state, attach labels
 * 4. Write training rows, then upsert serving rows
 * 5. Advance the checkpoint to the end of the feature window
 *
 * The checkpoint only moves after step 4 succeeded for the whole batch, so a
 * failed run is retried with identical boundaries. An empty feature window
 * still advances the checkpoint. Configuration errors are thrown; all other
 * failures end the run in {@link PipelineState#FAILED} and are reported in the result.
 *
 * Overlapping runs in the same process are rejected; across processes the
 * scheduler must keep invocations exclusive.
 */
@Service
@Slf4j
public class FeaturePipeline {

    private final EventReader eventReader;
    private final FailureEventReader failureEventReader;
    private final CheckpointStore checkpointStore;
    private final FeatureSink featureSink;
    private final MachineStateSource stateSource;
    private final WindowAssembler windowAssembler;
    private final FeatureCalculator featureCalculator;
    private final PredictiveLabeler labeler;
    private final PipelineProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public FeaturePipeline(EventReader eventReader,
                           FailureEventReader failureEventReader,
                           CheckpointStore checkpointStore,
                           FeatureSink featureSink,
                           MachineStateSource stateSource,
                           WindowAssembler windowAssembler,
                           FeatureCalculator featureCalculator,
                           PredictiveLabeler labeler,
                           PipelineProperties properties,
                           Clock clock) {
        this.eventReader = eventReader;
        this.failureEventReader = failureEventReader;
        this.checkpointStore = checkpointStore;
        this.featureSink = featureSink;
        this.stateSource = stateSource;
        this.windowAssembler = windowAssembler;
        this.featureCalculator = featureCalculator;
        this.labeler = labeler;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs the pipeline once.
     *
     * @throws PipelineConfigurationException when required settings or the checkpoint are missing
     */
    public PipelineRunResult run() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Pipeline run requested while another run is in progress; skipping");
            return PipelineRunResult.builder()
                .outcome(RunOutcome.SKIPPED_CONCURRENT_RUN)
                .finalState(PipelineState.IDLE)
                .build();
        }
        try {
            return execute(new PipelineRun());
        } finally {
            running.set(false);
        }
    }

    private PipelineRunResult execute(PipelineRun run) {
        WindowBoundaryCalculator boundaries = new WindowBoundaryCalculator(
            properties.getTimeWindow(), properties.getPredictionHorizon(), properties.getProcessingLag());

        Instant lastProcessed;
        try {
            lastProcessed = checkpointStore.get();
        } catch (PipelineConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            run.fail();
            ExtractionException failure = new ExtractionException("Failed to read the checkpoint", e);
            log.error("Run {}: {}", run.getRunId(), failure.getMessage(), e);
            return PipelineRunResult.builder()
                .runId(run.getRunId())
                .outcome(RunOutcome.FAILED)
                .finalState(run.getState())
                .failureType(failure.getClass().getSimpleName())
                .failureMessage(failure.getMessage())
                .build();
        }
        Instant now = clock.instant();
        Optional<PipelineWindows> computed = boundaries.compute(lastProcessed, now);

        PipelineRunResult.PipelineRunResultBuilder result = PipelineRunResult.builder()
            .runId(run.getRunId())
            .checkpointBefore(lastProcessed)
            .checkpointAfter(lastProcessed);

        if (computed.isEmpty()) {
            log.info("Run {}: pipeline is up to date (checkpoint {} >= cutoff {}); nothing to process",
                run.getRunId(), lastProcessed, boundaries.cutoff(now));
            return result
                .outcome(RunOutcome.UP_TO_DATE)
                .finalState(run.getState())
                .build();
        }

        PipelineWindows windows = computed.get();
        run.transition(PipelineState.BOUNDARY_COMPUTED);
        result.windows(windows);
        log.info("Run {}: feature window [{}, {}), label window [{}, {})", run.getRunId(),
            windows.getFeaturesStart(), windows.getFeaturesEnd(), windows.getLabelsStart(), windows.getLabelsEnd());

        try {
            run.transition(PipelineState.EXTRACTING);
            List<RawEvent> events = extractEvents(windows);
            List<FailureEvent> failures = extractFailures(windows);
            result.rawEvents(events.size()).failureEvents(failures.size());

            if (events.isEmpty()) {
                log.info("Run {}: no sensor events in the feature window; only advancing the checkpoint", run.getRunId());
                advanceCheckpoint(windows);
                run.transition(PipelineState.CHECKPOINT_ADVANCED);
                return result
                    .outcome(RunOutcome.NO_SENSOR_EVENTS)
                    .finalState(run.getState())
                    .checkpointAfter(windows.getFeaturesEnd())
                    .build();
            }

            run.transition(PipelineState.TRANSFORMING);
            AssemblyResult assembly = assemble(events, windows);
            Map<String, MachineFeatureState> priorStates = loadPriorStates(assembly, windows);
            SortedMap<String, FeatureRecord> labeled = transform(assembly, priorStates, failures, windows, now);
            List<FeatureRecord> records = new ArrayList<>(labeled.values());
            result.droppedEvents(assembly.getDropped())
                .windowCount(assembly.getWindows().size())
                .positiveLabels((int) records.stream().filter(r -> r.getLabelFailure() == 1).count())
                .records(records);

            run.transition(PipelineState.LOADING);
            load(records, windows);

            advanceCheckpoint(windows);
            run.transition(PipelineState.CHECKPOINT_ADVANCED);
            log.info("Run {}: completed, {} machines written, checkpoint at {}",
                run.getRunId(), records.size(), windows.getFeaturesEnd());
            return result
                .outcome(RunOutcome.COMPLETED)
                .finalState(run.getState())
                .checkpointAfter(windows.getFeaturesEnd())
                .build();
        } catch (PipelineConfigurationException e) {
            run.fail();
            throw e;
        } catch (PipelineException e) {
            PipelineState failedIn = run.getState();
            run.fail();
            log.error("Run {}: failed during {}, checkpoint left at {}", run.getRunId(), failedIn, lastProcessed, e);
            return result
                .outcome(RunOutcome.FAILED)
                .finalState(run.getState())
                .failureType(e.getClass().getSimpleName())
                .failureMessage(e.getMessage())
                .build();
        }
    }

    private List<RawEvent> extractEvents(PipelineWindows windows) {
        try {
            return eventReader.fetch(windows.getFeaturesStart(), windows.getFeaturesEnd());
        } catch (RuntimeException e) {
            throw new ExtractionException("Failed to read sensor events", windows, e);
        }
    }

    private List<FailureEvent> extractFailures(PipelineWindows windows) {
        try {
            return failureEventReader.fetch(windows.getLabelsStart(), windows.getLabelsEnd());
        } catch (RuntimeException e) {
            throw new ExtractionException("Failed to read failure events", windows, e);
        }
    }

    private AssemblyResult assemble(List<RawEvent> events, PipelineWindows windows) {
        try {
            return windowAssembler.assemble(events);
        } catch (RuntimeException e) {
            throw new TransformException("Failed to assemble windows", windows, null, e);
        }
    }

    private Map<String, MachineFeatureState> loadPriorStates(AssemblyResult assembly, PipelineWindows windows) {
        if (!properties.isCarryState()) {
            return Map.of();
        }
        Set<String> machineIds = new TreeSet<>();
        assembly.orderedWindows().forEach(w -> machineIds.add(w.getMachineId()));
        try {
            return stateSource.loadStates(machineIds, windows.getFeaturesStart());
        } catch (RuntimeException e) {
            throw new ExtractionException("Failed to load prior machine state", windows, e);
        }
    }

    private SortedMap<String, FeatureRecord> transform(AssemblyResult assembly,
                                                       Map<String, MachineFeatureState> priorStates,
                                                       List<FailureEvent> failures,
                                                       PipelineWindows windows,
                                                       Instant processedAt) {
        try {
            SortedMap<String, FeatureRecord> features = featureCalculator.calculate(
                assembly.orderedWindows(), priorStates, windows, processedAt, properties.predictionHorizonHours());
            return labeler.label(features, failures);
        } catch (PipelineException e) {
            throw new TransformException("Failed to compute features", windows, e.getMachineId(), e);
        } catch (RuntimeException e) {
            throw new TransformException("Failed to compute features", windows, null, e);
        }
    }

    private void load(List<FeatureRecord> records, PipelineWindows windows) {
        try {
            featureSink.writeBatch(records);
        } catch (RuntimeException e) {
            throw new LoadException("Failed to write training features", windows, e);
        }
        try {
            featureSink.upsertBatch(records);
        } catch (RuntimeException e) {
            throw new LoadException("Training features written but serving upsert failed", windows, e);
        }
    }

    private void advanceCheckpoint(PipelineWindows windows) {
        try {
            checkpointStore.set(windows.getFeaturesEnd());
        } catch (RuntimeException e) {
            throw new LoadException("Failed to advance checkpoint to " + windows.getFeaturesEnd(), windows, e);
        }
    }
}
