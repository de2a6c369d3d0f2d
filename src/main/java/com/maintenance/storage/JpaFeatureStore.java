package com.maintenance.storage;

import com.maintenance.domain.FeatureRecord;
import com.maintenance.domain.MachineFeatureState;
import com.maintenance.domain.RollingMax;
import com.maintenance.model.ServingFeature;
import com.maintenance.model.TrainingFeature;
import com.maintenance.port.FeatureSink;
import com.maintenance.port.MachineStateSource;
import com.maintenance.repository.ServingFeatureRepository;
import com.maintenance.repository.TrainingFeatureRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Training and serving feature tables.
 *
 * Training rows are appended per (machine, window); writing a window again
 * overwrites its rows in place. They also hold the unrounded state each
 * window ended with, so the state before any window can be looked up again
 * when that window is replayed. Serving rows are one per machine.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaFeatureStore implements FeatureSink, MachineStateSource {

    private final TrainingFeatureRepository trainingRepository;
    private final ServingFeatureRepository servingRepository;

    @Override
    @Transactional
    public void writeBatch(List<FeatureRecord> records) {
        if (records.isEmpty()) {
            log.info("No features to write to the training store");
            return;
        }

        List<TrainingFeature> toSave = new ArrayList<>();
        int replaced = 0;
        for (FeatureRecord record : records) {
            requireLabeled(record);
            TrainingFeature row = trainingRepository
                .findByMachineIdAndWindowStartAndWindowEnd(record.getMachineId(), record.getWindowStart(), record.getWindowEnd())
                .orElse(null);
            if (row == null) {
                row = TrainingFeature.builder()
                    .machineId(record.getMachineId())
                    .windowStart(record.getWindowStart())
                    .windowEnd(record.getWindowEnd())
                    .build();
            } else {
                replaced++;
            }
            row.setTimestampProcessed(record.getTimestampProcessed());
            row.setVibMedia5h(record.getVibMedia5h());
            row.setTempMax24h(record.getTempMax24h());
            row.setLabelHorizonHours(record.getLabelHorizonHours());
            row.setLabelFailure(record.getLabelFailure());
            row.setEmaVibration(record.getState().getEmaVibration());
            row.setRollingMaxTemp(record.getState().getRollingMaxTemp().getValue());
            row.setRollingMaxAsOf(record.getState().getRollingMaxTemp().getAsOf());
            toSave.add(row);
        }
        trainingRepository.saveAll(toSave);

        log.info("Training store: {} rows written, {} of them replacing an earlier write of the same window",
            toSave.size(), replaced);
    }

    @Override
    @Transactional
    public void upsertBatch(List<FeatureRecord> records) {
        if (records.isEmpty()) {
            log.info("No features to upsert into the serving store");
            return;
        }

        List<String> machineIds = records.stream().map(FeatureRecord::getMachineId).collect(Collectors.toList());
        Map<String, ServingFeature> existing = servingRepository.findAllById(machineIds).stream()
            .collect(Collectors.toMap(ServingFeature::getMachineId, Function.identity()));

        List<ServingFeature> toSave = new ArrayList<>();
        for (FeatureRecord record : records) {
            requireLabeled(record);
            ServingFeature row = existing.getOrDefault(record.getMachineId(),
                ServingFeature.builder().machineId(record.getMachineId()).build());
            row.setWindowStart(record.getWindowStart());
            row.setWindowEnd(record.getWindowEnd());
            row.setTimestampProcessed(record.getTimestampProcessed());
            row.setVibMedia5h(record.getVibMedia5h());
            row.setTempMax24h(record.getTempMax24h());
            row.setLabelHorizonHours(record.getLabelHorizonHours());
            row.setLabelFailure(record.getLabelFailure());
            toSave.add(row);
        }
        servingRepository.saveAll(toSave);

        log.info("Serving store: {} machines upserted ({} new)", toSave.size(), toSave.size() - existing.size());
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, MachineFeatureState> loadStates(Collection<String> machineIds, Instant notAfter) {
        if (machineIds.isEmpty()) {
            return Map.of();
        }
        Map<String, MachineFeatureState> states = new HashMap<>();
        for (String machineId : machineIds) {
            trainingRepository.findFirstByMachineIdAndWindowEndLessThanEqualOrderByWindowEndDesc(machineId, notAfter)
                .ifPresent(row -> states.put(machineId, new MachineFeatureState(
                    row.getEmaVibration(),
                    new RollingMax(row.getRollingMaxTemp(), row.getRollingMaxAsOf()))));
        }
        log.info("Loaded prior state for {} of {} machines", states.size(), machineIds.size());
        return states;
    }

    private void requireLabeled(FeatureRecord record) {
        Objects.requireNonNull(record.getLabelFailure(), () -> "Unlabeled feature record for " + record.getMachineId());
    }
}
