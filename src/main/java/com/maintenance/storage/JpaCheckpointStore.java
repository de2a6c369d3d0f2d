package com.maintenance.storage;

import com.maintenance.config.PipelineProperties;
import com.maintenance.exception.PipelineConfigurationException;
import com.maintenance.model.PipelineCheckpoint;
import com.maintenance.port.CheckpointStore;
import com.maintenance.repository.PipelineCheckpointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Checkpoint kept as a single row of {@code pipeline_checkpoints}.
 *
 * When the row is missing the configured initial checkpoint is used; the row
 * itself is only created by the first successful write.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaCheckpointStore implements CheckpointStore {

    static final String PIPELINE_NAME = "machine-features";

    private final PipelineCheckpointRepository repository;
    private final PipelineProperties properties;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Instant get() {
        Optional<PipelineCheckpoint> stored = repository.findById(PIPELINE_NAME);
        if (stored.isPresent()) {
            return stored.get().getLastProcessed();
        }
        if (properties.getInitialCheckpoint() == null) {
            throw new PipelineConfigurationException(
                "No checkpoint stored for '" + PIPELINE_NAME + "' and pipeline.initial-checkpoint is not set");
        }
        return properties.getInitialCheckpoint();
    }

    @Override
    @Transactional
    public void set(Instant checkpoint) {
        Optional<PipelineCheckpoint> stored = repository.findById(PIPELINE_NAME);
        if (stored.isPresent()) {
            Instant current = stored.get().getLastProcessed();
            if (checkpoint.equals(current)) {
                log.info("Checkpoint already at {}", checkpoint);
                return;
            }
            if (checkpoint.isBefore(current)) {
                throw new IllegalStateException("Checkpoint cannot move backwards from " + current + " to " + checkpoint);
            }
        }
        save(stored, checkpoint);
        log.info("Checkpoint advanced to {}", checkpoint);
    }

    @Override
    @Transactional
    public void reset(Instant checkpoint) {
        save(repository.findById(PIPELINE_NAME), checkpoint);
        log.warn("Checkpoint reset to {}", checkpoint);
    }

    private void save(Optional<PipelineCheckpoint> stored, Instant checkpoint) {
        PipelineCheckpoint row = stored.orElseGet(() -> PipelineCheckpoint.builder().name(PIPELINE_NAME).build());
        row.setLastProcessed(checkpoint);
        row.setUpdatedAt(clock.instant());
        repository.save(row);
    }
}
