package com.maintenance.port;

import java.time.Instant;

/**
 * Durable "processed up to" timestamp of the pipeline.
 */
public interface CheckpointStore {

    /**
     * @throws com.maintenance.exception.PipelineConfigurationException if no checkpoint exists and none is configured
     */
    Instant get();

    /**
     * Advances the checkpoint. Setting the current value again is a no-op;
     * moving it backwards is rejected.
     */
    void set(Instant checkpoint);

    /**
     * Moves the checkpoint to any value, including backwards, for replay.
     */
    void reset(Instant checkpoint);
}
