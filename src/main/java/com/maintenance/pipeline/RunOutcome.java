package com.maintenance.pipeline;

public enum RunOutcome {
    /** Checkpoint is already at or past the cutoff; nothing was read. */
    UP_TO_DATE,
    /** The feature window held no sensor events; the checkpoint moved past it. */
    NO_SENSOR_EVENTS,
    COMPLETED,
    FAILED,
    /** Another run was in progress in this process. */
    SKIPPED_CONCURRENT_RUN;

    public boolean isSuccess() {
        return this != FAILED && this != SKIPPED_CONCURRENT_RUN;
    }
}
