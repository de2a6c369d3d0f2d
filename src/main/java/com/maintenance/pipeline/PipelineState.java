package com.maintenance.pipeline;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stages of a single pipeline run.
 */
public enum PipelineState {
    IDLE,
    BOUNDARY_COMPUTED,
    EXTRACTING,
    TRANSFORMING,
    LOADING,
    CHECKPOINT_ADVANCED,
    FAILED;

    public boolean isTerminal() {
        return this == CHECKPOINT_ADVANCED || this == FAILED;
    }

    /**
     * Successors allowed from this state. {@code FAILED} is reachable from any non-terminal state.
     */
    Set<PipelineState> successors() {
        switch (this) {
            case IDLE:
                return EnumSet.of(BOUNDARY_COMPUTED, FAILED);
            case BOUNDARY_COMPUTED:
                return EnumSet.of(EXTRACTING, FAILED);
            case EXTRACTING:
                // an empty feature window advances the checkpoint directly
                return EnumSet.of(TRANSFORMING, CHECKPOINT_ADVANCED, FAILED);
            case TRANSFORMING:
                return EnumSet.of(LOADING, FAILED);
            case LOADING:
                return EnumSet.of(CHECKPOINT_ADVANCED, FAILED);
            default:
                return EnumSet.noneOf(PipelineState.class);
        }
    }
}
