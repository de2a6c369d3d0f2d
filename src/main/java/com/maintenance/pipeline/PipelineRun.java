package com.maintenance.pipeline;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * State tracker of one run. Rejects transitions the run graph does not allow.
 */
@Slf4j
@Getter
class PipelineRun {

    private final String runId = UUID.randomUUID().toString().substring(0, 8);
    private PipelineState state = PipelineState.IDLE;

    void transition(PipelineState next) {
        if (!state.successors().contains(next)) {
            throw new IllegalStateException("Illegal pipeline transition " + state + " -> " + next);
        }
        log.debug("Run {}: {} -> {}", runId, state, next);
        state = next;
    }

    void fail() {
        if (!state.isTerminal()) {
            transition(PipelineState.FAILED);
        }
    }
}
