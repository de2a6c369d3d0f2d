package com.maintenance.domain;

import lombok.Value;

import java.time.Instant;

/**
 * Boundaries of one run: the half-open feature window and the label window right after it.
 */
@Value
public class PipelineWindows {

    Instant featuresStart;
    Instant featuresEnd;
    Instant labelsStart;
    Instant labelsEnd;

    @Override
    public String toString() {
        return "features=[" + featuresStart + ", " + featuresEnd + ") labels=[" + labelsStart + ", " + labelsEnd + ")";
    }
}
