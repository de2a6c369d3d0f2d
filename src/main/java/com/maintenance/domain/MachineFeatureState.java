package com.maintenance.domain;

import lombok.Value;

/**
 * Unrounded per-machine statistics carried from one run to the next.
 */
@Value
public class MachineFeatureState {

    double emaVibration;
    RollingMax rollingMaxTemp;
}
