package com.maintenance.domain;

import lombok.Value;

import java.time.Instant;

/**
 * Running maximum together with the window timestamp it was last updated at.
 */
@Value
public class RollingMax {

    public static final RollingMax INITIAL = new RollingMax(0.0, Instant.EPOCH);

    double value;
    Instant asOf;
}
