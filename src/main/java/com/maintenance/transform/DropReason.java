package com.maintenance.transform;

/**
 * Why a raw event was left out of windowing.
 */
public enum DropReason {
    MISSING_MACHINE_ID,
    MISSING_TIMESTAMP,
    MALFORMED_TIMESTAMP
}
