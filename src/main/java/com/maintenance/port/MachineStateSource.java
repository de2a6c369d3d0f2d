package com.maintenance.port;

import com.maintenance.domain.MachineFeatureState;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/**
 * Reconstructs per-machine feature state from previously emitted records.
 */
public interface MachineStateSource {

    /**
     * Returns, for each listed machine, the state it had at the end of its latest
     * window ending at or before {@code notAfter}. Records of later windows are
     * ignored, so replaying a window sees the same state as its first run.
     * Machines without such a record are absent.
     */
    Map<String, MachineFeatureState> loadStates(Collection<String> machineIds, Instant notAfter);
}
