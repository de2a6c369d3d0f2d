package com.maintenance.transform;

import com.maintenance.domain.FailureEvent;
import com.maintenance.domain.FeatureRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Attaches the supervised label to computed features.
 *
 * A machine is labeled 1 when any failure event for it was observed in the
 * label window that follows the feature window, 0 otherwise.
 */
@Component
@Slf4j
public class PredictiveLabeler {

    public SortedMap<String, FeatureRecord> label(Map<String, FeatureRecord> features,
                                                  Collection<FailureEvent> failures) {
        Set<String> failedMachines = failures.stream()
            .map(FailureEvent::getMachineId)
            .collect(Collectors.toSet());

        SortedMap<String, FeatureRecord> labeled = new TreeMap<>();
        features.forEach((machineId, record) ->
            labeled.put(machineId, record.withLabelFailure(failedMachines.contains(machineId) ? 1 : 0)));

        long positives = labeled.values().stream().filter(r -> r.getLabelFailure() == 1).count();
        log.info("Labeled {} machines against {} failure events: {} positive", labeled.size(), failures.size(), positives);
        return Collections.unmodifiableSortedMap(labeled);
    }
}
