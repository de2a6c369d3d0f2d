package com.maintenance.transform;

import com.maintenance.domain.FeatureRecord;
import com.maintenance.domain.MachineFeatureState;
import com.maintenance.domain.PipelineWindows;
import com.maintenance.domain.RollingMax;
import com.maintenance.domain.TimeWindow;
import com.maintenance.exception.TransformException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Computes the per-machine maintenance features from minute windows.
 *
 * Two recurrences are carried per machine:
 * - vib_media_5h: EMA of vibration with alpha = 0.01. A window without a
 *   vibration reading feeds the previous EMA back in, so the value holds steady.
 * - temp_max_24h: rolling maximum of temperature. When the window is more than
 *   24h after the last update the maximum restarts from the current reading.
 *   The update timestamp always moves to the current window.
 *
 * Windows must arrive in ascending time order per machine. Prior state is
 * never modified; the new state travels inside each emitted record.
 */
@Component
@Slf4j
public class FeatureCalculator {

    static final double EMA_ALPHA = 0.01;
    static final Duration ROLLING_MAX_SPAN = Duration.ofHours(24);

    /**
     * @param windows      windows sorted ascending by minute
     * @param priorStates  state per machine from the previous run; may be empty
     * @param runWindows   boundaries of the current run, copied onto each record
     * @param processedAt  processing timestamp stamped on each record
     * @param horizonHours prediction horizon the records will be labeled for
     * @return one record per machine seen in {@code windows}, keyed and ordered by machine id
     */
    public SortedMap<String, FeatureRecord> calculate(Collection<TimeWindow> windows,
                                                      Map<String, MachineFeatureState> priorStates,
                                                      PipelineWindows runWindows,
                                                      Instant processedAt,
                                                      long horizonHours) {
        log.info("Calculating features for {} windows", windows.size());

        Map<String, MachineFeatureState> states = new HashMap<>();
        Map<String, Instant> lastMinute = new HashMap<>();

        for (TimeWindow window : windows) {
            String machineId = window.getMachineId();
            Instant previous = lastMinute.get(machineId);
            if (previous != null && !window.getMinute().isAfter(previous)) {
                throw new TransformException(
                    "Windows out of order: " + window.getKey().minuteIso() + " after " + previous, machineId);
            }
            lastMinute.put(machineId, window.getMinute());

            MachineFeatureState current = states.containsKey(machineId)
                ? states.get(machineId)
                : priorStates.get(machineId);
            states.put(machineId, advance(current, window));
        }

        SortedMap<String, FeatureRecord> records = new TreeMap<>();
        states.forEach((machineId, state) -> records.put(machineId, FeatureRecord.builder()
            .machineId(machineId)
            .windowStart(runWindows.getFeaturesStart())
            .windowEnd(runWindows.getFeaturesEnd())
            .timestampProcessed(processedAt)
            .vibMedia5h(round(state.getEmaVibration(), 4))
            .tempMax24h(round(state.getRollingMaxTemp().getValue(), 2))
            .labelHorizonHours(horizonHours)
            .state(state)
            .build()));

        log.info("Feature calculation complete for {} machines", records.size());
        return Collections.unmodifiableSortedMap(records);
    }

    /**
     * Applies one window to a machine's state. A null state is a cold start.
     */
    MachineFeatureState advance(MachineFeatureState prior, TimeWindow window) {
        return new MachineFeatureState(
            nextEma(prior, window),
            nextRollingMax(prior == null ? RollingMax.INITIAL : prior.getRollingMaxTemp(), window));
    }

    private double nextEma(MachineFeatureState prior, TimeWindow window) {
        double previous;
        if (prior != null) {
            previous = prior.getEmaVibration();
        } else {
            previous = window.hasVibration() ? window.getVibration() : 0.0;
        }
        if (!window.hasVibration()) {
            // alpha*previous + (1-alpha)*previous, without the floating-point drift
            return previous;
        }
        return EMA_ALPHA * window.getVibration() + (1 - EMA_ALPHA) * previous;
    }

    private RollingMax nextRollingMax(RollingMax prior, TimeWindow window) {
        double current = window.hasTemperature() ? window.getTemperature() : 0.0;
        Duration gap = Duration.between(prior.getAsOf(), window.getMinute());
        double value = gap.compareTo(ROLLING_MAX_SPAN) > 0
            ? current
            : Math.max(prior.getValue(), current);
        return new RollingMax(value, window.getMinute());
    }

    static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
