package com.maintenance.transform;

import com.maintenance.domain.TimeWindow;
import com.maintenance.domain.WindowKey;
import lombok.Value;

import java.util.Collection;
import java.util.Map;
import java.util.SortedMap;

@Value
public class AssemblyResult {

    SortedMap<WindowKey, TimeWindow> windows;
    Map<DropReason, Integer> dropped;

    public Collection<TimeWindow> orderedWindows() {
        return windows.values();
    }

    public int droppedCount() {
        return dropped.values().stream().mapToInt(Integer::intValue).sum();
    }
}
