package com.trafficsentinel.service.runtime;

import java.util.List;
import java.util.Map;

public record StartupReport(List<Integer> startedLanes, Map<Integer, String> failedLanes) {
    public StartupReport {
        startedLanes = List.copyOf(startedLanes);
        failedLanes = Map.copyOf(failedLanes);
    }

    public boolean allStarted() {
        return failedLanes.isEmpty();
    }
}
