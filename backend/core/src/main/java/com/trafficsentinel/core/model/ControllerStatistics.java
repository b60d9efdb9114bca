package com.trafficsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ControllerStatistics(
        long cycles,
        long emergencyEvents,
        double cumulativeWaitSavedSeconds,
        SignalMode mode,
        int currentLane,
        long droppedLogRecords
) {
    @JsonProperty("averageWaitSavedPerCycle")
    public double averageWaitSavedPerCycle() {
        return cycles == 0 ? 0.0 : cumulativeWaitSavedSeconds / cycles;
    }
}
