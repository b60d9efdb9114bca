package com.trafficsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One persisted signal phase. Field names are part of the stored log format.
 */
public record PhaseRecord(
        Instant timestamp,
        int laneId,
        Map<String, Integer> vehicleCounts,
        boolean ambulanceDetected,
        double greenDurationSeconds,
        SignalMode mode
) {
    public PhaseRecord {
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(mode, "mode is required");
        vehicleCounts = vehicleCounts == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(vehicleCounts));
    }

    public int totalVehicles() {
        return vehicleCounts.values().stream().mapToInt(count -> count == null ? 0 : count).sum();
    }
}
