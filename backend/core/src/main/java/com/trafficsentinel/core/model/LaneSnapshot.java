package com.trafficsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record LaneSnapshot(
        int laneId,
        Map<String, Integer> counts,
        boolean ambulancePresent,
        Instant capturedAt
) {
    public LaneSnapshot {
        Objects.requireNonNull(counts, "counts is required");
        Objects.requireNonNull(capturedAt, "capturedAt is required");
        counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    public static LaneSnapshot empty(int laneId, Instant capturedAt) {
        return new LaneSnapshot(laneId, Map.of(), false, capturedAt);
    }

    public int totalVehicles() {
        int total = 0;
        for (Integer count : counts.values()) {
            total += count == null ? 0 : count;
        }
        return total;
    }
}
