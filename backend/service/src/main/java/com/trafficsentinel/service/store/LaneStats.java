package com.trafficsentinel.service.store;

public record LaneStats(
        int laneId,
        long totalVehicles,
        double averageVehicles,
        long totalCycles,
        long emergencyEvents,
        double averageGreenSeconds
) {
}
