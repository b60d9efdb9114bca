package com.trafficsentinel.service.store;

public record TodayStats(
        long totalCycles,
        long totalVehicles,
        long emergencyEvents,
        double waitTimeSavedSeconds
) {
}
