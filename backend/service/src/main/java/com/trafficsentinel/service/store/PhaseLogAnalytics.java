package com.trafficsentinel.service.store;

import com.trafficsentinel.core.model.PhaseRecord;
import com.trafficsentinel.core.model.SignalMode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class PhaseLogAnalytics {
    private final PhaseLogStore store;
    private final Clock clock;
    private final double fixedCycleGreenSeconds;

    public PhaseLogAnalytics(PhaseLogStore store, Clock clock, Duration fixedCycleGreen) {
        this.store = store;
        this.clock = clock;
        this.fixedCycleGreenSeconds = fixedCycleGreen.toMillis() / 1000.0;
    }

    public TodayStats todayStats() {
        Instant startOfDay = LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
        List<PhaseRecord> records = store.since(startOfDay);
        long vehicles = 0;
        long emergencies = 0;
        double waitSaved = 0;
        for (PhaseRecord record : records) {
            vehicles += record.totalVehicles();
            if (record.mode() == SignalMode.EMERGENCY) {
                emergencies++;
            }
            waitSaved += Math.max(0, fixedCycleGreenSeconds - record.greenDurationSeconds());
        }
        return new TodayStats(records.size(), vehicles, emergencies, waitSaved);
    }

    public List<LaneStats> laneStats(Duration window) {
        Instant since = clock.instant().minus(window);
        Map<Integer, List<PhaseRecord>> byLane = new TreeMap<>();
        for (PhaseRecord record : store.since(since)) {
            byLane.computeIfAbsent(record.laneId(), ignored -> new ArrayList<>()).add(record);
        }

        List<LaneStats> stats = new ArrayList<>();
        for (Map.Entry<Integer, List<PhaseRecord>> entry : byLane.entrySet()) {
            List<PhaseRecord> records = entry.getValue();
            long vehicles = 0;
            long ambulances = 0;
            double green = 0;
            for (PhaseRecord record : records) {
                vehicles += record.totalVehicles();
                ambulances += record.ambulanceDetected() ? 1 : 0;
                green += record.greenDurationSeconds();
            }
            stats.add(new LaneStats(
                    entry.getKey(),
                    vehicles,
                    (double) vehicles / records.size(),
                    records.size(),
                    ambulances,
                    green / records.size()
            ));
        }
        return stats;
    }
}
