package com.trafficsentinel.service.config;

import com.trafficsentinel.service.runtime.SignalTimings;

import java.util.List;

public record SystemConfig(
        List<LaneConfig> lanes,
        SignalTimings timings,
        GreenTimeConfig greenTime,
        MonitorConfig monitor,
        DetectorConfig detector,
        Integer apiPort,
        String phaseLogFile
) {
    public SystemConfig {
        lanes = lanes == null ? List.of() : List.copyOf(lanes);
        timings = timings == null ? SignalTimings.standard() : timings;
        greenTime = greenTime == null ? new GreenTimeConfig(null, null, null, null, null, null) : greenTime;
        monitor = monitor == null ? new MonitorConfig(null, null, null, null) : monitor;
        detector = detector == null ? new DetectorConfig(null, null) : detector;
        apiPort = apiPort == null ? 8080 : apiPort;
        phaseLogFile = phaseLogFile == null ? "logs/phases.jsonl" : phaseLogFile;
    }
}
