package com.trafficsentinel.service.runtime;

public record MonitorStatus(
        int laneId,
        String location,
        boolean running,
        long framesProcessed,
        long failedFrames
) {
}
