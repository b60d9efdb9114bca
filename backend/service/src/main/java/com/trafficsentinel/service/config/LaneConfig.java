package com.trafficsentinel.service.config;

public record LaneConfig(int laneId, String source, String script) {
}
