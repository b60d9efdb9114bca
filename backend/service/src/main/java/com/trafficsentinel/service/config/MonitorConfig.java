package com.trafficsentinel.service.config;

import java.time.Duration;

public record MonitorConfig(Duration minIterationDelay, Duration stopTimeout, Integer frameWidth, Integer frameHeight) {
    public MonitorConfig {
        minIterationDelay = minIterationDelay == null ? Duration.ofMillis(30) : minIterationDelay;
        stopTimeout = stopTimeout == null ? Duration.ofSeconds(5) : stopTimeout;
        frameWidth = frameWidth == null ? 640 : frameWidth;
        frameHeight = frameHeight == null ? 360 : frameHeight;
    }
}
