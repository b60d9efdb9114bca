package com.trafficsentinel.service.config;

import com.trafficsentinel.monitors.detect.ClassCountingDetector;

public record DetectorConfig(Double confidence, String script) {
    public DetectorConfig {
        confidence = confidence == null ? ClassCountingDetector.DEFAULT_CONFIDENCE : confidence;
    }
}
