package com.trafficsentinel.monitors.detect;

import java.util.Objects;

public record RawDetection(String label, double confidence) {
    public RawDetection {
        Objects.requireNonNull(label, "label is required");
    }
}
