package com.trafficsentinel.monitors.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record Detection<F>(F annotatedFrame, Map<String, Integer> counts, boolean ambulancePresent) {
    public Detection {
        Objects.requireNonNull(counts, "counts is required");
        counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    public static <F> Detection<F> empty() {
        return new Detection<>(null, Map.of(), false);
    }
}
