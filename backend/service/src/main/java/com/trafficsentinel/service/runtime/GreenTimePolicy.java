package com.trafficsentinel.service.runtime;

import java.time.Duration;
import java.util.Objects;

/**
 * Three-tier green time: more than {@code heavyAbove} vehicles gets {@code heavy}, at least
 * {@code moderateFrom} gets {@code moderate}, anything lighter gets {@code light}. Wait saved is
 * measured against a fixed-time controller that always grants {@code fixedCycleGreen}.
 */
public record GreenTimePolicy(
        int heavyAbove,
        int moderateFrom,
        Duration heavy,
        Duration moderate,
        Duration light,
        Duration fixedCycleGreen
) {
    public GreenTimePolicy {
        Objects.requireNonNull(heavy, "heavy is required");
        Objects.requireNonNull(moderate, "moderate is required");
        Objects.requireNonNull(light, "light is required");
        Objects.requireNonNull(fixedCycleGreen, "fixedCycleGreen is required");
        if (moderateFrom > heavyAbove) {
            throw new IllegalArgumentException("moderateFrom must not exceed heavyAbove");
        }
    }

    public static GreenTimePolicy standard() {
        return new GreenTimePolicy(
                15,
                5,
                Duration.ofSeconds(60),
                Duration.ofSeconds(30),
                Duration.ofSeconds(15),
                Duration.ofSeconds(60)
        );
    }

    public Duration greenDuration(int totalVehicles) {
        if (totalVehicles > heavyAbove) {
            return heavy;
        }
        if (totalVehicles >= moderateFrom) {
            return moderate;
        }
        return light;
    }

    public double waitSavedSeconds(Duration green) {
        Duration saved = fixedCycleGreen.minus(green);
        return saved.isNegative() ? 0.0 : saved.toNanos() / 1_000_000_000.0;
    }
}
