package com.trafficsentinel.service.runtime;

import java.time.Duration;

public record SignalTimings(
        Duration yellow,
        Duration transitionDelay,
        Duration emergencyGreen,
        Duration errorBackoff,
        Duration preemptionPoll
) {
    public static final Duration DEFAULT_YELLOW = Duration.ofSeconds(3);
    public static final Duration DEFAULT_TRANSITION_DELAY = Duration.ofSeconds(2);
    public static final Duration DEFAULT_EMERGENCY_GREEN = Duration.ofSeconds(45);
    public static final Duration DEFAULT_ERROR_BACKOFF = Duration.ofSeconds(5);
    public static final Duration DEFAULT_PREEMPTION_POLL = Duration.ofMillis(250);

    public SignalTimings {
        yellow = yellow == null ? DEFAULT_YELLOW : yellow;
        transitionDelay = transitionDelay == null ? DEFAULT_TRANSITION_DELAY : transitionDelay;
        emergencyGreen = emergencyGreen == null ? DEFAULT_EMERGENCY_GREEN : emergencyGreen;
        errorBackoff = errorBackoff == null ? DEFAULT_ERROR_BACKOFF : errorBackoff;
        preemptionPoll = preemptionPoll == null ? DEFAULT_PREEMPTION_POLL : preemptionPoll;
    }

    public static SignalTimings standard() {
        return new SignalTimings(null, null, null, null, null);
    }
}
