package com.trafficsentinel.core.events;

import com.trafficsentinel.core.model.EmergencySource;

import java.time.Instant;

public record EmergencyTriggered(
        Instant timestamp,
        int laneId,
        int previousLane,
        EmergencySource source
) implements Event {
    @Override
    public String type() {
        return "EmergencyTriggered";
    }
}
