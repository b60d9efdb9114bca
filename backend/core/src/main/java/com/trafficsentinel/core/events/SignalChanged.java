package com.trafficsentinel.core.events;

import com.trafficsentinel.core.model.SignalMode;
import com.trafficsentinel.core.model.SignalState;

import java.time.Instant;

public record SignalChanged(
        Instant timestamp,
        int laneId,
        SignalState previous,
        SignalState current,
        SignalMode mode
) implements Event {
    @Override
    public String type() {
        return "SignalChanged";
    }
}
