package com.trafficsentinel.service.store;

import com.trafficsentinel.core.model.SignalMode;

import java.util.Map;

public interface CycleLogger extends AutoCloseable {
    void logCycle(
            int laneId,
            Map<String, Integer> countsByClass,
            boolean ambulancePresent,
            double greenDurationSeconds,
            SignalMode mode
    );

    default long droppedRecords() {
        return 0;
    }

    @Override
    default void close() {
    }
}
