package com.trafficsentinel.service.store;

import com.trafficsentinel.core.model.PhaseRecord;

import java.time.Instant;
import java.util.List;

public interface PhaseLogStore {
    void append(PhaseRecord record);

    /**
     * Newest first.
     */
    List<PhaseRecord> recent(int limit);

    List<PhaseRecord> since(Instant since);
}
