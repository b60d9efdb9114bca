package com.trafficsentinel.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trafficsentinel.core.model.PhaseRecord;
import com.trafficsentinel.core.util.JsonUtils;

import java.io.IOException;

public final class PhaseRecordCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private PhaseRecordCodec() {
    }

    public static String toJsonLine(PhaseRecord record) {
        try {
            return MAPPER.writeValueAsString(record);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize phase record", e);
        }
    }

    public static PhaseRecord fromJsonLine(String line) {
        PhaseRecord record;
        try {
            record = MAPPER.readValue(line, PhaseRecord.class);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize phase record", e);
        }
        if (record == null) {
            throw new IllegalStateException("Unable to deserialize phase record");
        }
        return record;
    }
}
