package com.trafficsentinel.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.trafficsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static SystemConfig loadSystem(Path configDir) {
        Path path = configDir.resolve("system.json");
        SystemConfig config = read(path, new TypeReference<>() {
        });
        if (config == null) {
            throw new IllegalStateException("Config " + path + " is empty");
        }
        validateLanes(path, config.lanes());
        return config;
    }

    private static void validateLanes(Path path, List<LaneConfig> lanes) {
        if (lanes.isEmpty()) {
            throw new IllegalStateException("Config " + path + " must define at least one lane");
        }
        for (int i = 0; i < lanes.size(); i++) {
            LaneConfig lane = lanes.get(i);
            if (lane.laneId() != i + 1) {
                throw new IllegalStateException(
                        "Config " + path + " must list lanes 1.." + lanes.size() + " in order; found " + lane.laneId());
            }
            if (lane.source() == null || lane.source().isBlank()) {
                throw new IllegalStateException("Config " + path + " lane " + lane.laneId() + " has no source");
            }
        }
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
