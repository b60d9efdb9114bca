package com.trafficsentinel.monitors.detect;

import com.trafficsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Replays a fixed script of raw detections, one entry per frame, wrapping around at the end.
 * Stands in for a model-backed detector when running without one.
 */
public class ScriptedDetector<F> extends ClassCountingDetector<F> {
    private final List<List<RawDetection>> frames;
    private final AtomicLong cursor = new AtomicLong();

    public ScriptedDetector(List<List<RawDetection>> frames, double confidence) {
        super(confidence);
        if (frames == null || frames.isEmpty()) {
            throw new IllegalArgumentException("Detection script needs at least one frame");
        }
        List<List<RawDetection>> copy = new ArrayList<>();
        for (List<RawDetection> frame : frames) {
            copy.add(frame == null ? List.of() : List.copyOf(frame));
        }
        this.frames = List.copyOf(copy);
    }

    public static <F> ScriptedDetector<F> fromFile(Path scriptFile, double confidence) {
        try (InputStream in = Files.newInputStream(scriptFile)) {
            DetectionScript script = JsonUtils.objectMapper().readValue(in, DetectionScript.class);
            return new ScriptedDetector<>(script.frames(), confidence);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed reading detection script: " + scriptFile, e);
        }
    }

    public int scriptLength() {
        return frames.size();
    }

    @Override
    protected List<RawDetection> infer(F frame) {
        int index = (int) (cursor.getAndIncrement() % frames.size());
        return frames.get(index);
    }

    record DetectionScript(List<List<RawDetection>> frames) {
    }
}
