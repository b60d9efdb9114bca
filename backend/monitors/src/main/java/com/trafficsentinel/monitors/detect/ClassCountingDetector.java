package com.trafficsentinel.monitors.detect;

import com.trafficsentinel.monitors.api.Detection;
import com.trafficsentinel.monitors.api.Detector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for detectors backed by a labelled object detector. Subclasses supply raw detections; this
 * class applies the confidence threshold, counts the vehicle classes and raises the ambulance flag.
 */
public abstract class ClassCountingDetector<F> implements Detector<F> {
    public static final double DEFAULT_CONFIDENCE = 0.5;
    public static final List<String> VEHICLE_CLASSES = List.of("car", "bus", "truck", "motorcycle");
    public static final String AMBULANCE_CLASS = "ambulance";

    private volatile double confidence;

    protected ClassCountingDetector(double confidence) {
        this.confidence = requireValidConfidence(confidence);
    }

    public double confidence() {
        return confidence;
    }

    public void updateConfidence(double confidence) {
        this.confidence = requireValidConfidence(confidence);
    }

    @Override
    public final Detection<F> detect(F frame) {
        if (frame == null) {
            return Detection.empty();
        }
        double threshold = confidence;
        Map<String, Integer> counts = new LinkedHashMap<>();
        VEHICLE_CLASSES.forEach(vehicleClass -> counts.put(vehicleClass, 0));
        List<RawDetection> accepted = new ArrayList<>();
        boolean ambulance = false;

        for (RawDetection raw : infer(frame)) {
            if (raw.confidence() < threshold) {
                continue;
            }
            accepted.add(raw);
            if (counts.containsKey(raw.label())) {
                counts.merge(raw.label(), 1, Integer::sum);
            }
            if (AMBULANCE_CLASS.equals(raw.label())) {
                ambulance = true;
            }
        }
        return new Detection<>(annotate(frame, accepted), counts, ambulance);
    }

    protected abstract List<RawDetection> infer(F frame);

    protected F annotate(F frame, List<RawDetection> accepted) {
        return frame;
    }

    static double requireValidConfidence(double confidence) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0 and 1, got " + confidence);
        }
        return confidence;
    }
}
