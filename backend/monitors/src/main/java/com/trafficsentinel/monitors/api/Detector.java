package com.trafficsentinel.monitors.api;

/**
 * Turns one frame into per-class vehicle counts and an ambulance flag. A {@code null} frame must
 * yield {@link Detection#empty()}.
 */
public interface Detector<F> {
    Detection<F> detect(F frame);
}
