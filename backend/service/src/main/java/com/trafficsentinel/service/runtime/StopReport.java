package com.trafficsentinel.service.runtime;

import java.util.List;

/**
 * Outcome of stopping the system. Workers listed in {@code unstoppedWorkers} did not exit within the
 * timeout and were abandoned.
 */
public record StopReport(boolean clean, List<String> unstoppedWorkers) {
    public StopReport {
        unstoppedWorkers = List.copyOf(unstoppedWorkers);
    }
}
