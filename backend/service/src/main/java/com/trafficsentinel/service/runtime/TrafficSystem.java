package com.trafficsentinel.service.runtime;

import com.trafficsentinel.core.bus.EventBus;
import com.trafficsentinel.core.events.AlertRaised;
import com.trafficsentinel.core.model.ControllerStatistics;
import com.trafficsentinel.core.model.LaneSnapshot;
import com.trafficsentinel.core.model.SignalState;
import com.trafficsentinel.core.state.SharedLaneState;
import com.trafficsentinel.monitors.detect.ClassCountingDetector;
import com.trafficsentinel.monitors.lane.LaneMonitor;
import com.trafficsentinel.service.store.CycleLogger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Owns the lane monitor threads and the signal scheduler: starts them together and stops them
 * within a bounded time.
 */
public class TrafficSystem {
    private static final Logger LOGGER = Logger.getLogger(TrafficSystem.class.getName());

    private final List<LaneMonitor<?>> monitors;
    private final SignalScheduler scheduler;
    private final SharedLaneState laneState;
    private final CycleLogger cycleLogger;
    private final EventBus eventBus;
    private final Clock clock;
    private final Map<Integer, Thread> monitorThreads = new LinkedHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private final Object stopLock = new Object();
    private StopReport stopReport;

    public TrafficSystem(
            List<LaneMonitor<?>> monitors,
            SignalScheduler scheduler,
            SharedLaneState laneState,
            CycleLogger cycleLogger,
            EventBus eventBus,
            Clock clock
    ) {
        this.monitors = List.copyOf(monitors);
        this.scheduler = scheduler;
        this.laneState = laneState;
        this.cycleLogger = cycleLogger;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public StartupReport start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Traffic system already started");
        }
        List<Integer> startedLanes = new ArrayList<>();
        Map<Integer, String> failedLanes = new LinkedHashMap<>();
        for (LaneMonitor<?> monitor : monitors) {
            try {
                monitor.open();
            } catch (RuntimeException ex) {
                failedLanes.put(monitor.laneId(), ex.getMessage());
                LOGGER.warning("Lane " + monitor.laneId() + " did not start: " + ex.getMessage());
                eventBus.publish(new AlertRaised(
                        clock.instant(),
                        "monitor",
                        "Lane monitor failed to start: " + ex.getMessage(),
                        Map.of("lane", monitor.laneId())
                ));
                continue;
            }
            Thread thread = new Thread(monitor, "lane-monitor-" + monitor.laneId());
            thread.setDaemon(true);
            synchronized (monitorThreads) {
                monitorThreads.put(monitor.laneId(), thread);
            }
            thread.start();
            startedLanes.add(monitor.laneId());
        }
        scheduler.start();
        LOGGER.info("Traffic system started; lanes running " + startedLanes + ", failed " + failedLanes.keySet());
        return new StartupReport(startedLanes, failedLanes);
    }

    public StopReport stop(Duration timeout) {
        synchronized (stopLock) {
            if (stopReport != null) {
                return stopReport;
            }
            long deadline = System.nanoTime() + timeout.toNanos();
            monitors.forEach(LaneMonitor::stop);
            scheduler.stop();

            Map<Integer, Thread> threads;
            synchronized (monitorThreads) {
                threads = new LinkedHashMap<>(monitorThreads);
            }
            threads.values().forEach(Thread::interrupt);

            List<String> unstopped = new ArrayList<>();
            for (Thread thread : threads.values()) {
                if (!join(thread, deadline)) {
                    unstopped.add(thread.getName());
                }
            }
            if (!scheduler.awaitTermination(remaining(deadline))) {
                unstopped.add("signal-scheduler");
            }
            cycleLogger.close();

            stopReport = new StopReport(unstopped.isEmpty(), unstopped);
            if (stopReport.clean()) {
                LOGGER.info("Traffic system stopped");
            } else {
                LOGGER.warning("Traffic system stopped partially; abandoned " + unstopped);
                eventBus.publish(new AlertRaised(
                        clock.instant(),
                        "shutdown",
                        "Workers did not stop in time: " + unstopped,
                        Map.of("workers", unstopped)
                ));
            }
            return stopReport;
        }
    }

    public Map<Integer, SignalState> getAllStates() {
        return scheduler.getAllStates();
    }

    public Map<Integer, LaneSnapshot> getAllLaneData() {
        return laneState.getAll();
    }

    public ControllerStatistics getStatistics() {
        return scheduler.getStatistics();
    }

    public void forceEmergency(int laneId) {
        scheduler.forceEmergency(laneId);
    }

    public int updateConfidence(double confidence) {
        Set<ClassCountingDetector<?>> detectors = Collections.newSetFromMap(new IdentityHashMap<>());
        for (LaneMonitor<?> monitor : monitors) {
            if (monitor.detector() instanceof ClassCountingDetector<?> countingDetector) {
                detectors.add(countingDetector);
            }
        }
        if (detectors.isEmpty()) {
            throw new IllegalStateException("No lane detector supports a confidence threshold");
        }
        for (ClassCountingDetector<?> detector : detectors) {
            detector.updateConfidence(confidence);
        }
        LOGGER.info("Detector confidence set to " + confidence + " on " + detectors.size() + " detectors");
        return detectors.size();
    }

    public Map<Integer, MonitorStatus> monitorStatus() {
        Map<Integer, Thread> threads;
        synchronized (monitorThreads) {
            threads = new LinkedHashMap<>(monitorThreads);
        }
        Map<Integer, MonitorStatus> status = new LinkedHashMap<>();
        for (LaneMonitor<?> monitor : monitors) {
            Thread thread = threads.get(monitor.laneId());
            status.put(monitor.laneId(), new MonitorStatus(
                    monitor.laneId(),
                    monitor.location(),
                    thread != null && thread.isAlive(),
                    monitor.framesProcessed(),
                    monitor.failedFrames()
            ));
        }
        return status;
    }

    public SignalScheduler scheduler() {
        return scheduler;
    }

    private static boolean join(Thread thread, long deadline) {
        try {
            thread.join(Math.max(1, remaining(deadline).toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }

    private static Duration remaining(long deadline) {
        long nanos = deadline - System.nanoTime();
        return nanos <= 0 ? Duration.ZERO : Duration.ofNanos(nanos);
    }
}
