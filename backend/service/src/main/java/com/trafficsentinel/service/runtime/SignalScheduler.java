package com.trafficsentinel.service.runtime;

import com.trafficsentinel.core.bus.EventBus;
import com.trafficsentinel.core.events.AlertRaised;
import com.trafficsentinel.core.events.EmergencyTriggered;
import com.trafficsentinel.core.events.SignalChanged;
import com.trafficsentinel.core.model.ControllerStatistics;
import com.trafficsentinel.core.model.EmergencySource;
import com.trafficsentinel.core.model.LaneSnapshot;
import com.trafficsentinel.core.model.SignalMode;
import com.trafficsentinel.core.model.SignalState;
import com.trafficsentinel.core.state.SharedLaneState;
import com.trafficsentinel.service.store.CycleLogger;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Round-robin signal controller with emergency preemption.
 *
 * <p>One control loop owns the signal table. Each iteration either serves the active lane for a green
 * time derived from its vehicle count, or, when an override is pending or another lane reports an
 * ambulance, switches to that lane for a fixed emergency green. Green holds are preemptible; the
 * yellow and all-red phases of a transition are not, except by {@link #stop()}.
 *
 * <p>Signal states, mode, counters and the pending override are guarded by one monitor that is never
 * held across a timed wait.
 */
public class SignalScheduler {
    private static final Logger LOGGER = Logger.getLogger(SignalScheduler.class.getName());

    private final SharedLaneState laneState;
    private final CycleLogger cycleLogger;
    private final EventBus eventBus;
    private final Clock clock;
    private final SignalTimings timings;
    private final GreenTimePolicy greenTimePolicy;
    private final PhaseTimer timer;
    private final int laneCount;

    private final Object stateLock = new Object();
    private final SignalState[] states;
    private int currentLane = 1;
    private SignalMode mode = SignalMode.NORMAL;
    private Integer pendingOverride;
    private long cycles;
    private long emergencyEvents;
    private double cumulativeWaitSavedSeconds;

    private final LongAdder failedLogCalls = new LongAdder();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private volatile Thread worker;

    public SignalScheduler(
            SharedLaneState laneState,
            CycleLogger cycleLogger,
            EventBus eventBus,
            Clock clock,
            SignalTimings timings,
            GreenTimePolicy greenTimePolicy
    ) {
        this.laneState = Objects.requireNonNull(laneState, "laneState is required");
        this.cycleLogger = Objects.requireNonNull(cycleLogger, "cycleLogger is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.timings = Objects.requireNonNull(timings, "timings is required");
        this.greenTimePolicy = Objects.requireNonNull(greenTimePolicy, "greenTimePolicy is required");
        this.timer = new PhaseTimer(timings.preemptionPoll());
        this.laneCount = laneState.laneCount();
        this.states = new SignalState[laneCount];
        Arrays.fill(states, SignalState.RED);
        states[0] = SignalState.GREEN;

        PhaseTimer wakeTarget = timer;
        laneState.addPublishListener(snapshot -> {
            if (snapshot.ambulancePresent()) {
                wakeTarget.wake();
            }
        });
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Signal scheduler already started");
        }
        Thread thread = new Thread(this::runLoop, "signal-scheduler");
        thread.setDaemon(true);
        worker = thread;
        thread.start();
    }

    public void runOnce() {
        if (timer.isStopped()) {
            return;
        }
        int active = currentLane();
        Optional<EmergencyRequest> emergency = takeEmergency(Set.of(active));
        if (emergency.isPresent() && emergency.get().laneId() != active) {
            runEmergencyEpisode(emergency.get());
        } else {
            runNormalCycle(active, emergency.isPresent());
        }
    }

    public void forceEmergency(int laneId) {
        requireLane(laneId);
        synchronized (stateLock) {
            pendingOverride = laneId;
        }
        LOGGER.info("Manual override requested for lane " + laneId);
        timer.wake();
    }

    public Map<Integer, SignalState> getAllStates() {
        synchronized (stateLock) {
            Map<Integer, SignalState> copy = new LinkedHashMap<>();
            for (int i = 0; i < laneCount; i++) {
                copy.put(i + 1, states[i]);
            }
            return copy;
        }
    }

    public SignalState getLaneState(int laneId) {
        requireLane(laneId);
        synchronized (stateLock) {
            return states[laneId - 1];
        }
    }

    public ControllerStatistics getStatistics() {
        long dropped = failedLogCalls.sum() + cycleLogger.droppedRecords();
        synchronized (stateLock) {
            return new ControllerStatistics(
                    cycles,
                    emergencyEvents,
                    cumulativeWaitSavedSeconds,
                    mode,
                    currentLane,
                    dropped
            );
        }
    }

    public int currentLane() {
        synchronized (stateLock) {
            return currentLane;
        }
    }

    public SignalMode mode() {
        synchronized (stateLock) {
            return mode;
        }
    }

    public boolean hasPendingOverride() {
        synchronized (stateLock) {
            return pendingOverride != null;
        }
    }

    public int laneCount() {
        return laneCount;
    }

    public void stop() {
        if (stopRequested.compareAndSet(false, true)) {
            LOGGER.info("Signal scheduler stop requested");
            timer.stop();
        }
    }

    public boolean awaitTermination(Duration timeout) {
        Thread thread = worker;
        if (thread == null) {
            return true;
        }
        try {
            thread.join(Math.max(1, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }

    public boolean isRunning() {
        Thread thread = worker;
        return thread != null && thread.isAlive();
    }

    private void runLoop() {
        LOGGER.info("Signal scheduler started with lane " + currentLane() + " GREEN across " + laneCount + " lanes");
        try {
            while (!timer.isStopped()) {
                try {
                    runOnce();
                } catch (RuntimeException ex) {
                    handleCycleFailure(ex);
                }
            }
        } finally {
            LOGGER.info("Signal scheduler stopped");
        }
    }

    private void handleCycleFailure(RuntimeException ex) {
        int lane = currentLane();
        LOGGER.log(Level.SEVERE, "Signal cycle failed on lane " + lane + "; backing off", ex);
        eventBus.publish(new AlertRaised(
                clock.instant(),
                "scheduler",
                "Signal cycle failed: " + ex.getMessage(),
                Map.of("lane", lane)
        ));
        timer.sleep(timings.errorBackoff());
    }

    private void runNormalCycle(int lane, boolean overrideForActiveLane) {
        // no-op unless a failed transition left the active lane yellow or red
        setState(lane, SignalState.GREEN);
        LaneSnapshot snapshot = snapshotOf(lane);
        boolean ambulance = snapshot.ambulancePresent() || overrideForActiveLane;
        Duration green = greenTimePolicy.greenDuration(snapshot.totalVehicles());
        double waitSaved = greenTimePolicy.waitSavedSeconds(green);

        SignalMode phaseMode;
        synchronized (stateLock) {
            mode = ambulance ? SignalMode.EMERGENCY : SignalMode.NORMAL;
            if (ambulance) {
                emergencyEvents++;
            }
            cumulativeWaitSavedSeconds += waitSaved;
            phaseMode = mode;
        }
        if (ambulance) {
            LOGGER.info("Ambulance in active lane " + lane + "; holding green");
        }
        LOGGER.info("Lane " + lane + " GREEN for " + green.toMillis() + "ms, " + snapshot.totalVehicles()
                + " vehicles " + snapshot.counts() + ", mode " + phaseMode);
        logPhase(lane, snapshot.counts(), ambulance, green, phaseMode);

        HoldResult hold = holdGreen(lane, green, Set.of(lane));
        switch (hold.outcome()) {
            case STOPPED:
                return;
            case PREEMPTED:
                runEmergencyEpisode(hold.request());
                return;
            case ELAPSED:
            default:
                break;
        }
        if (!transition(lane, nextLane(lane))) {
            return;
        }
        synchronized (stateLock) {
            cycles++;
            mode = SignalMode.NORMAL;
        }
    }

    private void runEmergencyEpisode(EmergencyRequest first) {
        EmergencyRequest request = first;
        // an ambulance lane already granted in this episode cannot preempt again
        Set<Integer> served = new HashSet<>();
        while (true) {
            int from = currentLane();
            int lane = request.laneId();
            served.add(lane);
            LOGGER.warning("Emergency override (" + request.source() + "): switching lane " + from + " -> " + lane);
            synchronized (stateLock) {
                mode = SignalMode.EMERGENCY;
            }
            if (!transition(from, lane)) {
                return;
            }
            synchronized (stateLock) {
                cycles++;
                emergencyEvents++;
            }
            eventBus.publish(new EmergencyTriggered(clock.instant(), lane, from, request.source()));
            logPhase(lane, snapshotOf(lane).counts(), true, timings.emergencyGreen(), SignalMode.EMERGENCY);

            HoldResult hold = holdGreen(lane, timings.emergencyGreen(), served);
            if (hold.outcome() == PhaseTimer.Outcome.STOPPED) {
                return;
            }
            if (hold.outcome() == PhaseTimer.Outcome.PREEMPTED) {
                request = hold.request();
                continue;
            }
            break;
        }

        int lane = currentLane();
        if (!transition(lane, nextLane(lane))) {
            return;
        }
        synchronized (stateLock) {
            mode = SignalMode.NORMAL;
        }
    }

    private HoldResult holdGreen(int lane, Duration green, Set<Integer> excludedAmbulanceLanes) {
        long deadline = System.nanoTime() + green.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return new HoldResult(PhaseTimer.Outcome.ELAPSED, null);
            }
            PhaseTimer.Outcome outcome = timer.await(
                    Duration.ofNanos(remaining),
                    () -> emergencyPending(excludedAmbulanceLanes)
            );
            if (outcome != PhaseTimer.Outcome.PREEMPTED) {
                return new HoldResult(outcome, null);
            }
            // the wake-up check and the request read are separate; act only on what is taken here
            Optional<EmergencyRequest> request = takeEmergency(excludedAmbulanceLanes);
            if (request.isEmpty()) {
                LOGGER.fine("Emergency cleared before it was taken; lane " + lane + " keeps green");
                continue;
            }
            if (request.get().laneId() == lane) {
                synchronized (stateLock) {
                    mode = SignalMode.EMERGENCY;
                    emergencyEvents++;
                }
                LOGGER.info("Manual override for active lane " + lane + "; holding green");
                continue;
            }
            return new HoldResult(PhaseTimer.Outcome.PREEMPTED, request.get());
        }
    }

    private boolean transition(int from, int to) {
        if (from == to) {
            setState(to, SignalState.GREEN);
            return true;
        }
        setState(from, SignalState.YELLOW);
        if (timer.sleep(timings.yellow()) == PhaseTimer.Outcome.STOPPED) {
            return false;
        }
        setState(from, SignalState.RED);
        if (timer.sleep(timings.transitionDelay()) == PhaseTimer.Outcome.STOPPED) {
            return false;
        }
        setState(to, SignalState.GREEN);
        return true;
    }

    private void setState(int lane, SignalState next) {
        SignalState previous;
        SignalMode currentMode;
        synchronized (stateLock) {
            previous = states[lane - 1];
            states[lane - 1] = next;
            if (next == SignalState.GREEN) {
                currentLane = lane;
            }
            currentMode = mode;
        }
        if (previous != next) {
            eventBus.publish(new SignalChanged(clock.instant(), lane, previous, next, currentMode));
        }
    }

    private Optional<EmergencyRequest> takeEmergency(Set<Integer> excludedAmbulanceLanes) {
        synchronized (stateLock) {
            if (pendingOverride != null) {
                int lane = pendingOverride;
                pendingOverride = null;
                return Optional.of(new EmergencyRequest(lane, EmergencySource.MANUAL_OVERRIDE));
            }
        }
        int ambulanceLane = lowestAmbulanceLane(excludedAmbulanceLanes);
        if (ambulanceLane > 0) {
            return Optional.of(new EmergencyRequest(ambulanceLane, EmergencySource.AMBULANCE));
        }
        return Optional.empty();
    }

    private boolean emergencyPending(Set<Integer> excludedAmbulanceLanes) {
        return hasPendingOverride() || lowestAmbulanceLane(excludedAmbulanceLanes) > 0;
    }

    private int lowestAmbulanceLane(Set<Integer> excludedLanes) {
        for (int lane = 1; lane <= laneCount; lane++) {
            if (excludedLanes.contains(lane)) {
                continue;
            }
            Optional<LaneSnapshot> snapshot = laneState.get(lane);
            if (snapshot.isPresent() && snapshot.get().ambulancePresent()) {
                return lane;
            }
        }
        return 0;
    }

    private LaneSnapshot snapshotOf(int lane) {
        return laneState.get(lane).orElseGet(() -> LaneSnapshot.empty(lane, clock.instant()));
    }

    private void logPhase(int lane, Map<String, Integer> counts, boolean ambulance, Duration green, SignalMode phaseMode) {
        try {
            cycleLogger.logCycle(lane, counts, ambulance, green.toMillis() / 1000.0, phaseMode);
        } catch (RuntimeException ex) {
            failedLogCalls.increment();
            LOGGER.log(Level.WARNING, "Phase log failed for lane " + lane, ex);
        }
    }

    private int nextLane(int lane) {
        return (lane % laneCount) + 1;
    }

    private void requireLane(int laneId) {
        if (laneId < 1 || laneId > laneCount) {
            throw new IllegalArgumentException("Unknown lane " + laneId + "; expected 1.." + laneCount);
        }
    }

    private record EmergencyRequest(int laneId, EmergencySource source) {
    }

    private record HoldResult(PhaseTimer.Outcome outcome, EmergencyRequest request) {
    }
}
