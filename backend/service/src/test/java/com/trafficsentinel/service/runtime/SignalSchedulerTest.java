package com.trafficsentinel.service.runtime;

import com.trafficsentinel.core.bus.EventBus;
import com.trafficsentinel.core.events.AlertRaised;
import com.trafficsentinel.core.events.EmergencyTriggered;
import com.trafficsentinel.core.events.SignalChanged;
import com.trafficsentinel.core.model.ControllerStatistics;
import com.trafficsentinel.core.model.EmergencySource;
import com.trafficsentinel.core.model.LaneSnapshot;
import com.trafficsentinel.core.model.PhaseRecord;
import com.trafficsentinel.core.model.SignalMode;
import com.trafficsentinel.core.model.SignalState;
import com.trafficsentinel.core.state.SharedLaneState;
import com.trafficsentinel.service.support.CapturingCycleLogger;
import com.trafficsentinel.service.support.EventCapture;
import com.trafficsentinel.service.support.TestTimings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalSchedulerTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);

    private final List<SignalScheduler> started = new ArrayList<>();

    @AfterEach
    void tearDown() {
        for (SignalScheduler scheduler : started) {
            scheduler.stop();
            scheduler.awaitTermination(Duration.ofSeconds(2));
        }
    }

    @Test
    void startsWithFirstLaneGreenAndOthersRed() {
        SignalScheduler scheduler = scheduler(new SharedLaneState(3), new CapturingCycleLogger(), new EventBus(),
                TestTimings.fastPolicy());

        assertEquals(Map.of(1, SignalState.GREEN, 2, SignalState.RED, 3, SignalState.RED), scheduler.getAllStates());
        assertEquals(1, scheduler.currentLane());
        assertEquals(SignalMode.NORMAL, scheduler.mode());
    }

    @Test
    void runOnceServesLanesRoundRobin() {
        CapturingCycleLogger logger = new CapturingCycleLogger();
        SignalScheduler scheduler = scheduler(new SharedLaneState(3), logger, new EventBus(), TestTimings.fastPolicy());

        List<Integer> activeAfterEachCycle = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            scheduler.runOnce();
            activeAfterEachCycle.add(scheduler.currentLane());
        }

        assertEquals(List.of(2, 3, 1, 2), activeAfterEachCycle);
        assertEquals(List.of(1, 2, 3, 1), logger.records().stream().map(PhaseRecord::laneId).toList());
        assertEquals(4, scheduler.getStatistics().cycles());
        assertEquals(SignalState.GREEN, scheduler.getLaneState(2));
        assertEquals(SignalState.RED, scheduler.getLaneState(1));
    }

    @Test
    void transitionGoesThroughYellowAndRedBeforeNextGreen() {
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        SignalScheduler scheduler = scheduler(new SharedLaneState(2), new CapturingCycleLogger(), bus,
                TestTimings.fastPolicy());

        scheduler.runOnce();

        List<String> changes = capture.byType(SignalChanged.class).stream()
                .map(change -> change.laneId() + ":" + change.previous() + "->" + change.current())
                .toList();
        assertEquals(List.of("1:GREEN->YELLOW", "1:YELLOW->RED", "2:RED->GREEN"), changes);
    }

    @Test
    void greenTimeAndWaitSavedFollowVehicleCounts() {
        SharedLaneState state = new SharedLaneState(3);
        state.publish(1, new LaneSnapshot(1, Map.of("car", 20), false, CLOCK.instant()));
        state.publish(2, new LaneSnapshot(2, Map.of("car", 8, "bus", 2), false, CLOCK.instant()));
        CapturingCycleLogger logger = new CapturingCycleLogger();
        SignalScheduler scheduler = scheduler(state, logger, new EventBus(), TestTimings.fastPolicy());

        scheduler.runOnce();
        scheduler.runOnce();
        scheduler.runOnce();

        List<PhaseRecord> records = logger.records();
        assertEquals(0.06, records.get(0).greenDurationSeconds(), 1e-9);
        assertEquals(0.03, records.get(1).greenDurationSeconds(), 1e-9);
        assertEquals(0.015, records.get(2).greenDurationSeconds(), 1e-9);
        assertEquals(Map.of("car", 8, "bus", 2), records.get(1).vehicleCounts());

        ControllerStatistics stats = scheduler.getStatistics();
        assertEquals(3, stats.cycles());
        assertEquals(0.075, stats.cumulativeWaitSavedSeconds(), 1e-9);
        assertEquals(0.025, stats.averageWaitSavedPerCycle(), 1e-9);
        assertEquals(0, stats.emergencyEvents());
    }

    @Test
    void ambulanceInActiveLaneIsServedAsEmergencyWithoutSwitching() {
        SharedLaneState state = new SharedLaneState(3);
        state.publish(1, new LaneSnapshot(1, Map.of("car", 2), true, CLOCK.instant()));
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        CapturingCycleLogger logger = new CapturingCycleLogger();
        SignalScheduler scheduler = scheduler(state, logger, bus, TestTimings.fastPolicy());

        scheduler.runOnce();

        PhaseRecord record = logger.records().get(0);
        assertEquals(1, record.laneId());
        assertTrue(record.ambulanceDetected());
        assertEquals(SignalMode.EMERGENCY, record.mode());
        assertTrue(capture.byType(EmergencyTriggered.class).isEmpty());
        assertEquals(1, scheduler.getStatistics().emergencyEvents());
        assertEquals(SignalMode.NORMAL, scheduler.mode());
        assertEquals(2, scheduler.currentLane());
    }

    @Test
    void ambulanceInAnotherLaneTakesGreenForEmergencyDuration() {
        SharedLaneState state = new SharedLaneState(4);
        state.publish(3, new LaneSnapshot(3, Map.of("truck", 1), true, CLOCK.instant()));
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        CapturingCycleLogger logger = new CapturingCycleLogger();
        SignalScheduler scheduler = scheduler(state, logger, bus, TestTimings.fastPolicy());

        scheduler.runOnce();

        List<EmergencyTriggered> emergencies = capture.byType(EmergencyTriggered.class);
        assertEquals(1, emergencies.size());
        assertEquals(3, emergencies.get(0).laneId());
        assertEquals(1, emergencies.get(0).previousLane());
        assertEquals(EmergencySource.AMBULANCE, emergencies.get(0).source());

        PhaseRecord record = logger.records().get(0);
        assertEquals(3, record.laneId());
        assertTrue(record.ambulanceDetected());
        assertEquals(SignalMode.EMERGENCY, record.mode());
        assertEquals(0.02, record.greenDurationSeconds(), 1e-9);

        ControllerStatistics stats = scheduler.getStatistics();
        assertEquals(1, stats.cycles());
        assertEquals(1, stats.emergencyEvents());
        assertEquals(0.0, stats.cumulativeWaitSavedSeconds());
        assertEquals(4, scheduler.currentLane());
        assertEquals(SignalMode.NORMAL, scheduler.mode());
    }

    @Test
    void simultaneousAmbulancesAreServedLowestLaneFirstOncePerEpisode() {
        SharedLaneState state = new SharedLaneState(4);
        state.publish(4, new LaneSnapshot(4, Map.of(), true, CLOCK.instant()));
        state.publish(2, new LaneSnapshot(2, Map.of(), true, CLOCK.instant()));
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        SignalScheduler scheduler = scheduler(state, new CapturingCycleLogger(), bus, TestTimings.fastPolicy());

        scheduler.runOnce();

        List<EmergencyTriggered> emergencies = capture.byType(EmergencyTriggered.class);
        assertEquals(List.of(2, 4), emergencies.stream().map(EmergencyTriggered::laneId).toList());
        assertEquals(2, emergencies.get(1).previousLane());
        assertEquals(2, scheduler.getStatistics().emergencyEvents());
        assertEquals(1, scheduler.currentLane());
    }

    @Test
    void emergencyGreenIsAnnouncedInEmergencyMode() {
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        SignalScheduler scheduler = scheduler(new SharedLaneState(4), new CapturingCycleLogger(), bus,
                TestTimings.fastPolicy());
        scheduler.forceEmergency(3);

        scheduler.runOnce();

        SignalChanged emergencyGreen = capture.byType(SignalChanged.class).stream()
                .filter(change -> change.laneId() == 3 && change.current() == SignalState.GREEN)
                .findFirst()
                .orElseThrow();
        assertEquals(SignalMode.EMERGENCY, emergencyGreen.mode());
    }

    @Test
    void repeatedOverrideForSameLaneIsConsumedOnce() {
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        SignalScheduler scheduler = scheduler(new SharedLaneState(4), new CapturingCycleLogger(), bus,
                TestTimings.fastPolicy());

        scheduler.forceEmergency(3);
        scheduler.forceEmergency(3);
        assertTrue(scheduler.hasPendingOverride());
        scheduler.runOnce();

        assertFalse(scheduler.hasPendingOverride());
        assertEquals(4, scheduler.currentLane());
        scheduler.runOnce();

        List<EmergencyTriggered> emergencies = capture.byType(EmergencyTriggered.class);
        assertEquals(1, emergencies.size());
        assertEquals(EmergencySource.MANUAL_OVERRIDE, emergencies.get(0).source());
        assertEquals(1, scheduler.currentLane());
        assertEquals(1, scheduler.getStatistics().emergencyEvents());
    }

    @Test
    void overrideForActiveLaneHoldsGreen() {
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        CapturingCycleLogger logger = new CapturingCycleLogger();
        SignalScheduler scheduler = scheduler(new SharedLaneState(3), logger, bus, TestTimings.fastPolicy());

        scheduler.forceEmergency(1);
        scheduler.runOnce();

        assertTrue(capture.byType(EmergencyTriggered.class).isEmpty());
        assertEquals(1, logger.records().get(0).laneId());
        assertEquals(SignalMode.EMERGENCY, logger.records().get(0).mode());
        assertEquals(1, scheduler.getStatistics().emergencyEvents());
        assertFalse(scheduler.hasPendingOverride());
    }

    @Test
    void overrideDuringEmergencyGreenChainsToNextLane() {
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        SignalScheduler scheduler = scheduler(new SharedLaneState(4), new CapturingCycleLogger(), bus,
                TestTimings.fastPolicy());
        AtomicBoolean chained = new AtomicBoolean();
        bus.subscribe(SignalChanged.class, change -> {
            if (change.laneId() == 3 && change.current() == SignalState.GREEN && chained.compareAndSet(false, true)) {
                scheduler.forceEmergency(2);
            }
        });

        scheduler.forceEmergency(3);
        scheduler.runOnce();

        List<EmergencyTriggered> emergencies = capture.byType(EmergencyTriggered.class);
        assertEquals(List.of(3, 2), emergencies.stream().map(EmergencyTriggered::laneId).toList());
        assertEquals(3, emergencies.get(1).previousLane());
        assertEquals(2, scheduler.getStatistics().cycles());
        assertEquals(3, scheduler.currentLane());
    }

    @Test
    void forceEmergencyRejectsUnknownLane() {
        SignalScheduler scheduler = scheduler(new SharedLaneState(2), new CapturingCycleLogger(), new EventBus(),
                TestTimings.fastPolicy());

        assertThrows(IllegalArgumentException.class, () -> scheduler.forceEmergency(0));
        assertThrows(IllegalArgumentException.class, () -> scheduler.forceEmergency(3));
        assertFalse(scheduler.hasPendingOverride());
    }

    @Test
    void failedPhaseLogIsCountedAndCycleContinues() {
        CapturingCycleLogger logger = new CapturingCycleLogger();
        logger.failNext(1);
        SignalScheduler scheduler = scheduler(new SharedLaneState(2), logger, new EventBus(), TestTimings.fastPolicy());

        scheduler.runOnce();
        scheduler.runOnce();

        ControllerStatistics stats = scheduler.getStatistics();
        assertEquals(2, stats.cycles());
        assertEquals(1, stats.droppedLogRecords());
        assertEquals(1, logger.records().size());
    }

    @Test
    void manualOverridePreemptsLongGreenPromptly() throws Exception {
        EventBus bus = new EventBus();
        CountDownLatch emergency = new CountDownLatch(1);
        bus.subscribe(EmergencyTriggered.class, event -> emergency.countDown());
        SignalScheduler scheduler = scheduler(new SharedLaneState(4), new CapturingCycleLogger(), bus,
                TestTimings.longGreenPolicy());
        start(scheduler);
        Thread.sleep(50);

        long requestedAt = System.nanoTime();
        scheduler.forceEmergency(3);

        assertTrue(emergency.await(2, TimeUnit.SECONDS));
        long latencyMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - requestedAt);
        assertTrue(latencyMillis < 1_000, "preemption took " + latencyMillis + "ms");
    }

    @Test
    void ambulanceReportPreemptsLongGreenPromptly() throws Exception {
        SharedLaneState state = new SharedLaneState(3);
        EventBus bus = new EventBus();
        List<EmergencyTriggered> emergencies = new CopyOnWriteArrayList<>();
        CountDownLatch emergency = new CountDownLatch(1);
        bus.subscribe(EmergencyTriggered.class, event -> {
            emergencies.add(event);
            emergency.countDown();
        });
        SignalScheduler scheduler = scheduler(state, new CapturingCycleLogger(), bus, TestTimings.longGreenPolicy());
        start(scheduler);
        Thread.sleep(50);

        state.publish(2, new LaneSnapshot(2, Map.of("car", 1), true, CLOCK.instant()));

        assertTrue(emergency.await(2, TimeUnit.SECONDS));
        assertEquals(2, emergencies.get(0).laneId());
        assertEquals(EmergencySource.AMBULANCE, emergencies.get(0).source());
    }

    @Test
    void neverShowsMoreThanOneNonRedLane() throws Exception {
        SharedLaneState state = new SharedLaneState(4);
        EventBus bus = new EventBus();
        AtomicInteger violations = new AtomicInteger();
        SignalScheduler scheduler = scheduler(state, new CapturingCycleLogger(), bus, TestTimings.fastPolicy());
        bus.subscribe(SignalChanged.class, change -> {
            if (nonRed(scheduler.getAllStates()) > 1) {
                violations.incrementAndGet();
            }
        });
        start(scheduler);

        long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(400);
        int samples = 0;
        while (System.nanoTime() < until) {
            if (nonRed(scheduler.getAllStates()) > 1) {
                violations.incrementAndGet();
            }
            if (++samples % 5_000 == 0) {
                scheduler.forceEmergency(1 + samples / 5_000 % 4);
            }
        }

        assertEquals(0, violations.get());
        assertTrue(scheduler.getStatistics().cycles() > 0);
    }

    @Test
    void cycleFailureRaisesAlertBacksOffAndKeepsRunning() throws Exception {
        EventBus bus = new EventBus((event, error) -> {
            throw new IllegalStateException(error);
        });
        CountDownLatch alerted = new CountDownLatch(1);
        List<AlertRaised> alerts = new CopyOnWriteArrayList<>();
        bus.subscribe(AlertRaised.class, alert -> {
            alerts.add(alert);
            alerted.countDown();
        });
        AtomicBoolean failed = new AtomicBoolean();
        bus.subscribe(SignalChanged.class, change -> {
            if (failed.compareAndSet(false, true)) {
                throw new IllegalStateException("display offline");
            }
        });
        SignalScheduler scheduler = scheduler(new SharedLaneState(2), new CapturingCycleLogger(), bus,
                TestTimings.fastPolicy());
        start(scheduler);

        assertTrue(alerted.await(2, TimeUnit.SECONDS));
        assertEquals("scheduler", alerts.get(0).category());
        assertTrue(alerts.get(0).message().startsWith("Signal cycle failed: "));

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (scheduler.getStatistics().cycles() < 2 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(scheduler.getStatistics().cycles() >= 2);
        assertTrue(nonRed(scheduler.getAllStates()) <= 1);
    }

    @Test
    void stopEndsLoopAndLaterRunOnceIsNoOp() throws Exception {
        CapturingCycleLogger logger = new CapturingCycleLogger();
        SignalScheduler scheduler = scheduler(new SharedLaneState(2), logger, new EventBus(),
                TestTimings.longGreenPolicy());
        start(scheduler);
        Thread.sleep(30);

        scheduler.stop();
        scheduler.stop();

        assertTrue(scheduler.awaitTermination(Duration.ofSeconds(1)));
        assertFalse(scheduler.isRunning());
        int logged = logger.records().size();
        scheduler.runOnce();
        assertEquals(logged, logger.records().size());
        assertThrows(IllegalStateException.class, scheduler::start);
    }

    @Test
    void ambulanceFlagClearedBeforeItIsTakenLetsNormalGreenFinish() {
        FlickeringLaneState state = new FlickeringLaneState(3);
        CapturingCycleLogger logger = new CapturingCycleLogger() {
            @Override
            public void logCycle(int laneId, Map<String, Integer> counts, boolean ambulance, double green, SignalMode mode) {
                state.flickerOnce(2);
                super.logCycle(laneId, counts, ambulance, green, mode);
            }
        };
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        SignalScheduler scheduler = scheduler(state, logger, bus, TestTimings.fastPolicy());

        scheduler.runOnce();

        assertTrue(state.flickered());
        assertTrue(capture.byType(EmergencyTriggered.class).isEmpty());
        assertEquals(List.of(1), logger.records().stream().map(PhaseRecord::laneId).toList());
        ControllerStatistics stats = scheduler.getStatistics();
        assertEquals(1, stats.cycles());
        assertEquals(0.045, stats.cumulativeWaitSavedSeconds(), 1e-9);
        assertEquals(2, scheduler.currentLane());
        assertEquals(SignalMode.NORMAL, scheduler.mode());
    }

    @Test
    void ambulanceFlagClearedBeforeItIsTakenKeepsEmergencyGreenForFullDuration() {
        FlickeringLaneState state = new FlickeringLaneState(4);
        CapturingCycleLogger logger = new CapturingCycleLogger() {
            @Override
            public void logCycle(int laneId, Map<String, Integer> counts, boolean ambulance, double green, SignalMode mode) {
                state.flickerOnce(3);
                super.logCycle(laneId, counts, ambulance, green, mode);
            }
        };
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        SignalTimings timings = new SignalTimings(
                Duration.ofMillis(2),
                Duration.ofMillis(2),
                Duration.ofMillis(200),
                Duration.ofMillis(20),
                Duration.ofMillis(5)
        );
        SignalScheduler scheduler = new SignalScheduler(state, logger, bus, CLOCK, timings, TestTimings.fastPolicy());
        scheduler.forceEmergency(2);

        long begin = System.nanoTime();
        scheduler.runOnce();
        long tookMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

        assertTrue(state.flickered());
        assertTrue(tookMillis >= 190, "emergency green ended after " + tookMillis + "ms");
        assertEquals(List.of(2), capture.byType(EmergencyTriggered.class).stream()
                .map(EmergencyTriggered::laneId).toList());
        assertEquals(1, scheduler.getStatistics().cycles());
        assertEquals(3, scheduler.currentLane());
    }

    @Test
    void interruptStopsSchedulerAndLaterRunOnceIsNoOp() throws Exception {
        CapturingCycleLogger logger = new CapturingCycleLogger();
        SignalScheduler scheduler = scheduler(new SharedLaneState(2), logger, new EventBus(),
                TestTimings.longGreenPolicy());
        Thread cycle = new Thread(scheduler::runOnce, "interrupted-cycle");
        cycle.start();
        Thread.sleep(50);

        cycle.interrupt();
        cycle.join(2_000);

        assertFalse(cycle.isAlive());
        scheduler.runOnce();
        assertEquals(1, logger.records().size());
        assertEquals(0, scheduler.getStatistics().cycles());
        assertEquals(1, scheduler.currentLane());
    }

    private void start(SignalScheduler scheduler) {
        started.add(scheduler);
        scheduler.start();
    }

    private static SignalScheduler scheduler(
            SharedLaneState state,
            CapturingCycleLogger logger,
            EventBus bus,
            GreenTimePolicy policy
    ) {
        return new SignalScheduler(state, logger, bus, CLOCK, TestTimings.fast(), policy);
    }

    private static long nonRed(Map<Integer, SignalState> states) {
        return states.values().stream().filter(state -> state != SignalState.RED).count();
    }

    /**
     * Reports an ambulance on one lane for exactly one read, then falls back to the published slot.
     */
    private static final class FlickeringLaneState extends SharedLaneState {
        private final AtomicInteger flickerLane = new AtomicInteger();
        private final AtomicBoolean flickered = new AtomicBoolean();

        FlickeringLaneState(int laneCount) {
            super(laneCount);
        }

        void flickerOnce(int laneId) {
            if (!flickered.get()) {
                flickerLane.compareAndSet(0, laneId);
            }
        }

        boolean flickered() {
            return flickered.get();
        }

        @Override
        public Optional<LaneSnapshot> get(int laneId) {
            if (flickerLane.compareAndSet(laneId, 0)) {
                flickered.set(true);
                return Optional.of(new LaneSnapshot(laneId, Map.of(), true, CLOCK.instant()));
            }
            return super.get(laneId);
        }
    }
}
