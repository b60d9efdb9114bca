package com.trafficsentinel.service;

import com.trafficsentinel.core.bus.EventBus;
import com.trafficsentinel.core.events.AlertRaised;
import com.trafficsentinel.core.events.EmergencyTriggered;
import com.trafficsentinel.core.state.SharedLaneState;
import com.trafficsentinel.monitors.detect.ScriptedDetector;
import com.trafficsentinel.monitors.lane.LaneMonitor;
import com.trafficsentinel.monitors.video.GrabberVideoSource;
import com.trafficsentinel.service.api.ApiServer;
import com.trafficsentinel.service.config.ConfigLoader;
import com.trafficsentinel.service.config.LaneConfig;
import com.trafficsentinel.service.config.SystemConfig;
import com.trafficsentinel.service.runtime.GreenTimePolicy;
import com.trafficsentinel.service.runtime.SignalScheduler;
import com.trafficsentinel.service.runtime.StartupReport;
import com.trafficsentinel.service.runtime.StopReport;
import com.trafficsentinel.service.runtime.TrafficSystem;
import com.trafficsentinel.service.store.AsyncCycleLogger;
import com.trafficsentinel.service.store.JsonlPhaseLogStore;
import com.trafficsentinel.service.store.PhaseLogAnalytics;
import org.bytedeco.javacv.Frame;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        Path configDir = Path.of(args.length > 0 ? args[0] : "config");
        SystemConfig config = ConfigLoader.loadSystem(configDir);
        Clock clock = Clock.systemDefaultZone();

        EventBus eventBus = new EventBus();
        eventBus.subscribe(AlertRaised.class, alert -> LOGGER.warning("[" + alert.category() + "] " + alert.message()));
        eventBus.subscribe(EmergencyTriggered.class, event -> LOGGER.warning(
                "Emergency green for lane " + event.laneId() + " (" + event.source() + ")"));

        SharedLaneState laneState = new SharedLaneState(config.lanes().size());
        JsonlPhaseLogStore phaseLogStore = new JsonlPhaseLogStore(Path.of(config.phaseLogFile()));
        AsyncCycleLogger cycleLogger = new AsyncCycleLogger(phaseLogStore, eventBus, clock);

        List<LaneMonitor<?>> monitors = new ArrayList<>();
        for (LaneConfig lane : config.lanes()) {
            LaneMonitor<Frame> monitor = new LaneMonitor<>(
                    lane.laneId(),
                    lane.source(),
                    new GrabberVideoSource(config.monitor().frameWidth(), config.monitor().frameHeight()),
                    ScriptedDetector.<Frame>fromFile(
                            resolveScript(configDir, lane, config.detector().script()),
                            config.detector().confidence()
                    ),
                    laneState,
                    clock,
                    config.monitor().minIterationDelay()
            );
            monitors.add(monitor);
        }

        GreenTimePolicy greenTimePolicy = config.greenTime().toPolicy();
        SignalScheduler scheduler = new SignalScheduler(
                laneState,
                cycleLogger,
                eventBus,
                clock,
                config.timings(),
                greenTimePolicy
        );
        TrafficSystem trafficSystem = new TrafficSystem(monitors, scheduler, laneState, cycleLogger, eventBus, clock);
        ApiServer apiServer = new ApiServer(
                config.apiPort(),
                trafficSystem,
                phaseLogStore,
                new PhaseLogAnalytics(phaseLogStore, clock, greenTimePolicy.fixedCycleGreen())
        );

        StartupReport startup = trafficSystem.start();
        if (!startup.allStarted()) {
            LOGGER.warning("Lanes without video: " + startup.failedLanes());
        }
        apiServer.start();
        LOGGER.info("API listening on port " + apiServer.actualPort());

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            apiServer.stop();
            StopReport report = trafficSystem.stop(config.monitor().stopTimeout());
            if (!report.clean()) {
                LOGGER.warning("Shutdown abandoned " + report.unstoppedWorkers());
            }
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    private static Path resolveScript(Path configDir, LaneConfig lane, String defaultScript) {
        String script = lane.script() != null ? lane.script() : defaultScript;
        if (script == null || script.isBlank()) {
            throw new IllegalStateException("Lane " + lane.laneId() + " has no detection script configured");
        }
        return configDir.resolve(script);
    }
}
