package com.trafficsentinel.monitors.lane;

import com.trafficsentinel.core.model.LaneSnapshot;
import com.trafficsentinel.core.state.SharedLaneState;
import com.trafficsentinel.monitors.api.Detection;
import com.trafficsentinel.monitors.api.Detector;
import com.trafficsentinel.monitors.api.VideoSource;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Free-running detection loop for one lane. Reads frames from its video source, rewinding at end of
 * stream, and publishes every detection as a fresh snapshot into its slot of {@link SharedLaneState}.
 * The video source is closed and the slot cleared on every exit path.
 */
public class LaneMonitor<F> implements Runnable {
    private static final Logger LOGGER = Logger.getLogger(LaneMonitor.class.getName());

    private final int laneId;
    private final String location;
    private final VideoSource<F> source;
    private final Detector<F> detector;
    private final SharedLaneState laneState;
    private final Clock clock;
    private final Duration minIterationDelay;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicBoolean opened = new AtomicBoolean();
    private final AtomicBoolean released = new AtomicBoolean();
    private final LongAdder framesProcessed = new LongAdder();
    private final LongAdder failedFrames = new LongAdder();

    public LaneMonitor(
            int laneId,
            String location,
            VideoSource<F> source,
            Detector<F> detector,
            SharedLaneState laneState,
            Clock clock,
            Duration minIterationDelay
    ) {
        this.laneId = laneId;
        this.location = Objects.requireNonNull(location, "location is required");
        this.source = Objects.requireNonNull(source, "source is required");
        this.detector = Objects.requireNonNull(detector, "detector is required");
        this.laneState = Objects.requireNonNull(laneState, "laneState is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.minIterationDelay = Objects.requireNonNull(minIterationDelay, "minIterationDelay is required");
        if (laneId < 1 || laneId > laneState.laneCount()) {
            throw new IllegalArgumentException("Lane " + laneId + " is outside 1.." + laneState.laneCount());
        }
    }

    public void open() {
        if (!opened.compareAndSet(false, true)) {
            throw new IllegalStateException("Lane " + laneId + " monitor is already open");
        }
        try {
            source.open(location);
        } catch (RuntimeException ex) {
            release();
            throw new IllegalStateException("Lane " + laneId + " failed to open video source " + location, ex);
        }
    }

    @Override
    public void run() {
        if (!opened.get()) {
            throw new IllegalStateException("Lane " + laneId + " monitor must be opened before running");
        }
        LOGGER.info("Lane " + laneId + " monitor started on " + location);
        try {
            while (!stopRequested()) {
                processNextFrame();
                if (!pauseBetweenFrames()) {
                    break;
                }
            }
        } finally {
            release();
            LOGGER.info("Lane " + laneId + " monitor stopped after " + framesProcessed.sum() + " frames");
        }
    }

    void processNextFrame() {
        try {
            Optional<F> frame = source.nextFrame();
            if (frame.isEmpty()) {
                source.rewind();
                return;
            }
            Detection<F> detection = detector.detect(frame.get());
            laneState.publish(laneId, new LaneSnapshot(
                    laneId,
                    detection.counts(),
                    detection.ambulancePresent(),
                    clock.instant()
            ));
            framesProcessed.increment();
        } catch (RuntimeException ex) {
            failedFrames.increment();
            LOGGER.log(Level.WARNING, "Lane " + laneId + " skipped a frame: " + ex.getMessage(), ex);
        }
    }

    public void stop() {
        stopSignal.countDown();
    }

    public boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    public Optional<LaneSnapshot> getSnapshot() {
        return laneState.get(laneId);
    }

    public int laneId() {
        return laneId;
    }

    public String location() {
        return location;
    }

    public Detector<F> detector() {
        return detector;
    }

    public long framesProcessed() {
        return framesProcessed.sum();
    }

    public long failedFrames() {
        return failedFrames.sum();
    }

    private boolean stopRequested() {
        return isStopRequested() || Thread.currentThread().isInterrupted();
    }

    private boolean pauseBetweenFrames() {
        if (minIterationDelay.isZero() || minIterationDelay.isNegative()) {
            return !stopRequested();
        }
        try {
            return !stopSignal.await(minIterationDelay.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            source.close();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Lane " + laneId + " failed closing video source " + location, ex);
        } finally {
            laneState.clear(laneId);
        }
    }
}
