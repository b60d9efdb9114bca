package com.trafficsentinel.service.store;

import com.trafficsentinel.core.bus.EventBus;
import com.trafficsentinel.core.events.AlertRaised;
import com.trafficsentinel.core.model.PhaseRecord;
import com.trafficsentinel.core.model.SignalMode;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Logger;

/**
 * Writes phase records on a single background thread so a slow or failing store never holds up a
 * signal phase. Records that cannot be queued or written are dropped and counted.
 */
public class AsyncCycleLogger implements CycleLogger {
    private static final Logger LOGGER = Logger.getLogger(AsyncCycleLogger.class.getName());

    private final PhaseLogStore store;
    private final EventBus eventBus;
    private final Clock clock;
    private final Duration closeTimeout;
    private final ThreadPoolExecutor writer;
    private final LongAdder dropped = new LongAdder();
    private final LongAdder written = new LongAdder();

    public AsyncCycleLogger(PhaseLogStore store, EventBus eventBus, Clock clock) {
        this(store, eventBus, clock, 256, Duration.ofSeconds(5));
    }

    public AsyncCycleLogger(PhaseLogStore store, EventBus eventBus, Clock clock, int queueCapacity, Duration closeTimeout) {
        this.store = store;
        this.eventBus = eventBus;
        this.clock = clock;
        this.closeTimeout = closeTimeout;
        this.writer = new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "phase-log-writer");
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Override
    public void logCycle(
            int laneId,
            Map<String, Integer> countsByClass,
            boolean ambulancePresent,
            double greenDurationSeconds,
            SignalMode mode
    ) {
        PhaseRecord record = new PhaseRecord(
                clock.instant(),
                laneId,
                countsByClass,
                ambulancePresent,
                greenDurationSeconds,
                mode
        );
        try {
            writer.execute(() -> write(record));
        } catch (RejectedExecutionException ex) {
            drop(record, writer.isShutdown() ? "logger closed" : "write queue full");
        }
    }

    @Override
    public long droppedRecords() {
        return dropped.sum();
    }

    public long writtenRecords() {
        return written.sum();
    }

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(closeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                int abandoned = writer.shutdownNow().size();
                dropped.add(abandoned);
                LOGGER.warning("Phase log writer did not drain in time; dropped " + abandoned + " records");
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void write(PhaseRecord record) {
        try {
            store.append(record);
            written.increment();
        } catch (RuntimeException ex) {
            drop(record, ex.getMessage());
        }
    }

    private void drop(PhaseRecord record, String reason) {
        dropped.increment();
        LOGGER.warning("Dropped phase record for lane " + record.laneId() + ": " + reason);
        eventBus.publish(new AlertRaised(
                clock.instant(),
                "phase-log",
                "Dropped phase record for lane " + record.laneId() + ": " + reason,
                Map.of("lane", record.laneId())
        ));
    }
}
