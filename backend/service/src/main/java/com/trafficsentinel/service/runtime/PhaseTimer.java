package com.trafficsentinel.service.runtime;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Timed signal phase wait that can be cut short. A wait ends at its deadline, when the preemption
 * check turns true, or when the timer is stopped. {@link #wake()} forces an immediate recheck; the
 * check also runs at least once per poll interval, which bounds preemption latency for sources that
 * do not call {@code wake()}. Interrupting a waiting thread stops the timer for good.
 */
final class PhaseTimer {
    enum Outcome {
        ELAPSED,
        PREEMPTED,
        STOPPED
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeup = lock.newCondition();
    private final long pollIntervalNanos;
    private volatile boolean stopped;
    private long generation;

    PhaseTimer(Duration pollInterval) {
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.pollIntervalNanos = pollInterval.toNanos();
    }

    Outcome await(Duration duration, BooleanSupplier preemptCheck) {
        long deadline = System.nanoTime() + duration.toNanos();
        while (true) {
            long observedGeneration = currentGeneration();
            if (stopped) {
                return Outcome.STOPPED;
            }
            if (preemptCheck.getAsBoolean()) {
                return Outcome.PREEMPTED;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Outcome.ELAPSED;
            }
            lock.lock();
            try {
                if (generation == observedGeneration && !stopped) {
                    wakeup.awaitNanos(Math.min(remaining, pollIntervalNanos));
                }
            } catch (InterruptedException e) {
                // an interrupted owner is shutting down; later waits must not block again
                stopped = true;
                Thread.currentThread().interrupt();
                return Outcome.STOPPED;
            } finally {
                lock.unlock();
            }
        }
    }

    Outcome sleep(Duration duration) {
        return await(duration, () -> false);
    }

    void wake() {
        lock.lock();
        try {
            generation++;
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void stop() {
        stopped = true;
        wake();
    }

    boolean isStopped() {
        return stopped;
    }

    private long currentGeneration() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }
}
