package com.trafficsentinel.core.state;

import com.trafficsentinel.core.model.LaneSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Latest detection result per lane. Each lane owns one slot of a fixed array, so publishing to
 * one lane never contends with another lane or with readers. Snapshots are immutable and replaced
 * whole.
 */
public class SharedLaneState {
    private static final Logger LOGGER = Logger.getLogger(SharedLaneState.class.getName());

    private final AtomicReferenceArray<LaneSnapshot> slots;
    private final CopyOnWriteArrayList<Consumer<LaneSnapshot>> publishListeners = new CopyOnWriteArrayList<>();

    public SharedLaneState(int laneCount) {
        if (laneCount < 1) {
            throw new IllegalArgumentException("laneCount must be at least 1");
        }
        this.slots = new AtomicReferenceArray<>(laneCount);
    }

    public int laneCount() {
        return slots.length();
    }

    public void publish(int laneId, LaneSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot is required");
        if (snapshot.laneId() != laneId) {
            throw new IllegalArgumentException(
                    "Snapshot for lane " + snapshot.laneId() + " cannot be published to lane " + laneId);
        }
        slots.set(slotIndex(laneId), snapshot);
        for (Consumer<LaneSnapshot> listener : publishListeners) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "Publish listener failed for lane " + laneId, ex);
            }
        }
    }

    public Optional<LaneSnapshot> get(int laneId) {
        return Optional.ofNullable(slots.get(slotIndex(laneId)));
    }

    public Map<Integer, LaneSnapshot> getAll() {
        Map<Integer, LaneSnapshot> copy = new LinkedHashMap<>();
        for (int i = 0; i < slots.length(); i++) {
            LaneSnapshot snapshot = slots.get(i);
            if (snapshot != null) {
                copy.put(i + 1, snapshot);
            }
        }
        return copy;
    }

    public void clear(int laneId) {
        slots.set(slotIndex(laneId), null);
    }

    public void addPublishListener(Consumer<LaneSnapshot> listener) {
        publishListeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    private int slotIndex(int laneId) {
        if (laneId < 1 || laneId > slots.length()) {
            throw new IllegalArgumentException("Unknown lane " + laneId + "; expected 1.." + slots.length());
        }
        return laneId - 1;
    }
}
