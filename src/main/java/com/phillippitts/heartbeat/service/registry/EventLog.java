package com.phillippitts.heartbeat.service.registry;

import com.phillippitts.heartbeat.domain.HeartbeatEvent;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded, append-only history of heartbeat events for one service.
 *
 * <p>Keeps the most recent {@code capacity} events in append order; older events are dropped
 * from the head and are never mutated. Not thread-safe: the owning {@link ServiceRecord}
 * guards every access with its state lock.
 */
final class EventLog {

    private final int capacity;
    private final Deque<HeartbeatEvent> events;

    EventLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(Math.min(capacity, 128));
    }

    void append(HeartbeatEvent event) {
        events.addLast(Objects.requireNonNull(event, "event"));
        while (events.size() > capacity) {
            events.removeFirst();
        }
    }

    List<HeartbeatEvent> toList() {
        return List.copyOf(events);
    }
}
