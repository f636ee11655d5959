package com.phillippitts.heartbeat.service.registry;

import com.phillippitts.heartbeat.domain.HeartbeatEvent;
import com.phillippitts.heartbeat.domain.HeartbeatStatus;
import com.phillippitts.heartbeat.domain.ServiceSnapshot;
import com.phillippitts.heartbeat.util.MetadataMaps;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable registry state for one service.
 *
 * <p>Two locks per record:
 * <ul>
 *   <li>{@code stateLock} - short-held, guards every field and the event log. Readers take only
 *       this lock, so they never wait on collaborator I/O.</li>
 *   <li>{@code publishLock} - fair, held by a heartbeat from admission until its storage and
 *       notification calls return, so side effects for one service leave in admission order.</li>
 * </ul>
 * Lock order is always publish then state.
 */
final class ServiceRecord {

    static final String REGISTERED_MESSAGE = "Service registered";

    private final Lock stateLock = new ReentrantLock();
    private final Lock publishLock = new ReentrantLock(true);

    private final String id;
    private final String name;
    private final Instant createdAt;
    private final EventLog events;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private HeartbeatStatus status = HeartbeatStatus.UNKNOWN;
    private String lastMessage;
    private Instant lastHeartbeatAt;

    ServiceRecord(String id, String name, Map<String, ?> metadata, Instant createdAt, int historySize) {
        this.id = id;
        this.name = name;
        this.createdAt = createdAt;
        this.events = new EventLog(historySize);
        if (metadata != null) {
            this.metadata.putAll(metadata);
        }
        this.lastMessage = REGISTERED_MESSAGE;
        this.events.append(new HeartbeatEvent(createdAt, HeartbeatStatus.UNKNOWN, REGISTERED_MESSAGE,
                MetadataMaps.snapshot(metadata)));
    }

    String id() {
        return id;
    }

    Lock publishLock() {
        return publishLock;
    }

    /**
     * Applies one heartbeat atomically and returns the previous status with the resulting snapshot.
     */
    Transition apply(Instant now, HeartbeatStatus newStatus, String message, Map<String, ?> suppliedMetadata) {
        stateLock.lock();
        try {
            HeartbeatStatus previous = status;
            status = newStatus;
            lastMessage = message;
            // Never move backwards if the clock steps back
            if (lastHeartbeatAt == null || now.isAfter(lastHeartbeatAt)) {
                lastHeartbeatAt = now;
            }
            if (suppliedMetadata != null) {
                metadata.putAll(suppliedMetadata);
            }
            events.append(new HeartbeatEvent(lastHeartbeatAt, newStatus, message,
                    MetadataMaps.snapshot(suppliedMetadata)));
            return new Transition(previous, snapshotLocked());
        } finally {
            stateLock.unlock();
        }
    }

    ServiceSnapshot snapshot() {
        stateLock.lock();
        try {
            return snapshotLocked();
        } finally {
            stateLock.unlock();
        }
    }

    private ServiceSnapshot snapshotLocked() {
        return new ServiceSnapshot(id, name, status, lastMessage, metadata,
                lastHeartbeatAt, createdAt, events.toList());
    }

    /**
     * Result of {@link #apply}: the status before the heartbeat and the record afterwards.
     */
    record Transition(HeartbeatStatus previous, ServiceSnapshot snapshot) {
    }
}
