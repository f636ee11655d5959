package com.phillippitts.heartbeat.domain;

import com.phillippitts.heartbeat.util.MetadataMaps;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time, immutable copy of a registered service's record.
 *
 * <p>This is what the registry hands to callers, storage backends and notifiers; it never
 * changes after creation even if the service keeps reporting.
 *
 * @param id              unique service identifier
 * @param name            human-readable label
 * @param status          current status (equals the status of the last event)
 * @param lastMessage     message of the most recent event (nullable)
 * @param metadata        merged metadata
 * @param lastHeartbeatAt most recent heartbeat time, null until the first heartbeat
 * @param createdAt       registration time
 * @param events          event history, oldest first
 */
public record ServiceSnapshot(
        String id,
        String name,
        HeartbeatStatus status,
        String lastMessage,
        Map<String, Object> metadata,
        Instant lastHeartbeatAt,
        Instant createdAt,
        List<HeartbeatEvent> events
) {

    public ServiceSnapshot {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        metadata = MetadataMaps.snapshot(metadata);
        events = events == null ? List.of() : List.copyOf(events);
    }

    /**
     * @return the most recently appended event, or null if the history is empty
     */
    public HeartbeatEvent lastEvent() {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }
}
