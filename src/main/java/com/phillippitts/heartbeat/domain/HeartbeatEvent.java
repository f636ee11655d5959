package com.phillippitts.heartbeat.domain;

import com.phillippitts.heartbeat.util.MetadataMaps;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable entry in a service's event history, appended on every status-affecting call.
 *
 * @param timestamp when the registry admitted the heartbeat
 * @param status    status carried by the heartbeat
 * @param message   optional free-text note (nullable)
 * @param metadata  metadata supplied with this call only (empty when none)
 */
public record HeartbeatEvent(
        Instant timestamp,
        HeartbeatStatus status,
        String message,
        Map<String, Object> metadata
) {

    public HeartbeatEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(status, "status");
        metadata = MetadataMaps.snapshot(metadata);
    }
}
