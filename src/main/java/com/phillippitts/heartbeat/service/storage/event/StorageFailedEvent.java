package com.phillippitts.heartbeat.service.storage.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Published when a storage operation fails, times out or returns false.
 *
 * @param operation which call failed: {@code connect}, {@code storeHeartbeat}, {@code storeError}
 * @param serviceId affected service (nullable)
 * @param reason    short technical reason
 * @param at        when the failure was observed
 */
public record StorageFailedEvent(String operation, String serviceId, String reason, Instant at) {
    public StorageFailedEvent {
        Objects.requireNonNull(at, "at");
    }
}
