package com.phillippitts.heartbeat.service.notification.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Published when a notifier fails to deliver a transition notification.
 *
 * <p>Contains technical diagnostics only; never the service metadata.
 */
public record NotificationFailedEvent(String notifier, String serviceId, String reason, Instant at) {
    public NotificationFailedEvent {
        Objects.requireNonNull(at, "at");
    }
}
