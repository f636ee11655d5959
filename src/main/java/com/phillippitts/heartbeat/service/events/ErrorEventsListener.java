package com.phillippitts.heartbeat.service.events;

import com.phillippitts.heartbeat.service.notification.event.NotificationFailedEvent;
import com.phillippitts.heartbeat.service.storage.event.StorageFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Operator-facing summary of contained collaborator failures.
 *
 * <p>The dispatcher and storage gateway already log each failure; this listener adds one
 * actionable line per failing notifier or storage operation per minute, so a backend that stays
 * down across many heartbeats does not flood the log.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final ConcurrentMap<String, Instant> lastLogged = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onNotificationFailed(NotificationFailedEvent e) {
        if (shouldLog("notifier-" + e.notifier())) {
            LOG.warn("Notifier '{}' is failing (latest: service={}, reason={}). "
                    + "Check heartbeat.notifier.* settings and connectivity.", e.notifier(), e.serviceId(), e.reason());
        }
    }

    @EventListener
    void onStorageFailed(StorageFailedEvent e) {
        if (shouldLog("storage-" + e.operation())) {
            LOG.warn("Storage {} is failing (latest: service={}, reason={}). "
                    + "Registry state is kept in memory only until the backend recovers.",
                    e.operation(), e.serviceId(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        AtomicBoolean log = new AtomicBoolean();
        lastLogged.compute(key, (k, prev) -> {
            if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
                log.set(true);
                return now;
            }
            return prev;
        });
        return log.get();
    }
}
