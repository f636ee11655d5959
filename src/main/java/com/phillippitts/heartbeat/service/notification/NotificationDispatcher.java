package com.phillippitts.heartbeat.service.notification;

import com.phillippitts.heartbeat.domain.HeartbeatEvent;
import com.phillippitts.heartbeat.domain.HeartbeatStatus;
import com.phillippitts.heartbeat.domain.ServiceSnapshot;
import com.phillippitts.heartbeat.exception.NotifierException;
import com.phillippitts.heartbeat.service.notification.event.NotificationFailedEvent;
import com.phillippitts.heartbeat.service.storage.ErrorRecord;
import com.phillippitts.heartbeat.service.storage.StorageGateway;
import com.phillippitts.heartbeat.service.util.CollaboratorInvoker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decides whether a heartbeat is a notifiable transition and fans out to every {@link Notifier}.
 *
 * <p>Each notifier is called independently through {@link CollaboratorInvoker}. A failing,
 * negative or timed-out notifier is logged, recorded via {@link StorageGateway#storeError} and
 * published as {@link NotificationFailedEvent}; the remaining notifiers are still called and
 * the heartbeat caller never sees the failure.
 */
public class NotificationDispatcher {

    private static final Logger LOG = LogManager.getLogger(NotificationDispatcher.class);

    private final List<Notifier> notifiers;
    private final CollaboratorInvoker invoker;
    private final StorageGateway storage;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public NotificationDispatcher(List<Notifier> notifiers,
                                  CollaboratorInvoker invoker,
                                  StorageGateway storage,
                                  ApplicationEventPublisher publisher,
                                  Clock clock) {
        this.notifiers = List.copyOf(Objects.requireNonNull(notifiers, "notifiers"));
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        LOG.info("Notification dispatcher initialized with notifiers={}",
                this.notifiers.stream().map(Notifier::name).toList());
    }

    /**
     * Every status change is notifiable; repeating the same status (including HEALTHY after
     * HEALTHY) is not.
     */
    public static boolean shouldNotify(HeartbeatStatus previous, HeartbeatStatus current) {
        return previous != current;
    }

    /**
     * Notifies all notifiers if the heartbeat that produced {@code service} changed its status.
     *
     * @param service  snapshot right after the heartbeat
     * @param previous status before the heartbeat
     * @return number of notifiers that delivered successfully (0 when not notifiable)
     */
    public int dispatch(ServiceSnapshot service, HeartbeatStatus previous) {
        if (!shouldNotify(previous, service.status())) {
            return 0;
        }
        String title = title(service);
        String message = message(service, previous);
        NotificationLevel level = NotificationLevel.forStatus(service.status());

        int delivered = 0;
        for (Notifier notifier : notifiers) {
            CollaboratorInvoker.Outcome outcome =
                    invoker.invoke(() -> notifier.sendNotification(title, message, service, level));
            if (outcome.succeeded()) {
                delivered++;
                LOG.debug("Notified via {}: {}", notifier.name(), title);
            } else {
                handleFailure(notifier, service, outcome);
            }
        }
        return delivered;
    }

    static String title(ServiceSnapshot service) {
        return "Service " + service.name() + " is " + service.status();
    }

    static String message(ServiceSnapshot service, HeartbeatStatus previous) {
        StringBuilder sb = new StringBuilder("Status changed from ")
                .append(previous)
                .append(" to ")
                .append(service.status());
        HeartbeatEvent last = service.lastEvent();
        if (last != null && last.message() != null && !last.message().isBlank()) {
            sb.append(": ").append(last.message());
        }
        return sb.toString();
    }

    private void handleFailure(Notifier notifier, ServiceSnapshot service, CollaboratorInvoker.Outcome outcome) {
        NotifierException failure = new NotifierException("Notification failed: " + outcome.reason(),
                notifier.name(), outcome.cause());
        LOG.warn("Notifier {} failed for service {}: {}", notifier.name(), service.id(), failure.getMessage());
        Instant now = clock.instant();

        storage.storeError(new ErrorRecord(
                service.id(),
                "notifier:" + notifier.name(),
                failure.getMessage(),
                now,
                Map.of("status", service.status().name())));
        publisher.publishEvent(new NotificationFailedEvent(notifier.name(), service.id(), outcome.reason(), now));
    }
}
