package com.phillippitts.heartbeat.service.storage;

import com.phillippitts.heartbeat.domain.ServiceSnapshot;
import com.phillippitts.heartbeat.service.storage.event.StorageFailedEvent;
import com.phillippitts.heartbeat.service.util.CollaboratorInvoker;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Best-effort front for the optional {@link Storage} backend.
 *
 * <p>Every call runs through {@link CollaboratorInvoker}, so it is bounded by the collaborator
 * timeout. Failures are logged at WARN and published as {@link StorageFailedEvent}; nothing is
 * retried and nothing is thrown to the registry. When no backend is configured all methods
 * are no-ops.
 *
 * <p>If the startup {@link #connect()} fails, the next store attempt first tries to connect
 * again; stores are skipped while the backend stays unreachable.
 */
public class StorageGateway {

    private static final Logger LOG = LogManager.getLogger(StorageGateway.class);

    private final Storage storage;
    private final CollaboratorInvoker invoker;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private volatile boolean connected;

    /**
     * @param storage   backend, or null when persistence is disabled
     * @param invoker   time-bounded executor for backend calls
     * @param publisher event publisher for failure events
     * @param clock     timestamps failure events
     */
    public StorageGateway(Storage storage, CollaboratorInvoker invoker, ApplicationEventPublisher publisher,
                          Clock clock) {
        this.storage = storage;
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static StorageGateway disabled(CollaboratorInvoker invoker, ApplicationEventPublisher publisher,
                                          Clock clock) {
        return new StorageGateway(null, invoker, publisher, clock);
    }

    public boolean isConfigured() {
        return storage != null;
    }

    public boolean isConnected() {
        return connected;
    }

    @PostConstruct
    void initialize() {
        connect();
    }

    /**
     * Connects the backend. Called once at startup; safe to call again.
     *
     * @return true when connected (or nothing to connect)
     */
    public boolean connect() {
        if (storage == null) {
            LOG.info("No storage backend configured; registry state is in-memory only");
            return true;
        }
        CollaboratorInvoker.Outcome outcome = invoker.invoke(() -> {
            storage.connect();
            return true;
        });
        connected = outcome.succeeded();
        if (connected) {
            LOG.info("Storage backend {} connected", storage.name());
        } else {
            fail("connect", null, outcome);
        }
        return connected;
    }

    /** Persists a snapshot; failures are contained. */
    public boolean storeHeartbeat(ServiceSnapshot snapshot) {
        if (!ensureConnected()) {
            return false;
        }
        CollaboratorInvoker.Outcome outcome = invoker.invoke(() -> storage.storeHeartbeat(snapshot.id(), snapshot));
        if (!outcome.succeeded()) {
            fail("storeHeartbeat", snapshot.id(), outcome);
        }
        return outcome.succeeded();
    }

    /** Records an error entry; failures are logged only. */
    public boolean storeError(ErrorRecord error) {
        if (!ensureConnected()) {
            return false;
        }
        CollaboratorInvoker.Outcome outcome = invoker.invoke(() -> storage.storeError(error));
        if (!outcome.succeeded()) {
            fail("storeError", error.serviceId(), outcome);
        }
        return outcome.succeeded();
    }

    /**
     * Reads recorded errors back, newest first. Returns an empty list when no backend is
     * configured or the read fails; a failed read is handled like a failed store.
     */
    public List<ErrorRecord> errors(String serviceId, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got: " + limit);
        }
        if (!ensureConnected()) {
            return List.of();
        }
        AtomicReference<List<ErrorRecord>> result = new AtomicReference<>(List.of());
        CollaboratorInvoker.Outcome outcome = invoker.invoke(() -> {
            result.set(List.copyOf(storage.getErrors(serviceId, limit)));
            return true;
        });
        if (!outcome.succeeded()) {
            fail("getErrors", serviceId, outcome);
            return List.of();
        }
        return result.get();
    }

    private boolean ensureConnected() {
        if (storage == null) {
            return false;
        }
        return connected || connect();
    }

    private void fail(String operation, String serviceId, CollaboratorInvoker.Outcome outcome) {
        LOG.warn("Storage {} failed: backend={}, serviceId={}, reason={}",
                operation, storage.name(), serviceId, outcome.reason());
        if (outcome.cause() != null) {
            LOG.debug("Storage {} failure cause", operation, outcome.cause());
        }
        publisher.publishEvent(new StorageFailedEvent(operation, serviceId, outcome.reason(), clock.instant()));
    }
}
