package com.phillippitts.heartbeat.service.registry;

import com.phillippitts.heartbeat.config.properties.HeartbeatProperties;
import com.phillippitts.heartbeat.domain.HeartbeatStatus;
import com.phillippitts.heartbeat.domain.RegistrySummary;
import com.phillippitts.heartbeat.domain.ServiceSnapshot;
import com.phillippitts.heartbeat.exception.DuplicateServiceException;
import com.phillippitts.heartbeat.exception.InvalidStatusException;
import com.phillippitts.heartbeat.exception.ServiceNotFoundException;
import com.phillippitts.heartbeat.service.notification.NotificationDispatcher;
import com.phillippitts.heartbeat.service.storage.StorageGateway;
import com.phillippitts.heartbeat.util.LogSanitizer;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link ServiceRegistry} with per-service locking.
 *
 * <p><b>Heartbeat path:</b>
 * <ol>
 *   <li>take the service's publish lock (orders side effects per service)</li>
 *   <li>apply status, message, metadata merge and event append under the state lock</li>
 *   <li>persist the snapshot via {@link StorageGateway} (best-effort, time-bounded)</li>
 *   <li>hand the snapshot and previous status to {@link NotificationDispatcher}</li>
 * </ol>
 * Storage and notifier failures are contained in steps 3 and 4; only
 * {@link ServiceNotFoundException}, {@link DuplicateServiceException} and
 * {@link InvalidStatusException} reach callers.
 *
 * <p>The stale sweep uses the same {@link #heartbeat} entry point, so synthetic STALE updates go
 * through identical event and notification handling.
 */
@Service
public class DefaultServiceRegistry implements ServiceRegistry {

    private static final Logger LOG = LogManager.getLogger(DefaultServiceRegistry.class);

    private final ConcurrentMap<String, ServiceRecord> services = new ConcurrentHashMap<>();
    private final HeartbeatProperties props;
    private final Clock clock;
    private final StorageGateway storage;
    private final NotificationDispatcher dispatcher;

    public DefaultServiceRegistry(HeartbeatProperties props,
                                  Clock clock,
                                  StorageGateway storage,
                                  NotificationDispatcher dispatcher) {
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    @Override
    public String register(String name, String id, Map<String, ?> metadata) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Service name must not be blank");
        }
        boolean explicitId = id != null && !id.isBlank();
        String serviceId = explicitId ? id.trim() : UUID.randomUUID().toString();

        ServiceRecord record = new ServiceRecord(serviceId, name.trim(), metadata,
                clock.instant(), props.getEventHistorySize());
        // Hold the publish lock before the record becomes visible so the registration
        // snapshot is persisted before any heartbeat for the same id.
        record.publishLock().lock();
        try {
            while (services.putIfAbsent(serviceId, record) != null) {
                if (explicitId) {
                    throw new DuplicateServiceException(serviceId);
                }
                serviceId = UUID.randomUUID().toString();
                record = rebind(record, serviceId, name.trim(), metadata);
            }
            try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("serviceId", serviceId)) {
                LOG.info("Registered service name='{}', id={}", LogSanitizer.truncate(name, 120), serviceId);
                storage.storeHeartbeat(record.snapshot());
            }
            return serviceId;
        } finally {
            record.publishLock().unlock();
        }
    }

    @Override
    public ServiceSnapshot heartbeat(String id, HeartbeatStatus status, String message, Map<String, ?> metadata) {
        if (status == null) {
            throw new InvalidStatusException(null);
        }
        ServiceRecord record = find(id);

        record.publishLock().lock();
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("serviceId", id)) {
            ServiceRecord.Transition transition = record.apply(clock.instant(), status, message, metadata);
            ServiceSnapshot snapshot = transition.snapshot();
            if (transition.previous() != status) {
                LOG.info("Service {} status {} -> {}", id, transition.previous(), status);
            } else {
                LOG.debug("Heartbeat for {} status={}", id, status);
            }

            storage.storeHeartbeat(snapshot);
            dispatcher.dispatch(snapshot, transition.previous());
            return snapshot;
        } finally {
            record.publishLock().unlock();
        }
    }

    @Override
    public ServiceSnapshot get(String id) {
        return find(id).snapshot();
    }

    @Override
    public List<ServiceSnapshot> list() {
        List<ServiceSnapshot> result = new ArrayList<>(services.size());
        for (ServiceRecord record : services.values()) {
            result.add(record.snapshot());
        }
        return result;
    }

    @Override
    public RegistrySummary summary() {
        Map<HeartbeatStatus, Long> counts = new EnumMap<>(HeartbeatStatus.class);
        List<ServiceSnapshot> all = list();
        for (ServiceSnapshot s : all) {
            counts.merge(s.status(), 1L, Long::sum);
        }
        return new RegistrySummary(all.size(), counts);
    }

    private ServiceRecord find(String id) {
        ServiceRecord record = id == null ? null : services.get(id);
        if (record == null) {
            throw new ServiceNotFoundException(id);
        }
        return record;
    }

    /** Replaces a record that lost a generated-id collision; keeps the caller holding a publish lock. */
    private ServiceRecord rebind(ServiceRecord lost, String newId, String name, Map<String, ?> metadata) {
        lost.publishLock().unlock();
        ServiceRecord fresh = new ServiceRecord(newId, name, metadata, clock.instant(), props.getEventHistorySize());
        fresh.publishLock().lock();
        return fresh;
    }
}
