package com.phillippitts.heartbeat.service.registry;

import com.phillippitts.heartbeat.domain.HeartbeatStatus;
import com.phillippitts.heartbeat.domain.RegistrySummary;
import com.phillippitts.heartbeat.domain.ServiceSnapshot;
import com.phillippitts.heartbeat.exception.DuplicateServiceException;
import com.phillippitts.heartbeat.exception.InvalidStatusException;
import com.phillippitts.heartbeat.exception.ServiceNotFoundException;

import java.util.List;
import java.util.Map;

/**
 * Authoritative registry of monitored services.
 *
 * <p>All operations are atomic per service id. Operations on different ids never block each other,
 * and collaborator I/O (storage, notifiers) never blocks readers.
 */
public interface ServiceRegistry {

    /**
     * Registers a new service with status {@link HeartbeatStatus#UNKNOWN}.
     *
     * @param name     human-readable label (not blank)
     * @param id       explicit id, or null/blank to generate one
     * @param metadata initial metadata (nullable)
     * @return the final service id
     * @throws DuplicateServiceException if an explicit id is already registered
     * @throws IllegalArgumentException  if name is blank
     */
    String register(String name, String id, Map<String, ?> metadata);

    default String register(String name) {
        return register(name, null, null);
    }

    /**
     * Records a heartbeat and returns the service as it is right after the update.
     *
     * @throws ServiceNotFoundException if id is not registered
     * @throws InvalidStatusException   if status is null
     */
    ServiceSnapshot heartbeat(String id, HeartbeatStatus status, String message, Map<String, ?> metadata);

    /**
     * Parses a raw status value before touching the registry.
     *
     * @throws InvalidStatusException   if status is not a known status (nothing is recorded)
     * @throws ServiceNotFoundException if id is not registered
     */
    default ServiceSnapshot heartbeat(String id, String status, String message, Map<String, ?> metadata) {
        return heartbeat(id, HeartbeatStatus.parse(status), message, metadata);
    }

    default ServiceSnapshot heartbeat(String id, HeartbeatStatus status) {
        return heartbeat(id, status, null, null);
    }

    /**
     * @throws ServiceNotFoundException if id is not registered
     */
    ServiceSnapshot get(String id);

    /** All services; no ordering guarantee. */
    List<ServiceSnapshot> list();

    /** Total and per-status counts over all services. */
    RegistrySummary summary();
}
