package com.phillippitts.heartbeat.service.storage;

import com.phillippitts.heartbeat.domain.ServiceSnapshot;
import com.phillippitts.heartbeat.exception.StorageUnavailableException;

import java.util.List;

/**
 * Optional persistence backend for registry state.
 *
 * <p>The registry calls these methods best-effort: a {@code false} result, an exception or a
 * timeout is logged and recorded, never retried and never surfaced to heartbeat callers.
 */
public interface Storage {

    /**
     * Prepares the backend for use. Called once at startup.
     *
     * @throws StorageUnavailableException if the backend cannot be reached
     */
    void connect();

    /** Persist the latest snapshot of a service; return true on success. */
    boolean storeHeartbeat(String serviceId, ServiceSnapshot snapshot);

    /** Record a contained failure (notifier or storage); return true on success. */
    boolean storeError(ErrorRecord error);

    /**
     * Reads recorded failures back, newest first.
     *
     * @param serviceId only errors for this service, or all errors when null
     * @param limit     maximum number of records returned
     * @throws StorageUnavailableException if the backend cannot be read
     */
    List<ErrorRecord> getErrors(String serviceId, int limit);

    /** Name for logs. */
    default String name() {
        return getClass().getSimpleName();
    }
}
