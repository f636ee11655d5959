package com.phillippitts.heartbeat.service.scope;

import com.phillippitts.heartbeat.domain.HeartbeatStatus;
import com.phillippitts.heartbeat.service.registry.ServiceRegistry;

import java.util.Objects;

/**
 * Reports BUSY for the duration of a block of work and a final status when it ends.
 *
 * <p>Opening the scope sends {@link HeartbeatStatus#BUSY}. If {@link #complete()} was called before
 * {@link #close()}, the success status is sent; otherwise the block is treated as failed and the
 * error status is sent. Exceptions from the block propagate unchanged.
 *
 * <pre>{@code
 * try (HeartbeatScope scope = HeartbeatScope.open(registry, serviceId)) {
 *     runBatch();
 *     scope.complete();
 * }
 * }</pre>
 *
 * <p>Not thread-safe; use one scope per block.
 */
public final class HeartbeatScope implements AutoCloseable {

    static final String STARTED_MESSAGE = "Operation started";
    static final String COMPLETED_MESSAGE = "Operation completed";
    static final String FAILED_MESSAGE = "Operation did not complete";

    private final ServiceRegistry registry;
    private final String serviceId;
    private final HeartbeatStatus successStatus;
    private final HeartbeatStatus errorStatus;

    private boolean completed;
    private boolean closed;

    private HeartbeatScope(ServiceRegistry registry, String serviceId,
                           HeartbeatStatus successStatus, HeartbeatStatus errorStatus) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.serviceId = Objects.requireNonNull(serviceId, "serviceId");
        this.successStatus = Objects.requireNonNull(successStatus, "successStatus");
        this.errorStatus = Objects.requireNonNull(errorStatus, "errorStatus");
    }

    /**
     * Opens a scope reporting HEALTHY on success and ERROR on failure.
     */
    public static HeartbeatScope open(ServiceRegistry registry, String serviceId) {
        return open(registry, serviceId, HeartbeatStatus.HEALTHY, HeartbeatStatus.ERROR);
    }

    /**
     * Opens a scope and sends BUSY immediately.
     *
     * @throws com.phillippitts.heartbeat.exception.ServiceNotFoundException if the service is unknown
     */
    public static HeartbeatScope open(ServiceRegistry registry, String serviceId,
                                      HeartbeatStatus successStatus, HeartbeatStatus errorStatus) {
        HeartbeatScope scope = new HeartbeatScope(registry, serviceId, successStatus, errorStatus);
        registry.heartbeat(serviceId, HeartbeatStatus.BUSY, STARTED_MESSAGE, null);
        return scope;
    }

    /** Marks the block as successful; the closing heartbeat will carry the success status. */
    public void complete() {
        completed = true;
    }

    public boolean isCompleted() {
        return completed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (completed) {
            registry.heartbeat(serviceId, successStatus, COMPLETED_MESSAGE, null);
        } else {
            registry.heartbeat(serviceId, errorStatus, FAILED_MESSAGE, null);
        }
    }
}
