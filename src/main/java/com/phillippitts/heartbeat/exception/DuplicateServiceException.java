package com.phillippitts.heartbeat.exception;

/**
 * Thrown when registration supplies an explicit id that is already taken.
 */
public class DuplicateServiceException extends HeartbeatException {

    private final String serviceId;

    public DuplicateServiceException(String serviceId) {
        super("Service already registered: " + serviceId);
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }
}
