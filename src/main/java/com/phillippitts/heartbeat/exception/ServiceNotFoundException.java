package com.phillippitts.heartbeat.exception;

/**
 * Thrown when a heartbeat or lookup references a service id that was never registered.
 */
public class ServiceNotFoundException extends HeartbeatException {

    private final String serviceId;

    public ServiceNotFoundException(String serviceId) {
        super("Service not found: " + serviceId);
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }
}
