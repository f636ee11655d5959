package com.phillippitts.heartbeat.exception;

/**
 * Thrown when an externally supplied status value is not one of the known heartbeat statuses.
 */
public class InvalidStatusException extends HeartbeatException {

    private final String value;

    public InvalidStatusException(String value) {
        super("Invalid heartbeat status: '" + value + "'");
        this.value = value;
    }

    /**
     * @return the rejected raw value (may be null)
     */
    public String getValue() {
        return value;
    }
}
