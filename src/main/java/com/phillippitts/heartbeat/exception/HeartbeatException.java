package com.phillippitts.heartbeat.exception;

/**
 * Base exception for all heartbeat monitor errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class HeartbeatException extends RuntimeException {

    public HeartbeatException(String message) {
        super(message);
    }

    public HeartbeatException(String message, Throwable cause) {
        super(message, cause);
    }

    public HeartbeatException(Throwable cause) {
        super(cause);
    }
}
