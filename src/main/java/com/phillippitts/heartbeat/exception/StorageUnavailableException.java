package com.phillippitts.heartbeat.exception;

/**
 * Thrown by a storage backend that cannot connect or persist.
 * Never propagated to heartbeat callers; the registry logs and records it instead.
 */
public class StorageUnavailableException extends HeartbeatException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
