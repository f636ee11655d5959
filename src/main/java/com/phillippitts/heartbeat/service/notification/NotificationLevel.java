package com.phillippitts.heartbeat.service.notification;

import com.phillippitts.heartbeat.domain.HeartbeatStatus;

/**
 * Severity attached to a transition notification.
 */
public enum NotificationLevel {
    INFO,
    SUCCESS,
    WARNING,
    ERROR;

    /**
     * HEALTHY maps to SUCCESS; STALE and ERROR to ERROR; everything else to WARNING.
     */
    public static NotificationLevel forStatus(HeartbeatStatus status) {
        return switch (status) {
            case HEALTHY -> SUCCESS;
            case ERROR, STALE -> ERROR;
            case UNKNOWN, BUSY, WARNING -> WARNING;
        };
    }
}
