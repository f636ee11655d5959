package com.phillippitts.heartbeat.service.notification;

import com.phillippitts.heartbeat.domain.ServiceSnapshot;

/** Delivers a human-facing alert for a service status transition. */
public interface Notifier {

    /**
     * Send one notification; return true on success.
     * May also signal failure by throwing.
     */
    boolean sendNotification(String title, String message, ServiceSnapshot service, NotificationLevel level);

    /** Name for logs and error records. */
    String name();
}
