package com.phillippitts.heartbeat.service.notification;

import com.phillippitts.heartbeat.domain.ServiceSnapshot;
import com.phillippitts.heartbeat.util.LogSanitizer;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/** Log-only notifier (no network). Always available. */
@Component
class LoggingNotifier implements Notifier {
    private static final Logger LOG = LogManager.getLogger(LoggingNotifier.class);

    @Override
    public boolean sendNotification(String title, String message, ServiceSnapshot service, NotificationLevel level) {
        LOG.log(toLogLevel(level), "{} - {} (id={})", title, LogSanitizer.truncate(message, 200), service.id());
        return true;
    }

    @Override
    public String name() {
        return "log";
    }

    static Level toLogLevel(NotificationLevel level) {
        return switch (level) {
            case ERROR -> Level.ERROR;
            case WARNING -> Level.WARN;
            case INFO, SUCCESS -> Level.INFO;
        };
    }
}
