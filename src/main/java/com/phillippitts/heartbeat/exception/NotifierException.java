package com.phillippitts.heartbeat.exception;

/**
 * Thrown when a notifier fails to deliver (exception, negative result, or timeout).
 * Contained by the notification dispatcher.
 */
public class NotifierException extends HeartbeatException {

    private final String notifierName;

    public NotifierException(String message, String notifierName) {
        super(message + " (notifier: " + notifierName + ")");
        this.notifierName = notifierName;
    }

    public NotifierException(String message, String notifierName, Throwable cause) {
        super(message + " (notifier: " + notifierName + ")", cause);
        this.notifierName = notifierName;
    }

    public String getNotifierName() {
        return notifierName;
    }
}
