package com.phillippitts.heartbeat.domain;

import com.phillippitts.heartbeat.exception.InvalidStatusException;

import java.util.Locale;

/**
 * Closed set of health states a service can report or be assigned.
 *
 * <p>Only equality matters for transition detection; {@link #HEALTHY} is the single nominal state.
 */
public enum HeartbeatStatus {
    UNKNOWN,
    HEALTHY,
    BUSY,
    WARNING,
    ERROR,
    STALE;

    /**
     * Parses an externally supplied status, ignoring case and surrounding whitespace.
     *
     * @param value raw status value, e.g. {@code "healthy"}
     * @return matching status
     * @throws InvalidStatusException if value is null, blank, or not a known status
     */
    public static HeartbeatStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidStatusException(value);
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidStatusException(value);
        }
    }
}
