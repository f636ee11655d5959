package com.phillippitts.heartbeat.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate view over all registered services: total count and a count per status.
 *
 * @param total        number of registered services
 * @param statusCounts count per status; every status is present, zero when unused
 */
public record RegistrySummary(int total, Map<HeartbeatStatus, Long> statusCounts) {

    public RegistrySummary {
        EnumMap<HeartbeatStatus, Long> counts = new EnumMap<>(HeartbeatStatus.class);
        for (HeartbeatStatus s : HeartbeatStatus.values()) {
            counts.put(s, 0L);
        }
        if (statusCounts != null) {
            counts.putAll(statusCounts);
        }
        statusCounts = Collections.unmodifiableMap(counts);
    }

    public long count(HeartbeatStatus status) {
        return statusCounts.get(status);
    }
}
