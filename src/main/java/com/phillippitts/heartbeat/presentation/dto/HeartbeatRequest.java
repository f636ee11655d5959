package com.phillippitts.heartbeat.presentation.dto;

import java.util.Map;

/**
 * Body of {@code POST /api/services/{id}/heartbeat}. Every field is optional; the status
 * defaults to HEALTHY.
 */
public record HeartbeatRequest(String status, String message, Map<String, Object> metadata) {

    static final String DEFAULT_STATUS = "HEALTHY";

    public String statusOrDefault() {
        return status == null ? DEFAULT_STATUS : status;
    }
}
