package com.phillippitts.heartbeat.presentation.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Body of {@code POST /api/services}. An absent or blank id lets the registry generate one.
 */
public record RegisterServiceRequest(
        @NotBlank String name,
        String id,
        Map<String, Object> metadata
) {}
