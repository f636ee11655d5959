package com.phillippitts.heartbeat.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copies open-ended metadata maps into immutable snapshots.
 *
 * <p>Unlike {@link Map#copyOf(Map)}, null values supplied by callers are preserved.
 */
public final class MetadataMaps {

    private MetadataMaps() {
        // Utility class - prevent instantiation
    }

    /**
     * @param source map to copy (may be null)
     * @return unmodifiable insertion-ordered copy; empty map for null input
     */
    public static Map<String, Object> snapshot(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
