package com.phillippitts.heartbeat.service.storage;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A contained collaborator failure, as recorded through {@link Storage#storeError(ErrorRecord)}.
 *
 * @param serviceId service the failure relates to (nullable for global failures)
 * @param source    where it happened, e.g. {@code notifier:webhook}
 * @param message   failure description
 * @param timestamp when it happened
 * @param context   extra technical diagnostics
 */
public record ErrorRecord(
        String serviceId,
        String source,
        String message,
        Instant timestamp,
        Map<String, String> context
) {
    public ErrorRecord {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(timestamp, "timestamp");
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
