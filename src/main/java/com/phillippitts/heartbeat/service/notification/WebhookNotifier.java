package com.phillippitts.heartbeat.service.notification;

import com.phillippitts.heartbeat.config.notifier.WebhookNotifierProperties;
import com.phillippitts.heartbeat.domain.ServiceSnapshot;
import com.phillippitts.heartbeat.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Posts transition notifications to a chat incoming-webhook as a single embed.
 *
 * <p>Embed fields: service name, status, last heartbeat (if any) and metadata. Metadata entries
 * whose key looks like a credential are never sent.
 */
@Component
@ConditionalOnProperty(prefix = "heartbeat.notifier.webhook", name = "enabled", havingValue = "true")
class WebhookNotifier implements Notifier {
    private static final Logger LOG = LogManager.getLogger(WebhookNotifier.class);

    static final Map<NotificationLevel, Integer> COLORS = Map.of(
            NotificationLevel.INFO, 0x3498db,
            NotificationLevel.SUCCESS, 0x2ecc71,
            NotificationLevel.WARNING, 0xf39c12,
            NotificationLevel.ERROR, 0xe74c3c
    );

    private static final Set<String> HIDDEN_METADATA_KEYS = Set.of("password", "token", "secret", "key");
    private static final DateTimeFormatter HEARTBEAT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final WebhookNotifierProperties props;
    private final RestClient restClient;
    private final Clock clock;

    WebhookNotifier(WebhookNotifierProperties props, RestClient.Builder restClientBuilder, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (props.getUrl() == null || props.getUrl().isBlank()) {
            throw new IllegalStateException("heartbeat.notifier.webhook.url is required when the webhook notifier is enabled");
        }
        this.restClient = restClientBuilder.build();
    }

    @Override
    public boolean sendNotification(String title, String message, ServiceSnapshot service, NotificationLevel level) {
        String body = buildPayload(title, message, service, level, clock.instant()).toString();
        try {
            ResponseEntity<Void> response = restClient.post()
                    .uri(props.getUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .toBodilessEntity();
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientResponseException e) {
            LOG.error("Webhook rejected notification: status={}, response='{}'",
                    e.getStatusCode().value(), LogSanitizer.truncate(e.getResponseBodyAsString(), 200));
            return false;
        }
    }

    @Override
    public String name() {
        return "webhook";
    }

    JSONObject buildPayload(String title, String message, ServiceSnapshot service,
                            NotificationLevel level, Instant now) {
        JSONObject embed = new JSONObject()
                .put("title", title)
                .put("description", message)
                .put("color", COLORS.getOrDefault(level, COLORS.get(NotificationLevel.INFO)))
                .put("timestamp", now.toString());

        JSONArray fields = new JSONArray();
        if (service != null) {
            fields.put(field("Service Name", service.name(), true));
            fields.put(field("Status", service.status().name(), true));
            if (service.lastHeartbeatAt() != null) {
                fields.put(field("Last Heartbeat", HEARTBEAT_FORMAT.format(service.lastHeartbeatAt()), true));
            }
            String metadata = service.metadata().entrySet().stream()
                    .filter(e -> !HIDDEN_METADATA_KEYS.contains(e.getKey()))
                    .map(e -> "**" + e.getKey() + "**: " + e.getValue())
                    .collect(Collectors.joining("\n"));
            if (!metadata.isEmpty()) {
                fields.put(field("Metadata", metadata, false));
            }
        }
        embed.put("fields", fields);

        JSONObject payload = new JSONObject()
                .put("username", props.getUsername())
                .put("embeds", new JSONArray().put(embed));
        if (props.getAvatarUrl() != null && !props.getAvatarUrl().isBlank()) {
            payload.put("avatar_url", props.getAvatarUrl());
        }
        return payload;
    }

    private static JSONObject field(String name, String value, boolean inline) {
        return new JSONObject()
                .put("name", name)
                .put("value", value)
                .put("inline", inline);
    }
}
