package com.phillippitts.heartbeat.config.notifier;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the chat webhook notifier.
 */
@ConfigurationProperties(prefix = "heartbeat.notifier.webhook")
@Validated
public class WebhookNotifierProperties {

    /** Enable the webhook notifier. */
    private boolean enabled = false;

    /** Incoming-webhook URL (required when enabled). */
    private String url;

    /** Display name posted with each message. */
    private String username = "Heartbeat Monitor";

    /** Optional avatar image URL. */
    private String avatarUrl;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getAvatarUrl() {
        return avatarUrl;
    }

    public void setAvatarUrl(String avatarUrl) {
        this.avatarUrl = avatarUrl;
    }
}
