package com.phillippitts.heartbeat.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the heartbeat registry and stale-detection monitor.
 *
 * <p>Durations accept Spring Boot's formats, e.g. {@code 30s}, {@code 2m}, {@code PT45S}.
 */
@ConfigurationProperties(prefix = "heartbeat")
@Validated
public class HeartbeatProperties {

    /** How often the stale sweep runs. */
    @NotNull
    private Duration checkInterval = Duration.ofSeconds(30);

    /** Silence longer than this marks a service STALE. */
    @NotNull
    private Duration staleThreshold = Duration.ofSeconds(60);

    /** Maximum events retained per service; older events are discarded. */
    @Min(value = 1, message = "Event history size must be at least 1")
    @Max(value = 10_000, message = "Event history size must not exceed 10000")
    private int eventHistorySize = 100;

    /** Upper bound on a single storage or notifier call. */
    @NotNull
    private Duration collaboratorTimeout = Duration.ofSeconds(5);

    @Valid
    private Monitor monitor = new Monitor();

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = requirePositive(checkInterval, "checkInterval");
    }

    public Duration getStaleThreshold() {
        return staleThreshold;
    }

    public void setStaleThreshold(Duration staleThreshold) {
        this.staleThreshold = requirePositive(staleThreshold, "staleThreshold");
    }

    public int getEventHistorySize() {
        return eventHistorySize;
    }

    public void setEventHistorySize(int eventHistorySize) {
        this.eventHistorySize = eventHistorySize;
    }

    public Duration getCollaboratorTimeout() {
        return collaboratorTimeout;
    }

    public void setCollaboratorTimeout(Duration collaboratorTimeout) {
        this.collaboratorTimeout = requirePositive(collaboratorTimeout, "collaboratorTimeout");
    }

    public Monitor getMonitor() {
        return monitor;
    }

    public void setMonitor(Monitor monitor) {
        this.monitor = monitor;
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration, got: " + value);
        }
        return value;
    }

    /**
     * Lifecycle settings for the background monitor.
     */
    public static class Monitor {

        /** Start the stale sweep when the application context starts. */
        private boolean autoStart = true;

        /** How long stop() waits for an in-flight sweep to return. */
        @NotNull
        private Duration stopTimeout = Duration.ofSeconds(5);

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public Duration getStopTimeout() {
            return stopTimeout;
        }

        public void setStopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
        }
    }
}
