package com.phillippitts.heartbeat.config.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

/**
 * Configuration properties for the file-backed JSON document store.
 */
@ConfigurationProperties(prefix = "heartbeat.storage.file")
@Validated
public class FileStorageProperties {

    /** Enable file persistence of service snapshots and error records. */
    private boolean enabled = false;

    /** Root directory; created on connect. */
    @NotBlank(message = "Storage directory must not be blank")
    private String directory = "./heartbeat-data";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }
}
