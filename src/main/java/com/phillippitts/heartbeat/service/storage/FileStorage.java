package com.phillippitts.heartbeat.service.storage;

import com.phillippitts.heartbeat.config.storage.FileStorageProperties;
import com.phillippitts.heartbeat.domain.HeartbeatEvent;
import com.phillippitts.heartbeat.domain.ServiceSnapshot;
import com.phillippitts.heartbeat.exception.StorageUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JSON document store on the local filesystem.
 *
 * <p>Layout under the configured directory:
 * <pre>
 * services/&lt;id&gt;.json   latest snapshot per service, replaced atomically
 * errors.jsonl           one error record per line, append-only
 * </pre>
 */
@Component
@ConditionalOnProperty(prefix = "heartbeat.storage.file", name = "enabled", havingValue = "true")
public class FileStorage implements Storage {

    private static final Logger LOG = LogManager.getLogger(FileStorage.class);

    static final String SERVICES_DIR = "services";
    static final String ERRORS_FILE = "errors.jsonl";

    private final Path root;
    private final Clock clock;
    private final ReentrantLock errorsLock = new ReentrantLock();

    public FileStorage(FileStorageProperties props, Clock clock) {
        this.root = Paths.get(props.getDirectory()).toAbsolutePath().normalize();
        this.clock = clock;
    }

    @Override
    public void connect() {
        try {
            Files.createDirectories(root.resolve(SERVICES_DIR));
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot create storage directory " + root, e);
        }
        if (!Files.isWritable(root)) {
            throw new StorageUnavailableException("Storage directory is not writable: " + root);
        }
        LOG.info("File storage ready at {}", root);
    }

    @Override
    public boolean storeHeartbeat(String serviceId, ServiceSnapshot snapshot) {
        Path target = serviceFile(serviceId);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, toJson(snapshot).toString(2), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (IOException e) {
            LOG.error("Error storing heartbeat for {}: {}", serviceId, e.toString());
            return false;
        }
    }

    @Override
    public boolean storeError(ErrorRecord error) {
        JSONObject json = new JSONObject()
                .put("service_id", error.serviceId() == null ? JSONObject.NULL : error.serviceId())
                .put("source", error.source())
                .put("message", error.message() == null ? JSONObject.NULL : error.message())
                .put("timestamp", error.timestamp().toString())
                .put("context", new JSONObject(error.context()))
                .put("stored_at", clock.instant().toString());
        errorsLock.lock();
        try {
            Files.writeString(root.resolve(ERRORS_FILE), json + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            return true;
        } catch (IOException e) {
            LOG.error("Error storing error record: {}", e.toString());
            return false;
        } finally {
            errorsLock.unlock();
        }
    }

    @Override
    public List<ErrorRecord> getErrors(String serviceId, int limit) {
        Path file = root.resolve(ERRORS_FILE);
        List<String> lines;
        errorsLock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot read " + file, e);
        } finally {
            errorsLock.unlock();
        }

        List<ErrorRecord> result = new ArrayList<>();
        for (int i = lines.size() - 1; i >= 0 && result.size() < limit; i--) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                ErrorRecord error = fromJson(new JSONObject(line));
                if (serviceId == null || serviceId.equals(error.serviceId())) {
                    result.add(error);
                }
            } catch (JSONException | DateTimeParseException e) {
                LOG.warn("Skipping unreadable line {} in {}: {}", i + 1, file, e.getMessage());
            }
        }
        return result;
    }

    @Override
    public String name() {
        return "file";
    }

    Path serviceFile(String serviceId) {
        return root.resolve(SERVICES_DIR).resolve(fileNameFor(serviceId) + ".json");
    }

    /** Keeps ids readable on disk; ids that needed escaping get a hash suffix to stay unique. */
    static String fileNameFor(String serviceId) {
        String safe = serviceId.replaceAll("[^A-Za-z0-9._-]", "_").replaceFirst("^\\.+", "_");
        if (safe.equals(serviceId)) {
            return safe;
        }
        return safe + "-" + Integer.toHexString(serviceId.hashCode());
    }

    static JSONObject toJson(ServiceSnapshot snapshot) {
        JSONArray events = new JSONArray();
        for (HeartbeatEvent e : snapshot.events()) {
            events.put(new JSONObject()
                    .put("timestamp", e.timestamp().toString())
                    .put("status", e.status().name())
                    .put("message", e.message() == null ? JSONObject.NULL : e.message())
                    .put("metadata", metadataJson(e.metadata())));
        }
        return new JSONObject()
                .put("id", snapshot.id())
                .put("name", snapshot.name())
                .put("status", snapshot.status().name())
                .put("last_message", snapshot.lastMessage() == null ? JSONObject.NULL : snapshot.lastMessage())
                .put("metadata", metadataJson(snapshot.metadata()))
                .put("last_heartbeat", snapshot.lastHeartbeatAt() == null
                        ? JSONObject.NULL : snapshot.lastHeartbeatAt().toString())
                .put("created_at", snapshot.createdAt().toString())
                .put("events", events);
    }

    static ErrorRecord fromJson(JSONObject json) {
        Map<String, String> context = new LinkedHashMap<>();
        JSONObject ctx = json.optJSONObject("context");
        if (ctx != null) {
            for (String key : ctx.keySet()) {
                context.put(key, ctx.optString(key));
            }
        }
        return new ErrorRecord(
                json.isNull("service_id") ? null : json.getString("service_id"),
                json.getString("source"),
                json.isNull("message") ? null : json.getString("message"),
                Instant.parse(json.getString("timestamp")),
                context);
    }

    private static JSONObject metadataJson(Map<String, Object> metadata) {
        JSONObject json = new JSONObject();
        metadata.forEach((k, v) -> {
            Object wrapped = v == null ? JSONObject.NULL : JSONObject.wrap(v);
            json.put(k, wrapped == null ? String.valueOf(v) : wrapped);
        });
        return json;
    }
}
