package com.phillippitts.heartbeat.presentation.controller;

import com.phillippitts.heartbeat.domain.RegistrySummary;
import com.phillippitts.heartbeat.domain.ServiceSnapshot;
import com.phillippitts.heartbeat.presentation.dto.HeartbeatRequest;
import com.phillippitts.heartbeat.presentation.dto.RegisterServiceRequest;
import com.phillippitts.heartbeat.service.registry.ServiceRegistry;
import com.phillippitts.heartbeat.service.storage.ErrorRecord;
import com.phillippitts.heartbeat.service.storage.StorageGateway;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * HTTP adapter over {@link ServiceRegistry}. Domain exceptions are mapped by
 * {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/services")
class ServiceController {

    private final ServiceRegistry registry;
    private final StorageGateway storage;

    ServiceController(ServiceRegistry registry, StorageGateway storage) {
        this.registry = registry;
        this.storage = storage;
    }

    @PostMapping
    ResponseEntity<Map<String, String>> register(@Valid @RequestBody RegisterServiceRequest request) {
        String serviceId = registry.register(request.name(), request.id(), request.metadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("serviceId", serviceId));
    }

    @PostMapping("/{id}/heartbeat")
    ResponseEntity<ServiceSnapshot> heartbeat(@PathVariable("id") String id,
                                              @RequestBody(required = false) HeartbeatRequest request) {
        HeartbeatRequest body = request != null ? request : new HeartbeatRequest(null, null, null);
        return ResponseEntity.ok(registry.heartbeat(id, body.statusOrDefault(), body.message(), body.metadata()));
    }

    @GetMapping("/{id}")
    ResponseEntity<ServiceSnapshot> get(@PathVariable("id") String id) {
        return ResponseEntity.ok(registry.get(id));
    }

    /** Recorded notifier and storage failures for one service, newest first. Empty without storage. */
    @GetMapping("/{id}/errors")
    ResponseEntity<List<ErrorRecord>> errors(@PathVariable("id") String id,
                                             @RequestParam(name = "limit", defaultValue = "100") int limit) {
        registry.get(id);
        return ResponseEntity.ok(storage.errors(id, limit));
    }

    @GetMapping
    ResponseEntity<ServiceListResponse> list() {
        return ResponseEntity.ok(new ServiceListResponse(registry.list(), registry.summary()));
    }

    record ServiceListResponse(List<ServiceSnapshot> services, RegistrySummary summary) {}
}
