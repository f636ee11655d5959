package com.phillippitts.heartbeat.presentation.controller;

import com.phillippitts.heartbeat.service.monitor.HeartbeatMonitor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Manual control of stale detection. Start and stop are idempotent; the response always
 * carries the state after the call.
 */
@RestController
@RequestMapping("/api/monitor")
class MonitorController {

    private static final Logger LOG = LogManager.getLogger(MonitorController.class);

    private final HeartbeatMonitor monitor;

    MonitorController(HeartbeatMonitor monitor) {
        this.monitor = monitor;
    }

    @GetMapping
    ResponseEntity<Map<String, String>> state() {
        return ResponseEntity.ok(body());
    }

    @PostMapping("/start")
    ResponseEntity<Map<String, String>> start() {
        LOG.info("Monitor start requested over HTTP");
        monitor.start();
        return ResponseEntity.ok(body());
    }

    @PostMapping("/stop")
    ResponseEntity<Map<String, String>> stop() {
        LOG.info("Monitor stop requested over HTTP");
        monitor.stop();
        return ResponseEntity.ok(body());
    }

    private Map<String, String> body() {
        return Map.of("state", monitor.state().name());
    }
}
