package com.phillippitts.heartbeat.service.health;

import com.phillippitts.heartbeat.domain.HeartbeatStatus;
import com.phillippitts.heartbeat.domain.RegistrySummary;
import com.phillippitts.heartbeat.service.monitor.HeartbeatMonitor;
import com.phillippitts.heartbeat.service.monitor.MonitorState;
import com.phillippitts.heartbeat.service.registry.ServiceRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the heartbeat monitor itself.
 *
 * <ul>
 *   <li>UP: monitor running and no service is STALE or ERROR</li>
 *   <li>DEGRADED: monitor running, at least one service STALE or ERROR</li>
 *   <li>OUT_OF_SERVICE: monitor stopped (stale services are not being detected)</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class HeartbeatMonitorHealthIndicator implements HealthIndicator {

    private final HeartbeatMonitor monitor;
    private final ServiceRegistry registry;

    public HeartbeatMonitorHealthIndicator(HeartbeatMonitor monitor, ServiceRegistry registry) {
        this.monitor = monitor;
        this.registry = registry;
    }

    @Override
    public Health health() {
        RegistrySummary summary = registry.summary();
        long stale = summary.count(HeartbeatStatus.STALE);
        long error = summary.count(HeartbeatStatus.ERROR);

        Health.Builder builder;
        if (monitor.state() != MonitorState.RUNNING) {
            builder = Health.outOfService().withDetail("status", "Stale detection stopped");
        } else if (stale > 0 || error > 0) {
            builder = Health.status("DEGRADED").withDetail("status", "Some services are stale or failing");
        } else {
            builder = Health.up().withDetail("status", "Monitoring");
        }
        return builder
                .withDetail("monitor", monitor.state().name())
                .withDetail("services", summary.total())
                .withDetail("stale", stale)
                .withDetail("error", error)
                .build();
    }
}
