package com.phillippitts.heartbeat.config;

import com.phillippitts.heartbeat.domain.HeartbeatStatus;
import com.phillippitts.heartbeat.service.registry.ServiceRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Exposes registry gauges via Micrometer.
 *
 * <ul>
 *   <li>heartbeat.services.total - number of registered services</li>
 *   <li>heartbeat.services.status{status=healthy|stale|...} - services per status</li>
 * </ul>
 *
 * <p>Available via {@code GET /actuator/metrics/heartbeat.services.status}.
 */
@Configuration
public class HeartbeatMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(HeartbeatMetricsConfig.class);

    @Bean
    public MeterBinder heartbeatRegistryMetrics(ServiceRegistry registry) {
        return meterRegistry -> {
            Gauge.builder("heartbeat.services.total", registry, r -> r.summary().total())
                    .description("Number of registered services")
                    .register(meterRegistry);

            for (HeartbeatStatus status : HeartbeatStatus.values()) {
                Gauge.builder("heartbeat.services.status", registry, r -> r.summary().count(status))
                        .description("Number of services currently in the given status")
                        .tag("status", status.name().toLowerCase(Locale.ROOT))
                        .register(meterRegistry);
            }
            LOG.info("Heartbeat registry metrics registered: heartbeat.services.* available via /actuator/metrics");
        };
    }
}
