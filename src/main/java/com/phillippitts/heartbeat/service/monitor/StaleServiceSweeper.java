package com.phillippitts.heartbeat.service.monitor;

import com.phillippitts.heartbeat.config.properties.HeartbeatProperties;
import com.phillippitts.heartbeat.domain.HeartbeatStatus;
import com.phillippitts.heartbeat.domain.ServiceSnapshot;
import com.phillippitts.heartbeat.exception.ServiceNotFoundException;
import com.phillippitts.heartbeat.service.registry.ServiceRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * One tick of stale detection: demotes services that stopped reporting to {@link HeartbeatStatus#STALE}.
 *
 * <p>A service is stale when it has heartbeated at least once, is not already STALE, and its last
 * heartbeat is older than {@code heartbeat.stale-threshold}. The STALE update goes through
 * {@link ServiceRegistry#heartbeat}, which also refreshes the last-heartbeat time, so an outage
 * is flagged once per threshold window rather than on every tick.
 *
 * <p>Scheduling is owned by {@link HeartbeatMonitor}; this class only knows how to sweep. The
 * monitor passes a {@code proceed} signal that is checked between services. A sweep is never
 * interrupted inside a registry update, so every update it starts also reaches storage and the
 * notifiers.
 */
@Component
public class StaleServiceSweeper {

    private static final Logger LOG = LogManager.getLogger(StaleServiceSweeper.class);

    private final ServiceRegistry registry;
    private final HeartbeatProperties props;
    private final Clock clock;

    public StaleServiceSweeper(ServiceRegistry registry, HeartbeatProperties props, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Scheduled entry point. Never throws: a failing tick is logged and the next tick runs normally.
     *
     * @param proceed checked before each service; the sweep ends once it returns false
     */
    public void run(BooleanSupplier proceed) {
        try {
            int marked = sweep(proceed);
            if (marked > 0) {
                LOG.info("Stale sweep marked {} service(s) STALE", marked);
            }
        } catch (Exception e) {
            LOG.error("Stale sweep failed; will retry on next interval", e);
        }
    }

    /**
     * Checks every service once, or until {@code proceed} returns false.
     *
     * @param proceed checked before each service
     * @return number of services transitioned to STALE
     */
    public int sweep(BooleanSupplier proceed) {
        Duration threshold = props.getStaleThreshold();
        int marked = 0;
        for (ServiceSnapshot service : registry.list()) {
            if (!proceed.getAsBoolean()) {
                LOG.debug("Stale sweep stopped after {} update(s)", marked);
                break;
            }
            Instant now = clock.instant();
            if (!isStale(service, now, threshold)) {
                continue;
            }
            long elapsedSeconds = Duration.between(service.lastHeartbeatAt(), now).getSeconds();
            try {
                registry.heartbeat(service.id(), HeartbeatStatus.STALE,
                        "No heartbeat received in " + elapsedSeconds + "s", null);
                marked++;
            } catch (ServiceNotFoundException e) {
                LOG.debug("Service {} disappeared during sweep", service.id());
            }
        }
        return marked;
    }

    static boolean isStale(ServiceSnapshot service, Instant now, Duration threshold) {
        Instant last = service.lastHeartbeatAt();
        if (last == null || service.status() == HeartbeatStatus.STALE) {
            return false;
        }
        return Duration.between(last, now).compareTo(threshold) > 0;
    }
}
