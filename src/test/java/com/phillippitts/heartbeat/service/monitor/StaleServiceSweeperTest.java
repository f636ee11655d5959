package com.phillippitts.heartbeat.service.monitor;

import com.phillippitts.heartbeat.config.properties.HeartbeatProperties;
import com.phillippitts.heartbeat.domain.HeartbeatStatus;
import com.phillippitts.heartbeat.domain.ServiceSnapshot;
import com.phillippitts.heartbeat.exception.ServiceNotFoundException;
import com.phillippitts.heartbeat.service.registry.DefaultServiceRegistry;
import com.phillippitts.heartbeat.service.registry.ServiceRegistry;
import com.phillippitts.heartbeat.testsupport.MutableClock;
import com.phillippitts.heartbeat.testsupport.RecordingNotifier;
import com.phillippitts.heartbeat.testsupport.RecordingStorage;
import com.phillippitts.heartbeat.testsupport.TestCollaborators;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StaleServiceSweeperTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private MutableClock clock;
    private HeartbeatProperties props;
    private RecordingNotifier notifier;
    private DefaultServiceRegistry registry;
    private StaleServiceSweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        props = new HeartbeatProperties();
        props.setStaleThreshold(Duration.ofSeconds(60));
        notifier = new RecordingNotifier("rec");
        registry = TestCollaborators.registry(props, clock, new RecordingStorage(), List.of(notifier), e -> { });
        sweeper = new StaleServiceSweeper(registry, props, clock);
    }

    @Test
    void silentServiceBecomesStaleWithElapsedSecondsInMessage() {
        registry.register("svc-A", "svc-A", null);
        registry.heartbeat("svc-A", HeartbeatStatus.HEALTHY);
        clock.advance(Duration.ofSeconds(10));
        registry.heartbeat("svc-A", HeartbeatStatus.WARNING, "high load", null);

        clock.advance(Duration.ofSeconds(61));
        assertThat(sweepAll()).isEqualTo(1);

        ServiceSnapshot s = registry.get("svc-A");
        assertThat(s.status()).isEqualTo(HeartbeatStatus.STALE);
        assertThat(s.lastEvent().message()).isEqualTo("No heartbeat received in 61s");
        assertThat(notifier.sent).extracting(RecordingNotifier.Sent::title).containsExactly(
                "Service svc-A is HEALTHY", "Service svc-A is WARNING", "Service svc-A is STALE");
    }

    @Test
    void staleServiceIsFlaggedOnlyOnce() {
        String id = registry.register("api");
        registry.heartbeat(id, HeartbeatStatus.HEALTHY);
        clock.advance(Duration.ofSeconds(61));

        assertThat(sweepAll()).isEqualTo(1);
        assertThat(sweepAll()).isZero();
        clock.advance(Duration.ofMinutes(10));
        assertThat(sweepAll()).isZero();

        assertThat(registry.get(id).events()).hasSize(3);
        assertThat(notifier.sent).hasSize(2);
    }

    @Test
    void recoveredServiceCanGoStaleAgain() {
        String id = registry.register("api");
        registry.heartbeat(id, HeartbeatStatus.HEALTHY);
        clock.advance(Duration.ofSeconds(61));
        sweepAll();

        registry.heartbeat(id, HeartbeatStatus.HEALTHY);
        clock.advance(Duration.ofSeconds(61));

        assertThat(sweepAll()).isEqualTo(1);
        assertThat(registry.get(id).status()).isEqualTo(HeartbeatStatus.STALE);
    }

    @Test
    void neverHeartbeatedServiceIsNotStale() {
        String id = registry.register("api");
        clock.advance(Duration.ofHours(1));

        assertThat(sweepAll()).isZero();
        assertThat(registry.get(id).status()).isEqualTo(HeartbeatStatus.UNKNOWN);
    }

    @Test
    void exactlyAtThresholdIsNotStale() {
        String id = registry.register("api");
        registry.heartbeat(id, HeartbeatStatus.HEALTHY);
        clock.advance(Duration.ofSeconds(60));

        assertThat(sweepAll()).isZero();
    }

    @Test
    void stalenessDecisionIgnoresStatusExceptStale() {
        ServiceSnapshot error = new ServiceSnapshot("x", "x", HeartbeatStatus.ERROR, null, Map.of(),
                T0, T0, List.of());
        ServiceSnapshot stale = new ServiceSnapshot("x", "x", HeartbeatStatus.STALE, null, Map.of(),
                T0, T0, List.of());

        assertThat(StaleServiceSweeper.isStale(error, T0.plusSeconds(61), Duration.ofSeconds(60))).isTrue();
        assertThat(StaleServiceSweeper.isStale(stale, T0.plusSeconds(61), Duration.ofSeconds(60))).isFalse();
    }

    @Test
    void failingTickIsContained() {
        ServiceRegistry broken = mock(ServiceRegistry.class);
        when(broken.list()).thenThrow(new IllegalStateException("registry exploded"));

        assertThatCode(() -> new StaleServiceSweeper(broken, props, clock).run(() -> true)).doesNotThrowAnyException();
    }

    @Test
    void serviceRemovedDuringSweepIsSkipped() {
        ServiceRegistry racing = mock(ServiceRegistry.class);
        ServiceSnapshot old = new ServiceSnapshot("gone", "gone", HeartbeatStatus.HEALTHY, null, Map.of(),
                T0, T0, List.of());
        when(racing.list()).thenReturn(List.of(old));
        when(racing.heartbeat(eq("gone"), eq(HeartbeatStatus.STALE), anyString(), any()))
                .thenThrow(new ServiceNotFoundException("gone"));
        clock.advance(Duration.ofSeconds(61));

        assertThat(new StaleServiceSweeper(racing, props, clock).sweep(() -> true)).isZero();
    }

    @Test
    void sweepEndsWhenStopSignalled() {
        String id = registry.register("api");
        registry.heartbeat(id, HeartbeatStatus.HEALTHY);
        clock.advance(Duration.ofSeconds(61));

        assertThat(sweeper.sweep(() -> false)).isZero();
        assertThat(registry.get(id).status()).isEqualTo(HeartbeatStatus.HEALTHY);
    }

    @Test
    void stopSignalIsCheckedBetweenServicesOnly() {
        String first = registry.register("first");
        String second = registry.register("second");
        registry.heartbeat(first, HeartbeatStatus.HEALTHY);
        registry.heartbeat(second, HeartbeatStatus.HEALTHY);
        clock.advance(Duration.ofSeconds(61));
        AtomicInteger checks = new AtomicInteger();

        assertThat(sweeper.sweep(() -> checks.incrementAndGet() == 1)).isEqualTo(1);

        assertThat(List.of(registry.get(first).status(), registry.get(second).status()))
                .containsExactlyInAnyOrder(HeartbeatStatus.STALE, HeartbeatStatus.HEALTHY);
        assertThat(notifier.sent).extracting(RecordingNotifier.Sent::title)
                .filteredOn(t -> t.endsWith("is STALE"))
                .hasSize(1);
    }

    private int sweepAll() {
        return sweeper.sweep(() -> true);
    }
}
