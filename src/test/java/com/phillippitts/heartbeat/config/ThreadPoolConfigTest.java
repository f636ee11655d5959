package com.phillippitts.heartbeat.config;

import com.phillippitts.heartbeat.config.properties.ThreadPoolProperties;
import com.phillippitts.heartbeat.service.util.CollaboratorInvoker;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void collaboratorExecutorUsesConfiguredSizes() {
        ThreadPoolTaskExecutor executor = config.collaboratorExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(4);
            assertThat(executor.getMaxPoolSize()).isEqualTo(16);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("hb-collab-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void saturatedCollaboratorExecutorRejectsInsteadOfRunningOnCaller() {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getCollaborator().setCorePoolSize(1);
        props.getCollaborator().setMaxPoolSize(1);
        props.getCollaborator().setQueueCapacity(0);
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(props).collaboratorExecutor();
        CountDownLatch release = new CountDownLatch(1);
        try {
            executor.submit(() -> {
                release.await();
                return null;
            });
            CollaboratorInvoker invoker = new CollaboratorInvoker(executor, Duration.ofMillis(100));
            AtomicReference<String> ranOn = new AtomicReference<>();

            long start = System.nanoTime();
            CollaboratorInvoker.Outcome outcome = invoker.invoke(() -> {
                ranOn.set(Thread.currentThread().getName());
                Thread.sleep(2_000);
                return true;
            });
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(outcome.succeeded()).isFalse();
            assertThat(outcome.reason()).isEqualTo("rejected by executor");
            assertThat(ranOn.get()).isNull();
            assertThat(elapsedMs).isLessThan(1_000);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void collaboratorExecutorPropagatesThreadContext() throws Exception {
        ThreadPoolTaskExecutor executor = config.collaboratorExecutor();
        try {
            ThreadContext.put("serviceId", "svc-1");
            Future<String> seen = executor.submit(() -> ThreadContext.get("serviceId"));
            assertThat(seen.get(2, TimeUnit.SECONDS)).isEqualTo("svc-1");

            ThreadContext.clearAll();
            Future<String> after = executor.submit(() -> ThreadContext.get("serviceId"));
            assertThat(after.get(2, TimeUnit.SECONDS)).isNull();
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void monitorSchedulerIsSingleThreaded() {
        ThreadPoolTaskScheduler scheduler = config.monitorScheduler();
        try {
            assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(1);
            assertThat(scheduler.getThreadNamePrefix()).isEqualTo("hb-monitor-");
        } finally {
            scheduler.shutdown();
        }
    }
}
