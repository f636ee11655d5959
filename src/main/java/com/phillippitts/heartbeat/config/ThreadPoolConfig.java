package com.phillippitts.heartbeat.config;

import com.phillippitts.heartbeat.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind the heartbeat monitor.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Bounded pool running storage and notifier calls so callers can wait with a timeout.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. When the pool and queue are full
     * the call is rejected and {@link com.phillippitts.heartbeat.service.util.CollaboratorInvoker}
     * reports it as failed. Running it on the submitting thread would bypass the collaborator timeout.
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext (requestId, serviceId) from the submitting
     * thread to the worker so collaborator logs stay correlated.
     *
     * @return executor for collaborator calls
     */
    @Bean(name = "collaboratorExecutor")
    public ThreadPoolTaskExecutor collaboratorExecutor() {
        ThreadPoolProperties.CollaboratorPoolProperties collabProps = threadPoolProperties.getCollaborator();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(collabProps.getCorePoolSize());
        executor.setMaxPoolSize(collabProps.getMaxPoolSize());
        executor.setQueueCapacity(collabProps.getQueueCapacity());
        executor.setThreadNamePrefix(collabProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(collabProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler for the stale sweep. The sweep is started and stopped explicitly by
     * {@link com.phillippitts.heartbeat.service.monitor.HeartbeatMonitor}; nothing else is scheduled here.
     * Shutdown waits for an in-flight tick instead of interrupting it mid-update.
     *
     * @return scheduler for the monitor
     */
    @Bean(name = "monitorScheduler")
    public ThreadPoolTaskScheduler monitorScheduler() {
        ThreadPoolProperties.MonitorPoolProperties monitorProps = threadPoolProperties.getMonitor();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(monitorProps.getPoolSize());
        scheduler.setThreadNamePrefix(monitorProps.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
