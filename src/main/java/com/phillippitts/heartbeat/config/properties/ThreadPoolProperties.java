package com.phillippitts.heartbeat.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the collaborator executor (storage and notifier calls)
 * and the monitor scheduler (stale sweep).
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private CollaboratorPoolProperties collaborator = new CollaboratorPoolProperties();
    private MonitorPoolProperties monitor = new MonitorPoolProperties();

    public CollaboratorPoolProperties getCollaborator() {
        return collaborator;
    }

    public void setCollaborator(CollaboratorPoolProperties collaborator) {
        this.collaborator = collaborator;
    }

    public MonitorPoolProperties getMonitor() {
        return monitor;
    }

    public void setMonitor(MonitorPoolProperties monitor) {
        this.monitor = monitor;
    }

    /**
     * Collaborator executor pool configuration.
     */
    public static class CollaboratorPoolProperties {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 200;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "hb-collab-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Monitor scheduler configuration. A single thread is enough: there is at most one sweep.
     */
    public static class MonitorPoolProperties {
        private int poolSize = 1;
        private String threadNamePrefix = "hb-monitor-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
