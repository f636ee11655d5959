package com.phillippitts.heartbeat.config;

import com.phillippitts.heartbeat.config.properties.HeartbeatProperties;
import com.phillippitts.heartbeat.service.notification.NotificationDispatcher;
import com.phillippitts.heartbeat.service.notification.Notifier;
import com.phillippitts.heartbeat.service.storage.Storage;
import com.phillippitts.heartbeat.service.storage.StorageGateway;
import com.phillippitts.heartbeat.service.util.CollaboratorInvoker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Wires the registry's collaborators: clock, time-bounded invoker, optional storage and notifiers.
 */
@Configuration
public class HeartbeatConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CollaboratorInvoker collaboratorInvoker(
            @Qualifier("collaboratorExecutor") ThreadPoolTaskExecutor collaboratorExecutor,
            HeartbeatProperties props) {
        return new CollaboratorInvoker(collaboratorExecutor, props.getCollaboratorTimeout());
    }

    /**
     * Storage is optional: with no {@link Storage} bean the gateway is a no-op.
     */
    @Bean
    public StorageGateway storageGateway(ObjectProvider<Storage> storage,
                                         CollaboratorInvoker invoker,
                                         ApplicationEventPublisher publisher,
                                         Clock clock) {
        return new StorageGateway(storage.getIfUnique(), invoker, publisher, clock);
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(ObjectProvider<Notifier> notifiers,
                                                         CollaboratorInvoker invoker,
                                                         StorageGateway storageGateway,
                                                         ApplicationEventPublisher publisher,
                                                         Clock clock) {
        return new NotificationDispatcher(notifiers.orderedStream().toList(), invoker, storageGateway,
                publisher, clock);
    }
}
