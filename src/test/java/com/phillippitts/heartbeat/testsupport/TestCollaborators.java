package com.phillippitts.heartbeat.testsupport;

import com.phillippitts.heartbeat.config.properties.HeartbeatProperties;
import com.phillippitts.heartbeat.service.notification.NotificationDispatcher;
import com.phillippitts.heartbeat.service.notification.Notifier;
import com.phillippitts.heartbeat.service.registry.DefaultServiceRegistry;
import com.phillippitts.heartbeat.service.storage.Storage;
import com.phillippitts.heartbeat.service.storage.StorageGateway;
import com.phillippitts.heartbeat.service.util.CollaboratorInvoker;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/** Builds a fully wired registry without a Spring context. */
public final class TestCollaborators {

    private TestCollaborators() {
    }

    public static CollaboratorInvoker invoker() {
        return invoker(Duration.ofSeconds(2));
    }

    public static CollaboratorInvoker invoker(Duration timeout) {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("test-collab-");
        executor.setDaemon(true);
        return new CollaboratorInvoker(executor, timeout);
    }

    public static DefaultServiceRegistry registry(HeartbeatProperties props, Clock clock, Storage storage,
                                                  List<Notifier> notifiers, ApplicationEventPublisher publisher) {
        CollaboratorInvoker invoker = invoker();
        StorageGateway gateway = new StorageGateway(storage, invoker, publisher, clock);
        gateway.connect();
        NotificationDispatcher dispatcher = new NotificationDispatcher(notifiers, invoker, gateway, publisher, clock);
        return new DefaultServiceRegistry(props, clock, gateway, dispatcher);
    }
}
