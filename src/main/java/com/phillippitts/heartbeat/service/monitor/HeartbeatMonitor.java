package com.phillippitts.heartbeat.service.monitor;

import com.phillippitts.heartbeat.config.properties.HeartbeatProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Starts and stops the recurring stale sweep, guaranteeing at most one sweep task.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * STOPPED → RUNNING (via start)
 * RUNNING → STOPPED (via stop)
 * </pre>
 * {@code start()} while running and {@code stop()} while stopped are no-ops. A task that finished
 * on its own counts as stopped, so the next {@code start()} schedules a fresh one.
 *
 * <p><b>Cancellation:</b> {@code stop()} clears the run's active flag and cancels the scheduled
 * task without interrupting it, then waits (up to {@code heartbeat.monitor.stop-timeout}) for an
 * in-flight tick to return. The sweeper reads the flag between services only, so the update in
 * progress finishes together with its storage and notification calls.
 *
 * <p>Also a {@link SmartLifecycle}: the container starts the monitor when
 * {@code heartbeat.monitor.auto-start=true} and stops it on shutdown.
 */
@Service
public class HeartbeatMonitor implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(HeartbeatMonitor.class);

    private final StaleServiceSweeper sweeper;
    private final TaskScheduler scheduler;
    private final HeartbeatProperties props;

    private final Lock lock = new ReentrantLock();
    // Held by a tick while it runs; stop() acquires it to wait for an in-flight tick
    private final ReentrantLock tickLock = new ReentrantLock();
    private RunningSweep running;

    public HeartbeatMonitor(StaleServiceSweeper sweeper,
                            @Qualifier("monitorScheduler") TaskScheduler scheduler,
                            HeartbeatProperties props) {
        this.sweeper = Objects.requireNonNull(sweeper, "sweeper");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Schedules the sweep if it is not already running.
     */
    @Override
    public void start() {
        lock.lock();
        try {
            if (isActive(running)) {
                LOG.debug("Heartbeat monitor already running");
                return;
            }
            Duration interval = props.getCheckInterval();
            AtomicBoolean active = new AtomicBoolean(true);
            Runnable tick = () -> runTick(active);
            ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(
                    tick, scheduler.getClock().instant().plus(interval), interval);
            running = new RunningSweep(future, active, scheduler.getClock().instant());
            LOG.info("Heartbeat monitor started: checkInterval={}, staleThreshold={}",
                    interval, props.getStaleThreshold());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the sweep and waits for an in-flight tick to finish its current service.
     */
    @Override
    public void stop() {
        lock.lock();
        try {
            RunningSweep current = running;
            if (current == null) {
                return;
            }
            running = null;
            current.active().set(false);
            current.future().cancel(false);
            awaitInFlightTick();
            LOG.info("Heartbeat monitor stopped");
        } finally {
            lock.unlock();
        }
    }

    public MonitorState state() {
        lock.lock();
        try {
            return isActive(running) ? MonitorState.RUNNING : MonitorState.STOPPED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return when the current sweep was scheduled, or null when stopped
     */
    public Instant startedAt() {
        lock.lock();
        try {
            return isActive(running) ? running.startedAt() : null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isRunning() {
        return state() == MonitorState.RUNNING;
    }

    @Override
    public boolean isAutoStartup() {
        return props.getMonitor().isAutoStart();
    }

    /** Visible for tests */
    ScheduledFuture<?> currentTask() {
        lock.lock();
        try {
            return running == null ? null : running.future();
        } finally {
            lock.unlock();
        }
    }

    private void runTick(AtomicBoolean active) {
        tickLock.lock();
        try {
            // A tick that was already dequeued when stop() ran must not sweep
            if (!active.get()) {
                return;
            }
            sweeper.run(active::get);
        } finally {
            tickLock.unlock();
        }
    }

    private void awaitInFlightTick() {
        Duration timeout = props.getMonitor().getStopTimeout();
        try {
            if (tickLock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                tickLock.unlock();
            } else {
                LOG.warn("In-flight stale sweep did not finish within {}", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for stale sweep to finish");
        }
    }

    private static boolean isActive(RunningSweep sweep) {
        return sweep != null && !sweep.future().isDone();
    }

    /** Handle of the one scheduled sweep task. */
    private record RunningSweep(ScheduledFuture<?> future, AtomicBoolean active, Instant startedAt) {
    }
}
