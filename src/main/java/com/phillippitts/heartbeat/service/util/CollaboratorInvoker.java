package com.phillippitts.heartbeat.service.util;

import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs storage and notifier calls on a bounded executor and waits at most a fixed timeout.
 *
 * <p>Collaborators are external I/O (disk, webhooks). A slow or hung collaborator must not stall
 * the registry or a sweep tick, so every call is submitted to the collaborator executor and the
 * calling thread waits up to {@code timeout}. A call that returns {@code false}, throws, times
 * out or is interrupted is reported as a failed {@link Outcome}; this class never throws.
 *
 * <p><b>Thread Safety:</b> stateless apart from its immutable configuration.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * CollaboratorInvoker.Outcome outcome = invoker.invoke(() -> notifier.sendNotification(...));
 * if (!outcome.succeeded()) {
 *     LOG.warn("Notifier failed: {}", outcome.reason());
 * }
 * }</pre>
 */
public final class CollaboratorInvoker {

    private final AsyncTaskExecutor executor;
    private final Duration timeout;

    /**
     * @param executor executor that runs collaborator calls
     * @param timeout  maximum time the caller waits for one call
     */
    public CollaboratorInvoker(AsyncTaskExecutor executor, Duration timeout) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Invokes a collaborator call and waits for its result.
     *
     * @param call the collaborator call; {@code true} means success
     * @return outcome describing success or the failure reason
     */
    public Outcome invoke(Callable<Boolean> call) {
        Future<Boolean> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException e) {
            return Outcome.failed("rejected by executor", e);
        }

        try {
            Boolean ok = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return Boolean.TRUE.equals(ok) ? Outcome.ok() : Outcome.failed("returned false", null);
        } catch (TimeoutException te) {
            future.cancel(true);
            return Outcome.failed("timed out after " + timeout.toMillis() + "ms", te);
        } catch (InterruptedException ie) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Outcome.failed("interrupted while waiting", ie);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause() != null ? ee.getCause() : ee;
            return Outcome.failed(cause.toString(), cause);
        }
    }

    /**
     * Result of one collaborator call.
     *
     * @param succeeded true when the call returned {@code true} in time
     * @param reason    failure reason, null on success
     * @param cause     underlying exception if any
     */
    public record Outcome(boolean succeeded, String reason, Throwable cause) {

        static Outcome ok() {
            return new Outcome(true, null, null);
        }

        static Outcome failed(String reason, Throwable cause) {
            return new Outcome(false, reason, cause);
        }
    }
}
