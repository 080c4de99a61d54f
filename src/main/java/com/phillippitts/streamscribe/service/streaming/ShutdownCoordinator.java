package com.phillippitts.streamscribe.service.streaming;

import com.phillippitts.streamscribe.service.metrics.StreamingMetrics;
import com.phillippitts.streamscribe.service.session.Session;
import com.phillippitts.streamscribe.service.session.SessionCloseResult;
import com.phillippitts.streamscribe.service.session.SessionFactory;
import com.phillippitts.streamscribe.service.session.SessionHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the cancellation flag of one streaming run and its idempotent stop sequence.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * RUNNING → STOPPING (via requestStop; later requests are no-ops)
 * STOPPING → STOPPED (after step 5 completed or failed)
 * </pre>
 *
 * <p><b>Stop sequence</b> (each step failure-tolerant, failures logged and suppressed):
 * <ol>
 *   <li>Set the cancellation flag (synchronously, inside {@link #requestStop(String)})</li>
 *   <li>Stop the streaming session, then mark it closed. Before stopping, wait up to
 *       {@code flushWait} for the pump to finish its exit flush</li>
 *   <li>Await every registered task without a timeout and without interrupting it</li>
 *   <li>Release the interrupt-signal registration</li>
 *   <li>Close the remote session by task id</li>
 * </ol>
 * Steps 2 to 5 run on a dedicated {@code stream-shutdown} thread, started at most once.
 *
 * @since 1.0
 */
public class ShutdownCoordinator {

    private static final Logger LOG = LogManager.getLogger(ShutdownCoordinator.class);

    private final PipelineFlags flags;
    private final SessionFactory sessionFactory;
    private final String credential;
    private final Duration flushWait;
    private final Duration closeTimeout;
    private final StreamingMetrics metrics;

    private final AtomicReference<ShutdownState> state = new AtomicReference<>(ShutdownState.RUNNING);
    private final CompletableFuture<ShutdownState> stopped = new CompletableFuture<>();
    private final Map<String, CompletableFuture<?>> tasks = new ConcurrentHashMap<>();

    private volatile SessionHandle handle;
    private volatile Session session;
    private volatile StopSignalRegistration signalRegistration;
    private volatile CompletableFuture<?> flushBarrier;
    private volatile SessionCloseResult closeResult;
    private volatile String stopReason;

    /**
     * @param closeTimeout timeout for closing the remote session, or {@code null} for none
     */
    public ShutdownCoordinator(PipelineFlags flags, SessionFactory sessionFactory, String credential,
                               Duration flushWait, Duration closeTimeout, StreamingMetrics metrics) {
        this.flags = Objects.requireNonNull(flags, "flags");
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        this.credential = credential;
        this.flushWait = Objects.requireNonNull(flushWait, "flushWait");
        this.closeTimeout = closeTimeout;
        this.metrics = metrics;
    }

    void attachHandle(SessionHandle handle) {
        this.handle = handle;
    }

    void attachSession(Session session) {
        this.session = session;
    }

    void attachSignal(StopSignalRegistration registration) {
        this.signalRegistration = registration;
    }

    void registerTask(String name, CompletableFuture<?> task) {
        tasks.put(name, task);
    }

    /** The stop sequence waits for this future (bounded) before stopping the session. */
    void setFlushBarrier(CompletableFuture<?> barrier) {
        this.flushBarrier = barrier;
    }

    /**
     * Requests the stop sequence. The first call sets the cancellation flag and starts the
     * sequence; every later call is a no-op returning the same future.
     *
     * @param reason short description for the log
     * @return future completed with {@link ShutdownState#STOPPED} once the sequence has finished
     */
    public CompletableFuture<ShutdownState> requestStop(String reason) {
        if (!state.compareAndSet(ShutdownState.RUNNING, ShutdownState.STOPPING)) {
            LOG.debug("Stop already requested ({}); ignoring '{}'", stopReason, reason);
            return stopped;
        }
        stopReason = reason;
        LOG.info("Stopping stream: {}", reason);
        flags.cancel();
        LOG.info("Shutdown step 1/5: cancellation flag set");

        Map<String, String> context = ThreadContext.getImmutableContext();
        Thread t = new Thread(() -> {
            if (context != null && !context.isEmpty()) {
                ThreadContext.putAll(context);
            }
            try {
                runStopSequence();
            } finally {
                ThreadContext.clearAll();
            }
        }, "stream-shutdown");
        t.start();
        return stopped;
    }

    private void runStopSequence() {
        try {
            step(2, "stop-session", this::stopSession);
            step(3, "await-tasks", this::awaitTasks);
            step(4, "release-signal", this::releaseSignal);
            step(5, "close-session", this::closeRemoteSession);
        } finally {
            state.set(ShutdownState.STOPPED);
            LOG.info("Stream stopped");
            stopped.complete(ShutdownState.STOPPED);
        }
    }

    private void stopSession() throws InterruptedException {
        awaitFlush();
        Session s = session;
        try {
            if (s != null) {
                s.stop();
            }
        } finally {
            flags.markSessionClosed();
        }
    }

    private void awaitFlush() throws InterruptedException {
        CompletableFuture<?> barrier = flushBarrier;
        if (barrier == null) {
            return;
        }
        try {
            barrier.handle((v, e) -> null).get(flushWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Audio pump did not finish within {}ms; stopping session anyway", flushWait.toMillis());
        } catch (ExecutionException e) {
            throw new IllegalStateException("Flush barrier failed unexpectedly", e);
        }
    }

    private void awaitTasks() throws Exception {
        CompletableFuture<?>[] pending = tasks.values().toArray(new CompletableFuture<?>[0]);
        CompletableFuture.allOf(pending).handle((v, e) -> null).get();
        LOG.debug("All {} pipeline tasks finished", pending.length);
    }

    private void releaseSignal() {
        StopSignalRegistration registration = signalRegistration;
        if (registration != null) {
            registration.release();
        }
    }

    private void closeRemoteSession() {
        SessionHandle h = handle;
        if (h == null) {
            LOG.debug("No remote session to close");
            return;
        }
        closeResult = sessionFactory.closeSession(h.taskId(), credential, closeTimeout);
    }

    private void step(int number, String name, ShutdownStep action) {
        LOG.info("Shutdown step {}/5: {}", number, name);
        try {
            action.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Shutdown step {} interrupted", name);
            recordFailure(name);
        } catch (Exception e) {
            LOG.warn("Shutdown step {} failed: {}", name, e.toString());
            recordFailure(name);
        }
    }

    private void recordFailure(String name) {
        if (metrics != null) {
            metrics.incrementShutdownStepFailure(name);
        }
    }

    public ShutdownState state() {
        return state.get();
    }

    public boolean isStopRequested() {
        return state.get() != ShutdownState.RUNNING;
    }

    /** Blocks until the stop sequence has finished. */
    public ShutdownState awaitStopped() {
        return stopped.join();
    }

    /** Close outcome from step 5, or {@code null} if it failed or has not run. */
    public SessionCloseResult closeResult() {
        return closeResult;
    }

    public String stopReason() {
        return stopReason;
    }

    @FunctionalInterface
    private interface ShutdownStep {
        void run() throws Exception;
    }
}
