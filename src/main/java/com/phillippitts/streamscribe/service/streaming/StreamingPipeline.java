package com.phillippitts.streamscribe.service.streaming;

import com.phillippitts.streamscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.streamscribe.config.properties.ShutdownProperties;
import com.phillippitts.streamscribe.config.properties.TranscriptionProperties;
import com.phillippitts.streamscribe.exception.StreamScribeException;
import com.phillippitts.streamscribe.service.audio.capture.CaptureHandle;
import com.phillippitts.streamscribe.service.audio.capture.FrameCallback;
import com.phillippitts.streamscribe.service.audio.capture.FrameSource;
import com.phillippitts.streamscribe.service.metrics.StreamingMetrics;
import com.phillippitts.streamscribe.service.output.OutputSink;
import com.phillippitts.streamscribe.service.session.Session;
import com.phillippitts.streamscribe.service.session.SessionFactory;
import com.phillippitts.streamscribe.service.session.SessionHandle;
import com.phillippitts.streamscribe.service.session.TranscriptionModel;
import com.phillippitts.streamscribe.util.StreamTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one streaming session end to end: create the remote session, start capture, pump and
 * receiver, and return once the {@link ShutdownCoordinator} has reached
 * {@link ShutdownState#STOPPED}.
 *
 * <p><b>Data flow:</b> FrameSource → BoundedFrameChannel → ChunkPump → Session (outbound);
 * Session → ResultReceiver → OutputSink (inbound).
 *
 * <p><b>Stop triggers:</b> an interrupt signal, a task ending on its own (capture reached its
 * maximum duration, the remote side closed the stream), or a task failing. A task that ends
 * because the run was already cancelled does not trigger anything.
 *
 * <p>Only one run may be active at a time.
 *
 * @since 1.0
 */
@Service
public class StreamingPipeline {

    private static final Logger LOG = LogManager.getLogger(StreamingPipeline.class);

    static final String CAPTURE_TASK = "audio-capture";
    static final String PUMP_TASK = "audio-pump";
    static final String RECEIVER_TASK = "stream-reader";

    private final FrameSource frameSource;
    private final SessionFactory sessionFactory;
    private final OutputSink outputSink;
    private final Executor executor;
    private final AudioCaptureProperties captureProps;
    private final TranscriptionProperties transcriptionProps;
    private final ShutdownProperties shutdownProps;
    private final StreamingMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final StopSignalRegistration.Registrar signalRegistrar;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ShutdownCoordinator current;

    public StreamingPipeline(FrameSource frameSource,
                             SessionFactory sessionFactory,
                             OutputSink outputSink,
                             @Qualifier("streamingExecutor") Executor executor,
                             AudioCaptureProperties captureProps,
                             TranscriptionProperties transcriptionProps,
                             ShutdownProperties shutdownProps,
                             StreamingMetrics metrics,
                             ApplicationEventPublisher publisher,
                             StopSignalRegistration.Registrar signalRegistrar) {
        this.frameSource = Objects.requireNonNull(frameSource, "frameSource");
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        this.outputSink = Objects.requireNonNull(outputSink, "outputSink");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.captureProps = Objects.requireNonNull(captureProps, "captureProps");
        this.transcriptionProps = Objects.requireNonNull(transcriptionProps, "transcriptionProps");
        this.shutdownProps = Objects.requireNonNull(shutdownProps, "shutdownProps");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.signalRegistrar = Objects.requireNonNull(signalRegistrar, "signalRegistrar");
    }

    /**
     * Streams until stopped and returns the run's summary.
     *
     * @throws IllegalStateException if another run is active
     * @throws com.phillippitts.streamscribe.exception.StreamScribeException if the session
     *         cannot be created or started (the remote session is still closed when it exists)
     */
    public StreamingSummary run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Another streaming run is already active");
        }
        try {
            return doRun();
        } finally {
            current = null;
            ThreadContext.remove("sessionId");
            ThreadContext.remove("taskId");
            running.set(false);
        }
    }

    /**
     * Requests the stop sequence of the active run.
     *
     * @return {@code true} if a run was active
     */
    public boolean requestStop(String reason) {
        ShutdownCoordinator coordinator = current;
        if (coordinator == null) {
            LOG.debug("requestStop('{}') with no active run; ignoring", reason);
            return false;
        }
        coordinator.requestStop(reason);
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    private StreamingSummary doRun() {
        TranscriptionModel model = TranscriptionModel.parse(transcriptionProps.getModel());
        String credential = transcriptionProps.getToken();
        PipelineFlags flags = new PipelineFlags();
        ShutdownCoordinator coordinator = new ShutdownCoordinator(flags, sessionFactory, credential,
                shutdownProps.getFlushWait(), shutdownProps.getCloseTimeout(), metrics);

        SessionHandle handle = sessionFactory.createSession(model, credential);
        ThreadContext.put("sessionId", handle.sessionId());
        ThreadContext.put("taskId", handle.taskId());
        coordinator.attachHandle(handle);
        current = coordinator;
        LOG.info("Session {} initialized (task={}, maxTime={}s); opening stream",
                handle.sessionId(), handle.taskId(), handle.maxTimeSeconds());

        BoundedFrameChannel channel = new BoundedFrameChannel(captureProps.getQueueCapacity(), metrics);
        ChunkPump pump;
        ResultReceiver receiver;
        try {
            Session session = sessionFactory.openStream(handle);
            coordinator.attachSession(session);
            session.start();
            coordinator.attachSignal(signalRegistrar.register(() -> {
                LOG.info("Interrupt received; stopping");
                coordinator.requestStop("interrupt signal").join();
            }));

            pump = new ChunkPump(channel, session, flags,
                    captureProps.chunkSizeBytes(), captureProps.chunkDuration(), metrics);
            receiver = new ResultReceiver(session, flags, outputSink,
                    transcriptionProps.getReceiverIdleSleep(), metrics);

            // Tasks wait on the gate so every one is registered before any can trigger a stop
            CompletableFuture<Void> gate = new CompletableFuture<>();
            launch(CAPTURE_TASK, () -> capture(channel, flags), gate, coordinator, flags);
            CompletableFuture<Void> pumpTask = launch(PUMP_TASK, pump, gate, coordinator, flags);
            launch(RECEIVER_TASK, receiver, gate, coordinator, flags);
            coordinator.setFlushBarrier(pumpTask);
            gate.complete(null);
        } catch (RuntimeException e) {
            LOG.error("Failed to start streaming: {}", e.toString());
            coordinator.requestStop("startup failure");
            coordinator.awaitStopped();
            throw e;
        }

        coordinator.awaitStopped();
        StreamingSummary summary = new StreamingSummary(handle.sessionId(), handle.taskId(),
                coordinator.stopReason(), pump.bytesSent(), pump.chunksSent(), channel.dropCount(),
                receiver.messagesReceived(), coordinator.closeResult());
        LOG.info("Streaming finished: reason='{}', chunks={}, bytes={}, dropped={}, messages={}",
                summary.stopReason(), summary.chunksSent(), summary.bytesSent(),
                summary.framesDropped(), summary.messagesReceived());
        return summary;
    }

    private CompletableFuture<Void> launch(String name, Runnable body, CompletableFuture<Void> gate,
                                           ShutdownCoordinator coordinator, PipelineFlags flags) {
        CompletableFuture<Void> task = gate.thenRunAsync(() -> {
            LOG.debug("Task {} started", name);
            body.run();
        }, executor);
        coordinator.registerTask(name, task);
        task.whenComplete((v, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                LOG.error("Task {} failed: {}", name, cause.toString());
                publisher.publishEvent(new StreamingFailureEvent(name, cause.getClass().getSimpleName(), Instant.now()));
                coordinator.requestStop(name + " failed");
            } else if (!flags.isCancelled()) {
                coordinator.requestStop(name + " finished");
            }
        });
        return task;
    }

    private void capture(BoundedFrameChannel channel, PipelineFlags flags) {
        LOG.info("Audio capture task started");
        long maxDurationMs = captureProps.getMaxDurationMs();
        long started = System.nanoTime();
        FrameCallback callback = new FrameCallback() {
            @Override
            public void onFrame(byte[] frame) {
                channel.push(frame);
            }

            @Override
            public void onStatus(String status) {
                LOG.warn("Recording status: {}", status);
            }
        };
        try (CaptureHandle handle = frameSource.open(callback)) {
            while (!flags.isCancelled()) {
                if (maxDurationMs > 0 && (System.nanoTime() - started) / 1_000_000L >= maxDurationMs) {
                    LOG.info("Max capture duration reached ({} ms)", maxDurationMs);
                    break;
                }
                if (!handle.isOpen()) {
                    throw new StreamScribeException("Capture device stopped delivering frames");
                }
                try {
                    Thread.sleep(StreamTimeouts.CAPTURE_POLL_INTERVAL.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Audio capture task interrupted");
                    break;
                }
            }
        }
        LOG.info("Audio capture task finished");
    }
}
