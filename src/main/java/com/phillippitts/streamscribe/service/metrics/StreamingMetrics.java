package com.phillippitts.streamscribe.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized metrics tracking for the streaming pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Frames dropped by the bounded queue</li>
 *   <li>Chunks and bytes sent, by flush trigger (size, time, final)</li>
 *   <li>Result messages received</li>
 *   <li>Shutdown step failures</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class StreamingMetrics {

    private static final String METRIC_PREFIX = "streamscribe";

    private final MeterRegistry registry;

    public StreamingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementFramesDropped() {
        Counter.builder(METRIC_PREFIX + ".audio.frames.dropped")
                .description("Frames evicted from the audio queue under pressure")
                .register(registry)
                .increment();
    }

    /**
     * Records one chunk sent to the session.
     *
     * @param trigger flush trigger (size, time, final)
     * @param bytes chunk length in bytes
     */
    public void recordChunkSent(String trigger, int bytes) {
        Counter.builder(METRIC_PREFIX + ".audio.chunks.sent")
                .description("Audio chunks sent to the transcription session")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
        Counter.builder(METRIC_PREFIX + ".audio.bytes.sent")
                .description("Audio bytes sent to the transcription session")
                .baseUnit("bytes")
                .register(registry)
                .increment(bytes);
    }

    public void incrementMessagesReceived() {
        Counter.builder(METRIC_PREFIX + ".messages.received")
                .description("Result messages received from the transcription session")
                .register(registry)
                .increment();
    }

    /**
     * @param step shutdown step name (stop-session, await-tasks, release-signal, close-session)
     */
    public void incrementShutdownStepFailure(String step) {
        Counter.builder(METRIC_PREFIX + ".shutdown.step.failure")
                .description("Shutdown steps that raised and were suppressed")
                .tag("step", step)
                .register(registry)
                .increment();
    }
}
