package com.phillippitts.streamscribe.service.streaming;

import com.phillippitts.streamscribe.service.metrics.StreamingMetrics;
import com.phillippitts.streamscribe.service.output.OutputSink;
import com.phillippitts.streamscribe.service.session.Session;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reads result messages from the {@link Session} and forwards them to the {@link OutputSink}
 * in receipt order.
 *
 * <p>Each read waits for the session's own idle window. An empty read is followed by a short
 * sleep instead of an immediate retry. The loop ends when the run is cancelled, or when the
 * remote side has closed the stream and every buffered message was forwarded.
 */
public class ResultReceiver implements Runnable {

    private static final Logger LOG = LogManager.getLogger(ResultReceiver.class);

    private final Session session;
    private final PipelineFlags flags;
    private final OutputSink sink;
    private final Duration idleSleep;
    private final StreamingMetrics metrics;

    private final AtomicLong received = new AtomicLong();
    private volatile boolean endedByRemote;

    public ResultReceiver(Session session, PipelineFlags flags, OutputSink sink,
                          Duration idleSleep, StreamingMetrics metrics) {
        this.session = Objects.requireNonNull(session, "session");
        this.flags = Objects.requireNonNull(flags, "flags");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.idleSleep = Objects.requireNonNull(idleSleep, "idleSleep");
        this.metrics = metrics;
    }

    @Override
    public void run() {
        LOG.info("Result receiver started");
        while (!flags.isCancelled()) {
            Optional<String> message = session.readNext(null);
            if (message.isPresent()) {
                sink.accept(message.get());
                received.incrementAndGet();
                if (metrics != null) {
                    metrics.incrementMessagesReceived();
                }
                continue;
            }
            if (session.isRemoteClosed()) {
                endedByRemote = true;
                LOG.info("Stream ended by remote side");
                break;
            }
            try {
                Thread.sleep(idleSleep.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Result receiver interrupted; leaving read loop");
                break;
            }
        }
        LOG.info("Result receiver finished: {} messages received", received.get());
    }

    public long messagesReceived() {
        return received.get();
    }

    /** True when the loop ended because the remote side closed the stream. */
    public boolean endedByRemote() {
        return endedByRemote;
    }
}
