package com.phillippitts.streamscribe.service.streaming;

import com.phillippitts.streamscribe.service.metrics.StreamingMetrics;
import com.phillippitts.streamscribe.service.session.Session;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Consumes frames from the {@link BoundedFrameChannel}, re-chunks them and sends the chunks to the
 * {@link Session}.
 *
 * <p><b>Flush triggers:</b>
 * <ul>
 *   <li>Size: while at least {@code chunkSizeBytes} are buffered, exactly that many bytes are sent
 *       from the front of the buffer</li>
 *   <li>Time: when the flush deadline has passed and a sub-threshold residue remains, the whole
 *       residue is sent and the deadline moves one chunk duration ahead</li>
 *   <li>Final: when the loop ends on cancellation and the session is still open, frames still
 *       queued in the channel join the buffer and whatever remains is sent once</li>
 * </ul>
 *
 * <p>Waiting on the channel is bounded by the chunk duration, which bounds flush latency during
 * silence. A {@link com.phillippitts.streamscribe.exception.TransportException} from a send
 * propagates out of {@link #run()}.
 *
 * @since 1.0
 */
public class ChunkPump implements Runnable {

    private static final Logger LOG = LogManager.getLogger(ChunkPump.class);

    private final BoundedFrameChannel channel;
    private final Session session;
    private final PipelineFlags flags;
    private final int chunkSizeBytes;
    private final Duration chunkDuration;
    private final StreamingMetrics metrics;
    private final LongSupplier nanoClock;

    private final AccumulationBuffer buffer = new AccumulationBuffer();
    private final AtomicLong bytesSent = new AtomicLong();
    private final AtomicLong chunksSent = new AtomicLong();

    public ChunkPump(BoundedFrameChannel channel, Session session, PipelineFlags flags,
                     int chunkSizeBytes, Duration chunkDuration, StreamingMetrics metrics) {
        this(channel, session, flags, chunkSizeBytes, chunkDuration, metrics, System::nanoTime);
    }

    // Package-private for tests
    ChunkPump(BoundedFrameChannel channel, Session session, PipelineFlags flags,
              int chunkSizeBytes, Duration chunkDuration, StreamingMetrics metrics, LongSupplier nanoClock) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.session = Objects.requireNonNull(session, "session");
        this.flags = Objects.requireNonNull(flags, "flags");
        this.chunkDuration = Objects.requireNonNull(chunkDuration, "chunkDuration");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        if (chunkSizeBytes <= 0) {
            throw new IllegalArgumentException("chunkSizeBytes must be positive: " + chunkSizeBytes);
        }
        if (chunkDuration.isNegative() || chunkDuration.isZero()) {
            throw new IllegalArgumentException("chunkDuration must be positive: " + chunkDuration);
        }
        this.chunkSizeBytes = chunkSizeBytes;
        this.metrics = metrics;
    }

    @Override
    public void run() {
        LOG.info("Audio pump started (chunk={} bytes, interval={}ms)", chunkSizeBytes, chunkDuration.toMillis());
        long interval = chunkDuration.toNanos();
        long nextFlush = nanoClock.getAsLong() + interval;

        while (!flags.isCancelled() && !flags.isSessionClosed()) {
            byte[] frame;
            try {
                frame = channel.poll(chunkDuration);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Audio pump interrupted; leaving send loop");
                break;
            }
            if (frame != null) {
                buffer.append(frame);
            }

            while (buffer.size() >= chunkSizeBytes && !flags.isSessionClosed()) {
                send(buffer.take(chunkSizeBytes), "size");
            }
            if (flags.isSessionClosed()) {
                break;
            }

            long now = nanoClock.getAsLong();
            if (buffer.size() > 0 && now - nextFlush >= 0) {
                send(buffer.takeAll(), "time");
                nextFlush = now + interval;
            }
        }

        if (!flags.isSessionClosed()) {
            for (byte[] queued : channel.drain()) {
                buffer.append(queued);
            }
        }
        if (buffer.size() > 0 && !flags.isSessionClosed()) {
            int remaining = buffer.size();
            send(buffer.takeAll(), "final");
            LOG.info("Flushed {} remaining bytes before stop", remaining);
        }
        LOG.info("Audio pump finished: {} chunks, {} bytes sent", chunksSent.get(), bytesSent.get());
    }

    private void send(byte[] chunk, String trigger) {
        session.sendBytes(chunk);
        bytesSent.addAndGet(chunk.length);
        chunksSent.incrementAndGet();
        if (metrics != null) {
            metrics.recordChunkSent(trigger, chunk.length);
        }
        LOG.trace("Sent {} byte chunk ({} flush)", chunk.length, trigger);
    }

    public long bytesSent() {
        return bytesSent.get();
    }

    public long chunksSent() {
        return chunksSent.get();
    }

    /** Bytes currently held back from the session. Only meaningful once {@link #run()} returned. */
    int bufferedBytes() {
        return buffer.size();
    }

    /**
     * Growable byte buffer that gives up bytes from the front. Confined to the pump thread.
     */
    static final class AccumulationBuffer {
        private byte[] data = new byte[8192];
        private int size;

        void append(byte[] bytes) {
            if (size + bytes.length > data.length) {
                data = Arrays.copyOf(data, Math.max(data.length * 2, size + bytes.length));
            }
            System.arraycopy(bytes, 0, data, size, bytes.length);
            size += bytes.length;
        }

        byte[] take(int n) {
            byte[] out = Arrays.copyOf(data, n);
            System.arraycopy(data, n, data, 0, size - n);
            size -= n;
            return out;
        }

        byte[] takeAll() {
            return take(size);
        }

        int size() {
            return size;
        }
    }
}
