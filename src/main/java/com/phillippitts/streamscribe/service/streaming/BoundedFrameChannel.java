package com.phillippitts.streamscribe.service.streaming;

import com.phillippitts.streamscribe.service.metrics.StreamingMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-capacity frame queue between the capture thread and the pump, with a drop-oldest policy.
 *
 * <p>{@link #push(byte[])} never blocks: when the queue is full it evicts the oldest frame and
 * retries the insert once. If the retry loses a race with another producer the new frame is lost;
 * that path is logged, not raised. Every tenth drop emits one WARN line.
 *
 * <p><b>Thread Safety:</b> Safe for one producer and one consumer on different threads.
 * Ownership of a pushed array transfers to the queue; callers must not modify it afterwards.
 *
 * @since 1.0
 */
public final class BoundedFrameChannel {

    private static final Logger LOG = LogManager.getLogger(BoundedFrameChannel.class);

    static final int DROP_LOG_INTERVAL = 10;

    private final ArrayBlockingQueue<byte[]> queue;
    private final AtomicLong dropCount = new AtomicLong();
    private final StreamingMetrics metrics;

    public BoundedFrameChannel(int capacity) {
        this(capacity, null);
    }

    public BoundedFrameChannel(int capacity, StreamingMetrics metrics) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.metrics = metrics;
    }

    /**
     * Inserts a frame, evicting the oldest queued frame when full. Empty frames are ignored.
     */
    public void push(byte[] frame) {
        if (frame == null || frame.length == 0) {
            return;
        }
        if (queue.offer(frame)) {
            return;
        }
        long drops = dropCount.incrementAndGet();
        if (metrics != null) {
            metrics.incrementFramesDropped();
        }
        // Consumer may have emptied the queue in between; nothing to evict then
        queue.poll();
        if (!queue.offer(frame)) {
            LOG.debug("Frame of {} bytes lost after eviction retry", frame.length);
        }
        if (drops % DROP_LOG_INTERVAL == 0) {
            LOG.warn("Audio queue overflow: {} frames dropped", drops);
        }
    }

    /**
     * Waits up to {@code timeout} for the next frame.
     *
     * @return the oldest queued frame, or {@code null} on timeout
     */
    public byte[] poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /** Removes and returns all queued frames, oldest first. */
    public List<byte[]> drain() {
        List<byte[]> frames = new ArrayList<>(queue.size());
        queue.drainTo(frames);
        return frames;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return queue.size() + queue.remainingCapacity();
    }

    public long dropCount() {
        return dropCount.get();
    }
}
