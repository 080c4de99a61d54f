package com.phillippitts.streamscribe.testutil;

import com.phillippitts.streamscribe.exception.StreamScribeException;
import com.phillippitts.streamscribe.service.audio.AudioFormat;
import com.phillippitts.streamscribe.service.audio.capture.CaptureHandle;
import com.phillippitts.streamscribe.service.audio.capture.FrameCallback;
import com.phillippitts.streamscribe.service.audio.capture.FrameSource;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link FrameSource} that plays a fixed list of frames from a background thread.
 *
 * <p>After the last frame the handle either stays open and silent, or reports itself closed
 * when {@link #endAfterScript()} was requested (a device that stopped delivering).
 */
public class ScriptedFrameSource implements FrameSource {

    private final List<byte[]> frames;
    private final Duration interval;
    private final AtomicInteger delivered = new AtomicInteger();
    private final AtomicInteger opened = new AtomicInteger();
    private volatile boolean endAfterScript;
    private volatile RuntimeException openFailure;
    private volatile ScriptHandle lastHandle;

    public ScriptedFrameSource(List<byte[]> frames, Duration interval) {
        this.frames = List.copyOf(frames);
        this.interval = interval;
    }

    /** Frames of {@code size} bytes each, filled with their index. */
    public static List<byte[]> frames(int count, int size) {
        byte[][] out = new byte[count][];
        for (int i = 0; i < count; i++) {
            out[i] = new byte[size];
            Arrays.fill(out[i], (byte) i);
        }
        return List.of(out);
    }

    public ScriptedFrameSource endAfterScript() {
        this.endAfterScript = true;
        return this;
    }

    public ScriptedFrameSource failOpenWith(RuntimeException failure) {
        this.openFailure = failure;
        return this;
    }

    @Override
    public CaptureHandle open(FrameCallback callback) {
        RuntimeException failure = openFailure;
        if (failure != null) {
            throw new StreamScribeException("Capture failed to open: " + failure.getMessage(), failure);
        }
        opened.incrementAndGet();
        ScriptHandle handle = new ScriptHandle(callback);
        lastHandle = handle;
        handle.thread.start();
        return handle;
    }

    @Override
    public AudioFormat format() {
        return AudioFormat.PCM16_MONO_16K;
    }

    @Override
    public Duration blockDuration() {
        return interval;
    }

    public int delivered() {
        return delivered.get();
    }

    public int openCount() {
        return opened.get();
    }

    public boolean lastHandleClosed() {
        ScriptHandle h = lastHandle;
        return h != null && h.closed.get();
    }

    private final class ScriptHandle implements CaptureHandle {
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile boolean exhausted;
        private final Thread thread;

        ScriptHandle(FrameCallback callback) {
            this.thread = new Thread(() -> {
                for (byte[] frame : frames) {
                    if (closed.get()) {
                        return;
                    }
                    callback.onFrame(frame);
                    delivered.incrementAndGet();
                    try {
                        Thread.sleep(interval.toMillis());
                    } catch (InterruptedException e) {
                        return;
                    }
                }
                exhausted = true;
            }, "scripted-capture");
            this.thread.setDaemon(true);
        }

        @Override
        public boolean isOpen() {
            return !closed.get() && !(endAfterScript && exhausted);
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                thread.interrupt();
                try {
                    thread.join(1000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }
}
