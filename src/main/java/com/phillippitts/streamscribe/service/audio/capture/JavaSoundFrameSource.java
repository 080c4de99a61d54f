package com.phillippitts.streamscribe.service.audio.capture;

import com.phillippitts.streamscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.streamscribe.exception.StreamScribeException;
import com.phillippitts.streamscribe.service.audio.AudioFormat;
import com.phillippitts.streamscribe.util.StreamTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Java Sound based microphone capture that delivers fixed-size PCM blocks to a callback.
 *
 * <p>Each open handle owns a daemon {@code audio-capture} thread that reads exactly one block
 * per iteration from the {@link TargetDataLine}. Short reads are accumulated until the block is
 * complete, so the callback never sees a partial or batched block.
 *
 * <p>This is the default implementation of {@link FrameSource}.
 * Test configurations can provide alternative implementations by marking them as @Primary.
 */
@Service
public class JavaSoundFrameSource implements FrameSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundFrameSource.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;

    @Autowired
    public JavaSoundFrameSource(AudioCaptureProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, defaultProvider());
    }

    // Package-private for tests
    JavaSoundFrameSource(AudioCaptureProperties props,
                         ApplicationEventPublisher publisher,
                         DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
    }

    @PostConstruct
    public void logSystemInfo() {
        String os = System.getProperty("os.name");
        String arch = System.getProperty("os.arch");
        int mixerCount = AudioSystem.getMixerInfo().length;
        String device = props.getDeviceName() != null ? props.getDeviceName() : "default";

        LOG.info("Audio capture initialized: OS={}, arch={}, device='{}', available-mixers={}, block={}ms",
                os, arch, device, mixerCount, props.getChunkMillis());
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            Mixer.Info[] mixers = AudioSystem.getMixerInfo();
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : mixers) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
                if (line == null) {
                    LOG.warn("Input device '{}' not found; using system default", device.get());
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public AudioFormat format() {
        return props.audioFormat();
    }

    @Override
    public Duration blockDuration() {
        return props.chunkDuration();
    }

    @Override
    public CaptureHandle open(FrameCallback callback) {
        Objects.requireNonNull(callback, "callback");
        AudioFormat format = format();
        int blockBytes = format.bytesFor(blockDuration());
        TargetDataLine line;
        try {
            line = provider.open(format.toJavaSound(), Optional.ofNullable(props.getDeviceName()));
        } catch (LineUnavailableException e) {
            LOG.warn("Microphone unavailable: {}", e.getMessage());
            publisher.publishEvent(new CaptureErrorEvent("MIC_UNAVAILABLE", Instant.now()));
            throw new StreamScribeException("Microphone unavailable: " + e.getMessage(), e);
        } catch (SecurityException se) {
            LOG.warn("Microphone access denied: {}", se.getMessage());
            publisher.publishEvent(new CaptureErrorEvent("MIC_PERMISSION_DENIED", Instant.now()));
            throw new StreamScribeException("Microphone access denied: " + se.getMessage(), se);
        } catch (RuntimeException re) {
            LOG.warn("Capture failed to open: {}", re.toString());
            publisher.publishEvent(new CaptureErrorEvent("CAPTURE_ERROR", Instant.now()));
            throw new StreamScribeException("Capture failed to open: " + re.getMessage(), re);
        }

        LineHandle handle = new LineHandle(line, callback, blockBytes);
        handle.start();
        LOG.info("Capture line open: sampleRate={} Hz, channels={}, sampleWidth={} bytes, block={} bytes",
                format.sampleRate(), format.channels(), format.sampleWidthBytes(), blockBytes);
        return handle;
    }

    /**
     * Handle over one open line. Callback delivery and close share {@code deliveryLock}, which
     * makes "close returned" imply "no callback running and none to come".
     */
    private final class LineHandle implements CaptureHandle {
        private final TargetDataLine line;
        private final FrameCallback callback;
        private final int blockBytes;
        private final AtomicBoolean active = new AtomicBoolean(false);
        private final Object deliveryLock = new Object();
        private volatile Thread thread;
        private volatile boolean ended;

        LineHandle(TargetDataLine line, FrameCallback callback, int blockBytes) {
            this.line = line;
            this.callback = callback;
            this.blockBytes = blockBytes;
        }

        void start() {
            active.set(true);
            line.start();
            Thread t = new Thread(this::readLoop, "audio-capture");
            t.setDaemon(true);
            thread = t;
            t.start();
        }

        private void readLoop() {
            byte[] block = new byte[blockBytes];
            int filled = 0;
            long frames = 0;
            try {
                while (active.get()) {
                    int n = line.read(block, filled, blockBytes - filled);
                    if (n <= 0) {
                        if (active.get() && !line.isOpen()) {
                            reportStatus("input line closed unexpectedly");
                            break;
                        }
                        continue;
                    }
                    filled += n;
                    if (filled == blockBytes) {
                        deliver(Arrays.copyOf(block, blockBytes));
                        filled = 0;
                        frames++;
                    }
                }
            } catch (RuntimeException e) {
                if (active.get()) {
                    reportStatus("read failed: " + e);
                    publisher.publishEvent(new CaptureErrorEvent("CAPTURE_ERROR", Instant.now()));
                }
            } finally {
                ended = true;
            }
            LOG.info("Audio capture thread finished: {} frames delivered", frames);
        }

        private void deliver(byte[] frame) {
            synchronized (deliveryLock) {
                if (!active.get()) {
                    return;
                }
                try {
                    callback.onFrame(frame);
                } catch (RuntimeException e) {
                    LOG.warn("Frame callback failed: {}", e.toString());
                }
            }
        }

        private void reportStatus(String status) {
            LOG.warn("Capture status: {}", status);
            synchronized (deliveryLock) {
                if (!active.get()) {
                    return;
                }
                try {
                    callback.onStatus(status);
                } catch (RuntimeException e) {
                    LOG.warn("Status callback failed: {}", e.toString());
                }
            }
        }

        @Override
        public boolean isOpen() {
            return active.get() && !ended;
        }

        @Override
        public void close() {
            synchronized (deliveryLock) {
                if (!active.compareAndSet(true, false)) {
                    return;
                }
            }
            try {
                line.stop();
                line.close();
            } catch (RuntimeException e) {
                LOG.debug("Error while closing capture line: {}", e.toString());
            }
            joinThread(thread, StreamTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
            LOG.info("Capture line closed");
        }

        private void joinThread(Thread t, long timeoutMs) {
            if (t == null || !t.isAlive() || t == Thread.currentThread()) {
                return;
            }
            try {
                t.join(timeoutMs);
                if (t.isAlive()) {
                    LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for capture thread to terminate");
            }
        }
    }
}
