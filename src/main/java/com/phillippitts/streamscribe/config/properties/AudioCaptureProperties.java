package com.phillippitts.streamscribe.config.properties;

import com.phillippitts.streamscribe.service.audio.AudioFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for microphone capture and the frame queue.
 *
 * Defaults: 16 kHz, mono, 16-bit PCM, 200 ms blocks, 50 queued frames.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Capture sample rate in Hz. */
    @Min(8_000)
    @Max(48_000)
    private final int sampleRate;

    /** Number of interleaved channels. */
    @Min(1)
    @Max(2)
    private final int channels;

    /** Bytes per sample (2 = 16-bit). */
    @Min(1)
    @Max(4)
    private final int sampleWidthBytes;

    /** Block and chunk duration in milliseconds; drives the capture block size and the flush deadline. */
    @Min(10)
    @Max(1000)
    private final int chunkMillis;

    /** Maximum number of frames held between the capture thread and the pump. */
    @Min(1)
    @Max(10_000)
    private final int queueCapacity;

    /** Capture hard stop in milliseconds; 0 streams until interrupted. */
    @Min(0)
    private final long maxDurationMs;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    @ConstructorBinding
    public AudioCaptureProperties(@DefaultValue("16000") int sampleRate,
                                  @DefaultValue("1") int channels,
                                  @DefaultValue("2") int sampleWidthBytes,
                                  @DefaultValue("200") int chunkMillis,
                                  @DefaultValue("50") int queueCapacity,
                                  @DefaultValue("0") long maxDurationMs,
                                  String deviceName) {
        this.sampleRate = sampleRate;
        this.channels = channels;
        this.sampleWidthBytes = sampleWidthBytes;
        this.chunkMillis = chunkMillis;
        this.queueCapacity = queueCapacity;
        this.maxDurationMs = maxDurationMs;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public int getSampleRate() { return sampleRate; }
    public int getChannels() { return channels; }
    public int getSampleWidthBytes() { return sampleWidthBytes; }
    public int getChunkMillis() { return chunkMillis; }
    public int getQueueCapacity() { return queueCapacity; }
    public long getMaxDurationMs() { return maxDurationMs; }
    public String getDeviceName() { return deviceName; }

    public Duration chunkDuration() {
        return Duration.ofMillis(chunkMillis);
    }

    public AudioFormat audioFormat() {
        return new AudioFormat(sampleRate, channels, sampleWidthBytes);
    }

    /** Bytes per wire chunk: sampleRate x channels x sampleWidth x chunk duration. */
    public int chunkSizeBytes() {
        return audioFormat().bytesFor(chunkDuration());
    }
}
