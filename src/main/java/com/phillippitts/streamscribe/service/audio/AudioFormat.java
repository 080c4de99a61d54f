package com.phillippitts.streamscribe.service.audio;

import java.time.Duration;

/**
 * Raw PCM format of captured and streamed audio: signed, little-endian, interleaved.
 *
 * @param sampleRate samples per second per channel
 * @param channels interleaved channel count
 * @param sampleWidthBytes bytes per sample (2 = 16-bit)
 */
public record AudioFormat(int sampleRate, int channels, int sampleWidthBytes) {

    /** Format expected by the transcription service: 16 kHz, mono, 16-bit. */
    public static final AudioFormat PCM16_MONO_16K = new AudioFormat(16_000, 1, 2);

    /** Java Sound signed flag. */
    public static final boolean SIGNED = true;
    /** Java Sound endian flag (false = little-endian). */
    public static final boolean BIG_ENDIAN = false;

    public AudioFormat {
        if (sampleRate <= 0 || channels <= 0 || sampleWidthBytes <= 0) {
            throw new IllegalArgumentException("Invalid audio format: sampleRate=" + sampleRate
                    + ", channels=" + channels + ", sampleWidthBytes=" + sampleWidthBytes);
        }
    }

    /** Bytes per sample frame (one sample for every channel). */
    public int blockAlign() {
        return sampleWidthBytes * channels;
    }

    /** Bytes per second. */
    public int byteRate() {
        return sampleRate * blockAlign();
    }

    /** Number of sample frames covering the given duration, rounded down. */
    public int framesFor(Duration duration) {
        return (int) ((long) sampleRate * duration.toNanos() / 1_000_000_000L);
    }

    /** Bytes covering the given duration, always a whole number of sample frames. */
    public int bytesFor(Duration duration) {
        return framesFor(duration) * blockAlign();
    }

    public javax.sound.sampled.AudioFormat toJavaSound() {
        return new javax.sound.sampled.AudioFormat(sampleRate, sampleWidthBytes * 8, channels, SIGNED, BIG_ENDIAN);
    }
}
