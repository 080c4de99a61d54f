package com.phillippitts.streamscribe.service.audio.capture;

import com.phillippitts.streamscribe.service.audio.AudioFormat;

import java.time.Duration;

/**
 * Microphone frame producer.
 *
 * Contract:
 * - Frames are raw PCM in {@link #format()}, each exactly one block of {@link #blockDuration()}
 * - Frames are delivered in capture order on a thread owned by the source
 * - Closing the returned handle stops delivery
 */
public interface FrameSource {

    /**
     * Opens the device and starts delivering frames to the callback.
     *
     * @throws com.phillippitts.streamscribe.exception.StreamScribeException if the device cannot be opened
     */
    CaptureHandle open(FrameCallback callback);

    AudioFormat format();

    Duration blockDuration();
}
