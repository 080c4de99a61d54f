package com.phillippitts.streamscribe.service.audio.capture;

/**
 * Scoped handle to an open capture device.
 *
 * <p>When {@link #close()} returns, no further {@link FrameCallback} invocations occur and any
 * invocation that was in progress has completed. Closing twice is a no-op.
 */
public interface CaptureHandle extends AutoCloseable {

    boolean isOpen();

    @Override
    void close();
}
