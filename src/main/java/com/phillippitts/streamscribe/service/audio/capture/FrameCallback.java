package com.phillippitts.streamscribe.service.audio.capture;

/**
 * Receives frames from a {@link FrameSource}.
 *
 * <p>Invoked on the capture thread, never on the caller's thread. Implementations must return
 * quickly and must not block: a slow callback causes the device buffer to overrun.
 */
public interface FrameCallback {

    /** Called exactly once per completed block with that block's raw bytes. */
    void onFrame(byte[] frame);

    /** Device status notification (overrun, line stopped, read failure). */
    void onStatus(String status);
}
