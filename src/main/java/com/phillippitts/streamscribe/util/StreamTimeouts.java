package com.phillippitts.streamscribe.util;

import java.time.Duration;

/**
 * Standard timing values for capture and streaming thread management.
 *
 * <p>Centralized constants keep the loops consistent. Values that operators may want to tune
 * live in configuration properties instead.
 *
 * @since 1.0
 */
public final class StreamTimeouts {

    /**
     * Interval at which the capture task re-checks the cancellation flag while the device
     * delivers frames on its own thread.
     */
    public static final Duration CAPTURE_POLL_INTERVAL = Duration.ofMillis(50);

    /**
     * Timeout for the audio capture thread to terminate when the capture handle is closed.
     *
     * <p>Reads block for at most one block duration, so 1000ms leaves headroom for the
     * final read to return.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /** Interval between close attempts while the service reports the session as busy. */
    public static final Duration CLOSE_BUSY_RETRY_INTERVAL = Duration.ofSeconds(2);

    /** Timeout for one request to the session service's HTTP API. */
    public static final Duration HTTP_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    /** Timeout for the end-of-stream message and close frame when a stream is stopped. */
    public static final Duration STREAM_STOP_TIMEOUT = Duration.ofSeconds(5);

    /** Service error code meaning the session is still busy and close should be retried. */
    public static final int CLOSE_BUSY_ERROR_CODE = 4;

    private StreamTimeouts() {
        // Utility class - prevent instantiation
    }
}
