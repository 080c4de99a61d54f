package com.phillippitts.streamscribe.service.streaming;

/**
 * Lifecycle of one streaming run as seen by the {@link ShutdownCoordinator}.
 *
 * <pre>
 * RUNNING → STOPPING (first stop request)
 * STOPPING → STOPPED (after the session close step completed or failed)
 * </pre>
 */
public enum ShutdownState {
    RUNNING,
    STOPPING,
    STOPPED
}
