package com.phillippitts.streamscribe.service.streaming;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and session-closed flags shared by every stage of one streaming run.
 *
 * <p>Both flags are monotonic (false to true). Only the {@link ShutdownCoordinator} sets them;
 * the loops read them at iteration boundaries.
 *
 * <p><b>Thread Safety:</b> All methods are thread-safe.
 */
public final class PipelineFlags {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean sessionClosed = new AtomicBoolean(false);

    /**
     * @return {@code true} only for the call that flipped the flag
     */
    boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Set once {@code Session.stop()} has returned; no sends are legal afterwards. */
    void markSessionClosed() {
        sessionClosed.set(true);
    }

    public boolean isSessionClosed() {
        return sessionClosed.get();
    }
}
