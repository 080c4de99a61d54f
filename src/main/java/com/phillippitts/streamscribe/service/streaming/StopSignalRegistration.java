package com.phillippitts.streamscribe.service.streaming;

/**
 * Registration of an interrupt-signal handler for one streaming run.
 */
public interface StopSignalRegistration {

    /** Removes the handler. Releasing twice is a no-op. */
    void release();

    /** Installs a handler that runs {@code onSignal} when the process is interrupted. */
    @FunctionalInterface
    interface Registrar {
        StopSignalRegistration register(Runnable onSignal);
    }
}
