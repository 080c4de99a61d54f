package com.phillippitts.streamscribe.service.streaming;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Maps SIGINT/SIGTERM to a JVM shutdown hook.
 *
 * <p>The hook thread runs the handler and blocks until it returns, so the JVM does not halt
 * while the stop sequence is still closing the remote session. Releasing from inside a running
 * shutdown is not possible; that case is logged and ignored.
 */
public final class ShutdownHookSignalRegistration implements StopSignalRegistration {

    private static final Logger LOG = LogManager.getLogger(ShutdownHookSignalRegistration.class);

    private final Thread hook;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private ShutdownHookSignalRegistration(Thread hook) {
        this.hook = hook;
    }

    public static ShutdownHookSignalRegistration register(Runnable onSignal) {
        Objects.requireNonNull(onSignal, "onSignal");
        Thread hook = new Thread(onSignal, "stream-interrupt");
        Runtime.getRuntime().addShutdownHook(hook);
        LOG.debug("Interrupt handler registered");
        return new ShutdownHookSignalRegistration(hook);
    }

    @Override
    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
            LOG.debug("Interrupt handler released");
        } catch (IllegalStateException e) {
            LOG.debug("JVM shutdown in progress; interrupt handler stays installed");
        }
    }
}
