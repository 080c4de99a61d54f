package com.phillippitts.streamscribe.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tuning for the stop sequence.
 */
@Validated
@ConfigurationProperties(prefix = "shutdown")
public class ShutdownProperties {

    /** Upper bound on waiting for the pump's exit flush before the session is stopped. */
    @NotNull
    private final Duration flushWait;

    /** Timeout for closing the remote session; unset means none is enforced. */
    private final Duration closeTimeout;

    @ConstructorBinding
    public ShutdownProperties(@DefaultValue("2s") Duration flushWait, Duration closeTimeout) {
        this.flushWait = flushWait;
        this.closeTimeout = closeTimeout;
    }

    public Duration getFlushWait() { return flushWait; }

    /** @return close timeout, or {@code null} when none is enforced */
    public Duration getCloseTimeout() { return closeTimeout; }
}
