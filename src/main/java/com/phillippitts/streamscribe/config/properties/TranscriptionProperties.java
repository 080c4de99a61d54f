package com.phillippitts.streamscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings for the remote real-time transcription service.
 *
 * <p>The token is an opaque bearer credential. It is never logged; use
 * {@link com.phillippitts.streamscribe.util.LogSanitizer#maskSecret(String)} when a hint is needed.
 */
@Validated
@ConfigurationProperties(prefix = "transcription")
public class TranscriptionProperties {

    /** Model name: speed, quality or quality_v2. */
    @NotBlank
    private final String model;

    /** Authorization header value, e.g. "Bearer ...". */
    private final String token;

    @NotBlank
    private final String apiBaseUrl;

    @NotBlank
    private final String wsBaseUrl;

    @NotBlank
    private final String createPath;

    @NotBlank
    private final String closePath;

    @NotBlank
    private final String streamPath;

    @NotNull
    private final Duration connectTimeout;

    /** How long one read waits for an inbound message when the caller passes no timeout. */
    @NotNull
    private final Duration readIdleWindow;

    /** Receiver back-off after an empty read. */
    @NotNull
    private final Duration receiverIdleSleep;

    @ConstructorBinding
    public TranscriptionProperties(@DefaultValue("speed") String model,
                                   String token,
                                   @DefaultValue("http://localhost:8080") String apiBaseUrl,
                                   @DefaultValue("ws://localhost:8080") String wsBaseUrl,
                                   @DefaultValue("/api/v1/transcribe/realtime/session") String createPath,
                                   @DefaultValue("/api/v1/transcribe/realtime/close") String closePath,
                                   @DefaultValue("/ws/v1/transcribe") String streamPath,
                                   @DefaultValue("10s") Duration connectTimeout,
                                   @DefaultValue("1s") Duration readIdleWindow,
                                   @DefaultValue("50ms") Duration receiverIdleSleep) {
        this.model = model;
        this.token = token == null ? "" : token;
        this.apiBaseUrl = apiBaseUrl;
        this.wsBaseUrl = wsBaseUrl;
        this.createPath = createPath;
        this.closePath = closePath;
        this.streamPath = streamPath;
        this.connectTimeout = connectTimeout;
        this.readIdleWindow = readIdleWindow;
        this.receiverIdleSleep = receiverIdleSleep;
    }

    public String getModel() { return model; }
    public String getToken() { return token; }
    public String getApiBaseUrl() { return apiBaseUrl; }
    public String getWsBaseUrl() { return wsBaseUrl; }
    public String getCreatePath() { return createPath; }
    public String getClosePath() { return closePath; }
    public String getStreamPath() { return streamPath; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public Duration getReadIdleWindow() { return readIdleWindow; }
    public Duration getReceiverIdleSleep() { return receiverIdleSleep; }
}
