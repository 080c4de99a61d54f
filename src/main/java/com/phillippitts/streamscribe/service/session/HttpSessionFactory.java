package com.phillippitts.streamscribe.service.session;

import com.phillippitts.streamscribe.config.properties.TranscriptionProperties;
import com.phillippitts.streamscribe.exception.SessionRequestException;
import com.phillippitts.streamscribe.util.LogSanitizer;
import com.phillippitts.streamscribe.util.StreamTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link SessionFactory} backed by the session service's HTTP API and a WebSocket stream.
 *
 * <p>Closing retries every {@link StreamTimeouts#CLOSE_BUSY_RETRY_INTERVAL} while the service
 * answers with the busy error code, until the session closes, another error is returned, or the
 * optional timeout elapses.
 */
public class HttpSessionFactory implements SessionFactory {

    private static final Logger LOG = LogManager.getLogger(HttpSessionFactory.class);

    private final TranscriptionProperties props;
    private final HttpClient httpClient;
    private final Duration busyRetryInterval;

    public HttpSessionFactory(TranscriptionProperties props) {
        this(props,
                HttpClient.newBuilder().connectTimeout(props.getConnectTimeout()).build(),
                StreamTimeouts.CLOSE_BUSY_RETRY_INTERVAL);
    }

    // Package-private for tests
    HttpSessionFactory(TranscriptionProperties props, HttpClient httpClient, Duration busyRetryInterval) {
        this.props = Objects.requireNonNull(props, "props");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.busyRetryInterval = Objects.requireNonNull(busyRetryInterval, "busyRetryInterval");
    }

    @Override
    public SessionHandle createSession(TranscriptionModel model, String credential) {
        Objects.requireNonNull(model, "model");
        URI uri = URI.create(props.getApiBaseUrl() + props.getCreatePath());
        LOG.debug("Creating session at {} (model={}, credential={})",
                uri, model.wireName(), LogSanitizer.maskSecret(credential));
        HttpRequest request = requestBuilder(uri, credential)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(SessionJsonParser.createRequest(model)))
                .build();
        SessionHandle handle = SessionJsonParser.parseCreated(execute(request, "create session"));
        LOG.info("Created session {} (task={}, model={}, maxTime={}s)",
                handle.sessionId(), handle.taskId(), model.wireName(), handle.maxTimeSeconds());
        return handle;
    }

    @Override
    public Session openStream(SessionHandle handle) {
        Objects.requireNonNull(handle, "handle");
        URI uri = URI.create(props.getWsBaseUrl() + props.getStreamPath() + "/"
                + URLEncoder.encode(handle.sessionId(), StandardCharsets.UTF_8));
        return new WebSocketSession(handle, uri, httpClient, props.getConnectTimeout(), props.getReadIdleWindow());
    }

    @Override
    public SessionCloseResult closeSession(String taskId, String credential, Duration timeout) {
        Objects.requireNonNull(taskId, "taskId");
        URI uri = URI.create(props.getApiBaseUrl() + props.getClosePath()
                + "?task_id=" + URLEncoder.encode(taskId, StandardCharsets.UTF_8));
        long deadline = timeout == null ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();
        int attempt = 0;
        while (true) {
            attempt++;
            HttpRequest request = requestBuilder(uri, credential)
                    .POST(HttpRequest.BodyPublishers.noBody())
                    .build();
            SessionCloseResult result = SessionJsonParser.parseClosed(execute(request, "close session"));
            if (!result.isBusy()) {
                if (result.isError()) {
                    throw new SessionRequestException("Session close rejected for task " + taskId
                            + ": " + result.message(), 200, result.errorCode());
                }
                LOG.info("Closed session task {} (status={}, duration={}s, attempts={})",
                        taskId, result.status(), result.duration(), attempt);
                return result;
            }
            if (timeout != null && System.nanoTime() + busyRetryInterval.toNanos() > deadline) {
                throw new SessionRequestException("Timed out closing session task " + taskId
                        + " after " + attempt + " attempts", 200, result.errorCode());
            }
            LOG.info("Session task {} busy; retrying close in {}ms (attempt {})",
                    taskId, busyRetryInterval.toMillis(), attempt);
            try {
                Thread.sleep(busyRetryInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SessionRequestException("Interrupted while closing session task " + taskId, e);
            }
        }
    }

    private HttpRequest.Builder requestBuilder(URI uri, String credential) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(StreamTimeouts.HTTP_REQUEST_TIMEOUT)
                .header("Accept", "application/json");
        if (credential != null && !credential.isBlank()) {
            builder.header("Authorization", credential);
        }
        return builder;
    }

    private String execute(HttpRequest request, String action) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SessionRequestException("Failed to " + action + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionRequestException("Interrupted while trying to " + action, e);
        }
        int status = response.statusCode();
        if (status / 100 != 2) {
            LOG.warn("Session service refused to {}: status={}, body={}",
                    action, status, LogSanitizer.truncate(response.body(), 200));
            throw new SessionRequestException("Failed to " + action, status, SessionJsonParser.errorCode(response.body()));
        }
        return response.body();
    }
}
