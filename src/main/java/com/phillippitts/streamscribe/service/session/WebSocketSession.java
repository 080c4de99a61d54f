package com.phillippitts.streamscribe.service.session;

import com.phillippitts.streamscribe.exception.TransportException;
import com.phillippitts.streamscribe.util.LogSanitizer;
import com.phillippitts.streamscribe.util.StreamTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link Session} over a JDK {@link WebSocket}.
 *
 * <p>Audio goes out as binary frames; results arrive as text messages and are buffered until
 * {@link #readNext(Duration)} takes them. Sends, text control messages and stop share one lock,
 * so at most one outbound operation is in flight.
 */
public class WebSocketSession implements Session {

    private static final Logger LOG = LogManager.getLogger(WebSocketSession.class);

    /** Control message telling the service no more audio follows. */
    static final String END_OF_STREAM_MESSAGE = "{\"action\":\"stop\"}";

    private final SessionHandle handle;
    private final URI uri;
    private final HttpClient httpClient;
    private final Duration connectTimeout;
    private final Duration idleWindow;

    private final BlockingQueue<String> inbound = new LinkedBlockingQueue<>();
    private final Object sendLock = new Object();
    private volatile WebSocket socket;
    private volatile boolean stopped;
    private volatile boolean remoteClosed;

    public WebSocketSession(SessionHandle handle, URI uri, HttpClient httpClient,
                            Duration connectTimeout, Duration idleWindow) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.idleWindow = Objects.requireNonNull(idleWindow, "idleWindow");
    }

    @Override
    public SessionHandle handle() {
        return handle;
    }

    @Override
    public void start() {
        synchronized (sendLock) {
            if (socket != null) {
                return;
            }
            if (stopped) {
                throw new TransportException("Stream already stopped", handle.sessionId());
            }
            LOG.debug("Connecting stream {}", uri);
            CompletableFuture<WebSocket> connecting = httpClient.newWebSocketBuilder()
                    .connectTimeout(connectTimeout)
                    .buildAsync(uri, new InboundListener());
            try {
                socket = connecting.get(connectTimeout.toMillis() * 2, TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                throw new TransportException("Failed to open stream", handle.sessionId(), e.getCause());
            } catch (TimeoutException e) {
                connecting.cancel(true);
                throw new TransportException("Timed out opening stream", handle.sessionId(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("Interrupted while opening stream", handle.sessionId(), e);
            }
            LOG.info("Stream connected for session {}", handle.sessionId());
        }
    }

    @Override
    public void sendBytes(byte[] data) {
        Objects.requireNonNull(data, "data");
        synchronized (sendLock) {
            WebSocket ws = requireWritable();
            await(ws.sendBinary(ByteBuffer.wrap(data), true), "send " + data.length + " bytes");
        }
    }

    @Override
    public void sendText(String message) {
        Objects.requireNonNull(message, "message");
        synchronized (sendLock) {
            WebSocket ws = requireWritable();
            await(ws.sendText(message, true), "send control message");
        }
    }

    @Override
    public Optional<String> readNext(Duration timeout) {
        Duration wait = timeout != null ? timeout : idleWindow;
        if (wait.isNegative()) {
            wait = Duration.ZERO;
        }
        try {
            return Optional.ofNullable(inbound.poll(wait.toNanos(), TimeUnit.NANOSECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public void stop() {
        synchronized (sendLock) {
            if (stopped) {
                return;
            }
            stopped = true;
            WebSocket ws = socket;
            if (ws == null || ws.isOutputClosed()) {
                return;
            }
            try {
                ws.sendText(END_OF_STREAM_MESSAGE, true)
                        .get(StreamTimeouts.STREAM_STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "stop")
                        .get(StreamTimeouts.STREAM_STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                LOG.info("Stream stopped for session {}", handle.sessionId());
            } catch (ExecutionException e) {
                ws.abort();
                throw new TransportException("Failed to stop stream", handle.sessionId(), e.getCause());
            } catch (TimeoutException e) {
                ws.abort();
                throw new TransportException("Timed out stopping stream", handle.sessionId(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ws.abort();
                throw new TransportException("Interrupted while stopping stream", handle.sessionId(), e);
            }
        }
    }

    @Override
    public boolean isRemoteClosed() {
        return remoteClosed && inbound.isEmpty();
    }

    private WebSocket requireWritable() {
        WebSocket ws = socket;
        if (ws == null) {
            throw new TransportException("Stream not started", handle.sessionId());
        }
        if (stopped) {
            throw new TransportException("Stream already stopped", handle.sessionId());
        }
        if (remoteClosed || ws.isOutputClosed()) {
            throw new TransportException("Stream closed by remote", handle.sessionId());
        }
        return ws;
    }

    private void await(CompletableFuture<WebSocket> pending, String action) {
        try {
            pending.get();
        } catch (ExecutionException e) {
            throw new TransportException("Failed to " + action, handle.sessionId(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while trying to " + action, handle.sessionId(), e);
        }
    }

    private final class InboundListener implements WebSocket.Listener {
        private final StringBuilder partial = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String message = partial.toString();
                partial.setLength(0);
                LOG.debug("Received message ({} chars): {}", message.length(), LogSanitizer.truncate(message, 120));
                inbound.offer(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            LOG.debug("Ignoring binary message ({} bytes)", data.remaining());
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            remoteClosed = true;
            LOG.info("Stream closed by remote: session={}, code={}, reason={}",
                    handle.sessionId(), statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            remoteClosed = true;
            LOG.warn("Stream error for session {}: {}", handle.sessionId(), error.toString());
        }
    }
}
