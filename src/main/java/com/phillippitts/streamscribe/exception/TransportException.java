package com.phillippitts.streamscribe.exception;

/**
 * Thrown when a send or receive on the streaming session fails.
 *
 * <p>Mid-stream transport failures are not retried; the pipeline treats them as a stop request.
 */
public class TransportException extends StreamScribeException {

    private final String sessionId;

    public TransportException(String message, String sessionId) {
        super(message + " (session: " + sessionId + ")");
        this.sessionId = sessionId;
    }

    public TransportException(String message, String sessionId, Throwable cause) {
        super(message + " (session: " + sessionId + ")", cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
