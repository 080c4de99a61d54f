package com.phillippitts.streamscribe.exception;

/**
 * Thrown when creating or closing a remote transcription session fails.
 * Carries the HTTP status and the service error code when the service returned one.
 */
public class SessionRequestException extends StreamScribeException {

    private final int statusCode;
    private final Integer errorCode;

    public SessionRequestException(String message) {
        super(message);
        this.statusCode = -1;
        this.errorCode = null;
    }

    public SessionRequestException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.errorCode = null;
    }

    public SessionRequestException(String message, int statusCode, Integer errorCode) {
        super(message + " (status=" + statusCode + (errorCode != null ? ", errorCode=" + errorCode : "") + ")");
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    /** HTTP status code, or -1 when the request never produced a response. */
    public int getStatusCode() {
        return statusCode;
    }

    public Integer getErrorCode() {
        return errorCode;
    }
}
