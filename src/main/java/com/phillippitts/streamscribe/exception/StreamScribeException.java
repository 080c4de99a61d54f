package com.phillippitts.streamscribe.exception;

/**
 * Base exception for all streamscribe application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class StreamScribeException extends RuntimeException {

    public StreamScribeException(String message) {
        super(message);
    }

    public StreamScribeException(String message, Throwable cause) {
        super(message, cause);
    }

    public StreamScribeException(Throwable cause) {
        super(cause);
    }
}
