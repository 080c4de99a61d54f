package com.phillippitts.streamscribe.service.session;

import java.time.Duration;
import java.util.Optional;

/**
 * Bidirectional streaming connection to one remote transcription session.
 *
 * <p>Sends are serialized by the implementation; callers never send in parallel on one session.
 */
public interface Session {

    SessionHandle handle();

    /** Opens the connection. Calling it again on a started session is a no-op. */
    void start();

    /**
     * Sends one unit of audio bytes.
     *
     * @throws com.phillippitts.streamscribe.exception.TransportException on write failure
     */
    void sendBytes(byte[] data);

    /**
     * Sends a text control message.
     *
     * @throws com.phillippitts.streamscribe.exception.TransportException on write failure
     */
    void sendText(String message);

    /**
     * Returns the next inbound message.
     *
     * @param timeout maximum wait, or {@code null} to use the session's own idle window
     * @return the message, or empty when none arrived in time or the stream has ended
     */
    Optional<String> readNext(Duration timeout);

    /** Signals end of audio and closes the connection. Idempotent. */
    void stop();

    /** True once the remote side has closed the stream and no buffered messages remain. */
    boolean isRemoteClosed();
}
