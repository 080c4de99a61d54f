package com.phillippitts.streamscribe.service.session;

import java.time.Duration;

/**
 * Creates and closes remote sessions, and opens streaming connections to them.
 */
public interface SessionFactory {

    /**
     * Creates a real-time session.
     *
     * @param credential bearer credential; opaque, never logged
     * @throws com.phillippitts.streamscribe.exception.SessionRequestException on rejection
     */
    SessionHandle createSession(TranscriptionModel model, String credential);

    /**
     * Opens a streaming connection for a created session. The returned session is not started.
     */
    Session openStream(SessionHandle handle);

    /**
     * Closes a session by task id, retrying while the service reports it busy.
     *
     * @param timeout overall limit, or {@code null} for none
     * @throws com.phillippitts.streamscribe.exception.SessionRequestException on failure or timeout
     */
    SessionCloseResult closeSession(String taskId, String credential, Duration timeout);
}
