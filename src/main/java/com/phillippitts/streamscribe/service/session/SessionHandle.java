package com.phillippitts.streamscribe.service.session;

import java.util.Objects;

/**
 * Identity of one remote real-time session, assigned at creation and immutable.
 *
 * @param sessionId identifies the streaming connection
 * @param taskId identifies the server-side task; used to close the session
 * @param usageId billing/usage record id (may be empty)
 * @param maxTimeSeconds server-side session time limit; 0 when not reported
 */
public record SessionHandle(String sessionId, String taskId, String usageId, int maxTimeSeconds) {

    public SessionHandle {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(taskId, "taskId");
        if (sessionId.isBlank() || taskId.isBlank()) {
            throw new IllegalArgumentException("sessionId and taskId must not be blank");
        }
        usageId = usageId == null ? "" : usageId;
    }
}
