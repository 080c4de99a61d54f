package com.phillippitts.streamscribe.service.session;

import com.phillippitts.streamscribe.util.StreamTimeouts;

/**
 * Outcome of closing a remote session.
 *
 * @param status service status string
 * @param duration billed session duration in seconds, if reported
 * @param errorCode service error code, if any
 * @param message service message, if any
 */
public record SessionCloseResult(String status, Integer duration, Integer errorCode, String message) {

    /** True when the service asks the caller to retry because the session is still busy. */
    public boolean isBusy() {
        return errorCode != null && errorCode == StreamTimeouts.CLOSE_BUSY_ERROR_CODE;
    }

    public boolean isError() {
        return errorCode != null && errorCode != 0;
    }
}
