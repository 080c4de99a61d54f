package com.phillippitts.streamscribe.service.streaming;

import java.time.Instant;

/**
 * Published when a pipeline task (capture, pump, receiver) ends with an exception.
 *
 * @param task task name
 * @param reason exception type, no message text
 */
public record StreamingFailureEvent(String task, String reason, Instant at) { }
