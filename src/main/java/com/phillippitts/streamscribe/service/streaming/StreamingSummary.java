package com.phillippitts.streamscribe.service.streaming;

import com.phillippitts.streamscribe.service.session.SessionCloseResult;

/**
 * Counters and outcome of one finished streaming run.
 *
 * @param closeResult result of closing the remote session, or {@code null} if closing failed
 */
public record StreamingSummary(String sessionId,
                               String taskId,
                               String stopReason,
                               long bytesSent,
                               long chunksSent,
                               long framesDropped,
                               long messagesReceived,
                               SessionCloseResult closeResult) { }
