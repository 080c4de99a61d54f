package com.phillippitts.streamscribe.presentation;

import com.phillippitts.streamscribe.service.streaming.StreamingPipeline;
import com.phillippitts.streamscribe.service.streaming.StreamingSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts one streaming run when the application starts and blocks until it has stopped.
 *
 * <p>Disabled with {@code streaming.autostart=false}, which tests use to load the context
 * without touching the microphone or the network.
 */
@Component
@ConditionalOnProperty(name = "streaming.autostart", havingValue = "true", matchIfMissing = true)
class StreamingRunner implements CommandLineRunner {

    private static final Logger LOG = LogManager.getLogger(StreamingRunner.class);

    private final StreamingPipeline pipeline;

    StreamingRunner(StreamingPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public void run(String... args) {
        LOG.info("Starting live transcription; press Ctrl+C to stop");
        StreamingSummary summary = pipeline.run();
        if (summary.closeResult() != null) {
            LOG.info("Session {} closed: status={}, duration={}s",
                    summary.sessionId(), summary.closeResult().status(), summary.closeResult().duration());
        } else {
            LOG.warn("Session {} ended without a close confirmation", summary.sessionId());
        }
    }
}
