package com.phillippitts.streamscribe.config;

import com.phillippitts.streamscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.streamscribe.service.audio.AudioFormat;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Configuration;

/**
 * Startup sanity check for the capture format and chunk size.
 * Logs the effective format and fails fast if misconfigured.
 */
@Configuration
class AudioFormatConfig {
    private static final Logger LOG = LogManager.getLogger(AudioFormatConfig.class);

    private final AudioCaptureProperties props;

    AudioFormatConfig(AudioCaptureProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validateAudioFormat() {
        AudioFormat format = props.audioFormat();
        int chunkBytes = props.chunkSizeBytes();
        if (chunkBytes <= 0 || chunkBytes % format.blockAlign() != 0) {
            throw new IllegalStateException("Audio chunk misconfigured: " + props.getChunkMillis()
                    + "ms yields " + chunkBytes + " bytes for block align " + format.blockAlign());
        }
        LOG.info("Audio format configured: sampleRate={} Hz, sampleWidth={} bytes, channels={}, "
                        + "byteRate={}, chunk={}ms ({} bytes), queueCapacity={}",
                format.sampleRate(), format.sampleWidthBytes(), format.channels(),
                format.byteRate(), props.getChunkMillis(), chunkBytes, props.getQueueCapacity());
    }
}
