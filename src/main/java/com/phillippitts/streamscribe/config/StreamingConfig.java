package com.phillippitts.streamscribe.config;

import com.phillippitts.streamscribe.config.properties.TranscriptionProperties;
import com.phillippitts.streamscribe.service.output.ConsoleOutputSink;
import com.phillippitts.streamscribe.service.output.OutputSink;
import com.phillippitts.streamscribe.service.session.HttpSessionFactory;
import com.phillippitts.streamscribe.service.session.SessionFactory;
import com.phillippitts.streamscribe.service.streaming.ShutdownHookSignalRegistration;
import com.phillippitts.streamscribe.service.streaming.StopSignalRegistration;
import com.phillippitts.streamscribe.util.LogSanitizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the default collaborators of the streaming pipeline. Each bean backs off when a test
 * configuration supplies its own.
 */
@Configuration
public class StreamingConfig {

    private static final Logger LOG = LogManager.getLogger(StreamingConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public SessionFactory sessionFactory(TranscriptionProperties props) {
        if (props.getToken().isBlank()) {
            LOG.warn("No transcription token configured (set TRANSCRIPTION_TOKEN); session requests will be rejected");
        } else {
            LOG.info("Transcription service: api={}, stream={}, model={}, token={}",
                    props.getApiBaseUrl(), props.getWsBaseUrl(), props.getModel(),
                    LogSanitizer.maskSecret(props.getToken()));
        }
        return new HttpSessionFactory(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public OutputSink outputSink() {
        return new ConsoleOutputSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public StopSignalRegistration.Registrar stopSignalRegistrar() {
        return ShutdownHookSignalRegistration::register;
    }

    /** Local registry for the pipeline counters; no exporter is attached. */
    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
