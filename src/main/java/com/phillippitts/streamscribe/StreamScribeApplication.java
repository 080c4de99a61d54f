package com.phillippitts.streamscribe;

import com.phillippitts.streamscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.streamscribe.config.properties.ShutdownProperties;
import com.phillippitts.streamscribe.config.properties.TranscriptionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AudioCaptureProperties.class,
        TranscriptionProperties.class,
        ShutdownProperties.class
})
public class StreamScribeApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(StreamScribeApplication.class, args)));
    }

}
