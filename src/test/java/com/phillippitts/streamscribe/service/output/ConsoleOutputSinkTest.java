package com.phillippitts.streamscribe.service.output;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleOutputSinkTest {

    @Test
    void writesOneLinePerMessage() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleOutputSink sink = new ConsoleOutputSink(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        sink.accept("{\"text\":\"hello\"}");
        sink.accept("{\"text\":\"wörld\"}");

        assertThat(buffer.toString(StandardCharsets.UTF_8).lines())
                .containsExactly("{\"text\":\"hello\"}", "{\"text\":\"wörld\"}");
    }
}
