package com.phillippitts.streamscribe.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void streamScribeExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        StreamScribeException ex = new StreamScribeException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void transportExceptionShouldCarrySessionId() {
        TransportException ex = new TransportException("send failed", "s-1", new IOException("reset"));

        assertThat(ex).isInstanceOf(StreamScribeException.class);
        assertThat(ex.getSessionId()).isEqualTo("s-1");
        assertThat(ex.getCause()).hasMessage("reset");
    }

    @Test
    void sessionRequestExceptionWithoutResponseHasNoStatus() {
        SessionRequestException ex = new SessionRequestException("Failed to create session", new IOException("refused"));

        assertThat(ex).isInstanceOf(StreamScribeException.class);
        assertThat(ex.getStatusCode()).isEqualTo(-1);
        assertThat(ex.getErrorCode()).isNull();
    }

    @Test
    void sessionRequestExceptionShouldCarryStatusAndErrorCode() {
        SessionRequestException ex = new SessionRequestException("Failed to close session", 200, 4);

        assertThat(ex.getStatusCode()).isEqualTo(200);
        assertThat(ex.getErrorCode()).isEqualTo(4);
    }
}
