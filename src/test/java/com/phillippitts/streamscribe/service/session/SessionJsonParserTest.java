package com.phillippitts.streamscribe.service.session;

import com.phillippitts.streamscribe.exception.SessionRequestException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionJsonParserTest {

    @Test
    void createRequestCarriesModelWireName() {
        JSONObject body = new JSONObject(SessionJsonParser.createRequest(TranscriptionModel.QUALITY_V2));

        assertThat(body.getString("model")).isEqualTo("quality_v2");
    }

    @Test
    void parsesCreatedSessionAtRoot() {
        SessionHandle h = SessionJsonParser.parseCreated(
                "{\"task_id\":\"t-9\",\"session_id\":\"s-9\",\"usage_id\":\"u-9\",\"max_time\":3600}");

        assertThat(h.taskId()).isEqualTo("t-9");
        assertThat(h.sessionId()).isEqualTo("s-9");
        assertThat(h.usageId()).isEqualTo("u-9");
        assertThat(h.maxTimeSeconds()).isEqualTo(3600);
    }

    @Test
    void parsesCreatedSessionInsideDataWrapper() {
        SessionHandle h = SessionJsonParser.parseCreated(
                "{\"status\":\"ok\",\"data\":{\"task_id\":\"t-1\",\"session_id\":\"s-1\"}}");

        assertThat(h.taskId()).isEqualTo("t-1");
        assertThat(h.usageId()).isEmpty();
        assertThat(h.maxTimeSeconds()).isZero();
    }

    @Test
    void missingIdsAreRejected() {
        assertThatThrownBy(() -> SessionJsonParser.parseCreated("{\"task_id\":\"t-1\"}"))
                .isInstanceOf(SessionRequestException.class)
                .hasMessageContaining("session_id");
    }

    @Test
    void malformedAndEmptyBodiesAreRejected() {
        assertThatThrownBy(() -> SessionJsonParser.parseCreated("not json"))
                .isInstanceOf(SessionRequestException.class)
                .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> SessionJsonParser.parseClosed(" "))
                .isInstanceOf(SessionRequestException.class)
                .hasMessageContaining("Empty");
    }

    @Test
    void parsesCloseResultWithBusyCode() {
        SessionCloseResult r = SessionJsonParser.parseClosed(
                "{\"status\":\"busy\",\"error_code\":4,\"message\":\"session still processing\"}");

        assertThat(r.isBusy()).isTrue();
        assertThat(r.isError()).isTrue();
        assertThat(r.message()).isEqualTo("session still processing");
        assertThat(r.duration()).isNull();
    }

    @Test
    void parsesSuccessfulCloseWithStringNumbers() {
        SessionCloseResult r = SessionJsonParser.parseClosed(
                "{\"data\":{\"duration\":\"42\"},\"status\":\"closed\",\"error_code\":0}");

        assertThat(r.status()).isEqualTo("closed");
        assertThat(r.duration()).isEqualTo(42);
        assertThat(r.isBusy()).isFalse();
        assertThat(r.isError()).isFalse();
    }

    @Test
    void errorCodeIsNullForUnparseableBody() {
        assertThat(SessionJsonParser.errorCode("<html>bad gateway</html>")).isNull();
        assertThat(SessionJsonParser.errorCode("{\"error_code\":17}")).isEqualTo(17);
    }
}
