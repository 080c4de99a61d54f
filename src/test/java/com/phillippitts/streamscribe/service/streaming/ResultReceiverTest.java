package com.phillippitts.streamscribe.service.streaming;

import com.phillippitts.streamscribe.service.metrics.StreamingMetrics;
import com.phillippitts.streamscribe.testutil.CollectingOutputSink;
import com.phillippitts.streamscribe.testutil.RecordingSession;
import com.phillippitts.streamscribe.testutil.RecordingSessionFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ResultReceiverTest {

    private final RecordingSession session = new RecordingSession(RecordingSessionFactory.HANDLE);
    private final PipelineFlags flags = new PipelineFlags();
    private final CollectingOutputSink sink = new CollectingOutputSink();

    @Test
    void forwardsMessagesInArrivalOrder() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ResultReceiver receiver = new ResultReceiver(session, flags, sink, Duration.ofMillis(5),
                new StreamingMetrics(registry));
        CompletableFuture<Void> run = CompletableFuture.runAsync(receiver);

        session.emit("{\"text\":\"hello\"}");
        session.emit("{\"text\":\"world\"}");
        await().atMost(2, TimeUnit.SECONDS).until(() -> sink.messages().size() == 2);
        flags.cancel();
        run.join();

        assertThat(sink.messages()).containsExactly("{\"text\":\"hello\"}", "{\"text\":\"world\"}");
        assertThat(receiver.messagesReceived()).isEqualTo(2);
        assertThat(registry.get("streamscribe.messages.received").counter().count()).isEqualTo(2.0);
        assertThat(receiver.endedByRemote()).isFalse();
    }

    @Test
    void drainsBufferedMessagesBeforeEndingOnRemoteClose() {
        session.emit("last");
        session.closeRemotely();
        ResultReceiver receiver = new ResultReceiver(session, flags, sink, Duration.ofMillis(5), null);

        receiver.run();

        assertThat(sink.messages()).containsExactly("last");
        assertThat(receiver.endedByRemote()).isTrue();
    }

    @Test
    void exitsPromptlyWhenCancelledWhileIdle() {
        ResultReceiver receiver = new ResultReceiver(session, flags, sink, Duration.ofMillis(5), null);
        CompletableFuture<Void> run = CompletableFuture.runAsync(receiver);

        flags.cancel();

        await().atMost(1, TimeUnit.SECONDS).until(run::isDone);
        assertThat(sink.messages()).isEmpty();
    }
}
