package com.phillippitts.streamscribe.service.streaming;

import com.phillippitts.streamscribe.service.metrics.StreamingMetrics;
import com.phillippitts.streamscribe.testutil.CapturingAppender;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedFrameChannelTest {

    private static byte[] frame(int marker) {
        return new byte[]{(byte) marker, (byte) marker};
    }

    @Test
    void overflowKeepsNewestFramesAndCountsDrops() {
        // Arrange
        BoundedFrameChannel channel = new BoundedFrameChannel(50);

        // Act: push capacity + 5
        for (int i = 0; i < 55; i++) {
            channel.push(frame(i));
        }

        // Assert: the oldest five were evicted, order of the rest preserved
        assertThat(channel.dropCount()).isEqualTo(5);
        List<byte[]> remaining = channel.drain();
        assertThat(remaining).hasSize(50);
        assertThat(remaining.get(0)[0]).isEqualTo((byte) 5);
        assertThat(remaining.get(49)[0]).isEqualTo((byte) 54);
    }

    @Test
    void overflowWarnsOncePerTenDrops() {
        BoundedFrameChannel channel = new BoundedFrameChannel(1);

        try (CapturingAppender logs = CapturingAppender.attach(BoundedFrameChannel.class, Level.WARN)) {
            // 1 fills the queue, the next 25 each drop one frame
            for (int i = 0; i < 26; i++) {
                channel.push(frame(i));
            }

            assertThat(channel.dropCount()).isEqualTo(25);
            assertThat(logs.messages(Level.WARN)).containsExactly(
                    "Audio queue overflow: 10 frames dropped",
                    "Audio queue overflow: 20 frames dropped");
        }
    }

    @Test
    void emptyAndNullFramesAreIgnored() {
        BoundedFrameChannel channel = new BoundedFrameChannel(2);

        channel.push(new byte[0]);
        channel.push(null);

        assertThat(channel.size()).isZero();
        assertThat(channel.dropCount()).isZero();
    }

    @Test
    void pollReturnsNullOnTimeout() throws InterruptedException {
        BoundedFrameChannel channel = new BoundedFrameChannel(2);

        long start = System.nanoTime();
        byte[] got = channel.poll(Duration.ofMillis(30));

        assertThat(got).isNull();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(25);
    }

    @Test
    void pollHandsOverFramePushedFromAnotherThread() throws Exception {
        BoundedFrameChannel channel = new BoundedFrameChannel(4);
        CountDownLatch polling = new CountDownLatch(1);
        Thread producer = new Thread(() -> {
            try {
                polling.await(1, TimeUnit.SECONDS);
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            channel.push(frame(7));
        });
        producer.start();

        polling.countDown();
        byte[] got = channel.poll(Duration.ofSeconds(2));

        assertThat(got).containsExactly(7, 7);
        producer.join(1000);
    }

    @Test
    void dropsAreReportedToMetrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        BoundedFrameChannel channel = new BoundedFrameChannel(1, new StreamingMetrics(registry));

        channel.push(frame(1));
        channel.push(frame(2));
        channel.push(frame(3));

        assertThat(registry.get("streamscribe.audio.frames.dropped").counter().count()).isEqualTo(2.0);
        assertThat(channel.drain()).singleElement().satisfies(f -> assertThat(f[0]).isEqualTo((byte) 3));
    }

    @Test
    void capacityIsReportedAndMustBePositive() {
        assertThat(new BoundedFrameChannel(50).capacity()).isEqualTo(50);
        assertThatThrownBy(() -> new BoundedFrameChannel(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
    }
}
