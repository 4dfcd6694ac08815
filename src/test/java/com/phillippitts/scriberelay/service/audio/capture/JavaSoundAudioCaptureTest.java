package com.phillippitts.scriberelay.service.audio.capture;

import com.phillippitts.scriberelay.config.audio.AudioCaptureProperties;
import com.phillippitts.scriberelay.domain.AudioFrame;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.TargetDataLine;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JavaSoundAudioCaptureTest {

    private final AudioCaptureProperties props = new AudioCaptureProperties(48_000, 20, 100, 5000, 2000, null);
    private final List<Object> events = new CopyOnWriteArrayList<>();
    private final ApplicationEventPublisher publisher = events::add;

    private static TargetDataLine steadyLine() throws Exception {
        TargetDataLine line = mock(TargetDataLine.class);
        when(line.read(any(byte[].class), anyInt(), anyInt())).thenAnswer(inv -> {
            Thread.sleep(5);
            Integer len = inv.getArgument(2);
            return len;
        });
        return line;
    }

    @Test
    void capturedAudioIsResampledToWireRate() throws Exception {
        TargetDataLine line = steadyLine();
        JavaSoundAudioCapture capture = new JavaSoundAudioCapture("test", props,
                new MicrophoneManager(Duration.ofMillis(100)), publisher, (fmt, dev) -> line);

        AtomicReference<AudioFrame> frame = new AtomicReference<>();
        capture.start(reason -> { });
        await().atMost(2, SECONDS).until(() -> {
            capture.drain().ifPresent(frame::set);
            return frame.get() != null;
        });
        capture.stop();

        // 20 ms reads at 48 kHz = 1920 bytes, one third of that on the wire
        assertThat(frame.get().sizeBytes() % 640).isZero();
        assertThat(capture.isActive()).isFalse();
        assertThat(events).isEmpty();
        verify(line).close();
    }

    @Test
    void stopReleasesMicrophone() throws Exception {
        MicrophoneManager microphones = new MicrophoneManager(Duration.ofMillis(100));
        TargetDataLine line = steadyLine();
        JavaSoundAudioCapture capture = new JavaSoundAudioCapture("owner", props, microphones, publisher,
                (fmt, dev) -> line);

        capture.start(reason -> { });
        assertThat(microphones.currentOwner()).contains("owner");
        capture.stop();

        assertThat(microphones.currentOwner()).isEmpty();
    }

    @Test
    void unavailableDevicePublishesEventAndReportsFailure() {
        List<String> failures = new CopyOnWriteArrayList<>();
        JavaSoundAudioCapture capture = new JavaSoundAudioCapture("test", props,
                new MicrophoneManager(Duration.ofMillis(100)), publisher, (fmt, dev) -> {
                    throw new LineUnavailableException("No audio device available");
                });

        capture.start(failures::add);

        await().atMost(2, SECONDS).until(() -> !failures.isEmpty());
        assertThat(failures).containsExactly("MIC_UNAVAILABLE");
        assertThat(events).singleElement()
                .isInstanceOfSatisfying(CaptureErrorEvent.class, e -> {
                    assertThat(e.reason()).isEqualTo("MIC_UNAVAILABLE");
                    assertThat(e.owner()).isEqualTo("test");
                });
        capture.stop();
    }

    @Test
    void permissionDeniedIsReported() {
        List<String> failures = new CopyOnWriteArrayList<>();
        JavaSoundAudioCapture capture = new JavaSoundAudioCapture("test", props,
                new MicrophoneManager(Duration.ofMillis(100)), publisher, (fmt, dev) -> {
                    throw new SecurityException("Microphone access denied");
                });

        capture.start(failures::add);

        await().atMost(2, SECONDS).until(() -> !failures.isEmpty());
        assertThat(failures).containsExactly("MIC_PERMISSION_DENIED");
        capture.stop();
    }

    @Test
    void secondStartWhileActiveIsRejected() throws Exception {
        TargetDataLine line = steadyLine();
        MicrophoneManager microphones = new MicrophoneManager(Duration.ofMillis(100));
        JavaSoundAudioCapture capture = new JavaSoundAudioCapture("test", props,
                microphones, publisher, (fmt, dev) -> line);
        capture.start(reason -> { });
        try {
            assertThatThrownBy(() -> capture.start(reason -> { }))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("already running");

            // The running capture keeps its stream and its microphone
            assertThat(capture.isActive()).isTrue();
            assertThat(microphones.currentOwner()).contains("test");
            assertThat(events).isEmpty();
        } finally {
            capture.stop();
        }
    }

    @Test
    void firstBufferOverflowIsReportedOnceWithoutEndingCapture() throws Exception {
        // 40 ms of wire audio; every 20 ms read adds 640 bytes and nothing drains
        AudioCaptureProperties tiny = new AudioCaptureProperties(48_000, 20, 100, 5000, 40, null);
        TargetDataLine line = steadyLine();
        List<String> failures = new CopyOnWriteArrayList<>();
        JavaSoundAudioCapture capture = new JavaSoundAudioCapture("test", tiny,
                new MicrophoneManager(Duration.ofMillis(100)), publisher, (fmt, dev) -> line);

        capture.start(failures::add);
        try {
            await().atMost(2, SECONDS).until(() -> !events.isEmpty());
            // more reads keep overflowing
            Thread.sleep(50);

            assertThat(events).singleElement()
                    .isInstanceOfSatisfying(CaptureErrorEvent.class,
                            e -> assertThat(e.reason()).isEqualTo(JavaSoundAudioCapture.BUFFER_OVERFLOW));
            assertThat(failures).isEmpty();
            assertThat(capture.isActive()).isTrue();
        } finally {
            capture.stop();
        }
    }

    @Test
    void discardDropsBufferedAudio() throws Exception {
        TargetDataLine line = steadyLine();
        JavaSoundAudioCapture capture = new JavaSoundAudioCapture("test", props,
                new MicrophoneManager(Duration.ofMillis(100)), publisher, (fmt, dev) -> line);
        capture.start(reason -> { });
        capture.stop();
        capture.discard();

        assertThat(capture.drain()).isEmpty();
    }
}
