package com.phillippitts.scriberelay.service.engine;

import com.phillippitts.scriberelay.config.audio.AudioCaptureProperties;
import com.phillippitts.scriberelay.domain.AudioFrame;
import com.phillippitts.scriberelay.domain.TranscriptFragment;
import com.phillippitts.scriberelay.service.audio.AudioFormat;
import com.phillippitts.scriberelay.service.audio.capture.AudioCaptureFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Platform-native strategy: frames are fed to an on-device recognizer at the low-latency cadence.
 */
@Component
public class NativeRecognitionEngine extends AbstractCaptureEngine {

    private final NativeRecognizer recognizer;
    private final AudioCaptureProperties captureProps;
    private NativeRecognizer.Session session;

    public NativeRecognitionEngine(AudioCaptureFactory captureFactory,
                                   NativeRecognizer recognizer,
                                   AudioCaptureProperties captureProps,
                                   @Qualifier("frameTimers") ScheduledExecutorService frameTimers) {
        super(captureFactory, frameTimers);
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer must not be null");
        this.captureProps = Objects.requireNonNull(captureProps, "captureProps must not be null");
    }

    @Override
    public LiveEngine kind() {
        return LiveEngine.NATIVE;
    }

    @Override
    public boolean isAvailable() {
        return recognizer.isAvailable();
    }

    @Override
    protected Duration flushInterval() {
        return Duration.ofMillis(captureProps.getStreamingFlushMillis());
    }

    @Override
    protected void doStart() {
        session = recognizer.open(AudioFormat.WIRE_SAMPLE_RATE);
    }

    @Override
    protected void processFrame(AudioFrame frame) {
        deliver(session.accept(frame.pcm()));
    }

    @Override
    protected void doFinish(Runnable whenDone) {
        try {
            deliver(session.finish());
        } finally {
            closeSession();
        }
        whenDone.run();
    }

    @Override
    protected void doAbort() {
        closeSession();
    }

    private void deliver(Optional<TranscriptFragment> fragment) {
        fragment.ifPresent(f -> {
            if (f.partial()) {
                partial(f.text());
            } else {
                commit(f.text());
            }
        });
    }

    private void closeSession() {
        if (session != null) {
            session.close();
            session = null;
        }
    }
}
