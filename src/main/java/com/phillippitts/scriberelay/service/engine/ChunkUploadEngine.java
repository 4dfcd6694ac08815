package com.phillippitts.scriberelay.service.engine;

import com.phillippitts.scriberelay.config.audio.AudioCaptureProperties;
import com.phillippitts.scriberelay.domain.AudioFrame;
import com.phillippitts.scriberelay.exception.ScribeRelayException;
import com.phillippitts.scriberelay.service.audio.WavWriter;
import com.phillippitts.scriberelay.service.audio.capture.AudioCaptureFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Chunked fallback: every flush interval the buffered audio becomes a WAV file that is
 * uploaded on a single background thread, so chunks are transcribed in capture order.
 *
 * <p>{@value #MAX_CONSECUTIVE_FAILURES} consecutive failed chunks end the session.
 */
@Component
public class ChunkUploadEngine extends AbstractCaptureEngine {

    private static final Logger LOG = LogManager.getLogger(ChunkUploadEngine.class);

    static final int MAX_CONSECUTIVE_FAILURES = 3;
    static final String FAILURE_MESSAGE = "Chunked transcription unavailable";

    private final ChunkTranscriptionClient client;
    private final AudioCaptureProperties captureProps;
    private final Supplier<ExecutorService> uploaderFactory;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private ExecutorService uploader;

    @org.springframework.beans.factory.annotation.Autowired
    public ChunkUploadEngine(AudioCaptureFactory captureFactory,
                             ChunkTranscriptionClient client,
                             AudioCaptureProperties captureProps,
                             @Qualifier("frameTimers") ScheduledExecutorService frameTimers) {
        this(captureFactory, client, captureProps, frameTimers, ChunkUploadEngine::newUploader);
    }

    // Package-private for tests
    ChunkUploadEngine(AudioCaptureFactory captureFactory,
                      ChunkTranscriptionClient client,
                      AudioCaptureProperties captureProps,
                      ScheduledExecutorService frameTimers,
                      Supplier<ExecutorService> uploaderFactory) {
        super(captureFactory, frameTimers);
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.captureProps = Objects.requireNonNull(captureProps, "captureProps must not be null");
        this.uploaderFactory = Objects.requireNonNull(uploaderFactory, "uploaderFactory must not be null");
    }

    @Override
    public LiveEngine kind() {
        return LiveEngine.CHUNK;
    }

    @Override
    public boolean isAvailable() {
        return client.isConfigured();
    }

    @Override
    protected Duration flushInterval() {
        return Duration.ofMillis(captureProps.getChunkFlushMillis());
    }

    @Override
    protected void doStart() {
        consecutiveFailures.set(0);
        uploader = uploaderFactory.get();
    }

    @Override
    protected void processFrame(AudioFrame frame) {
        byte[] wav = WavWriter.toWav(frame.pcm());
        try {
            uploader.execute(() -> upload(wav));
        } catch (RejectedExecutionException e) {
            LOG.debug("Chunk dropped after shutdown: bytes={}", wav.length);
        }
    }

    @Override
    protected void doFinish(Runnable whenDone) {
        ExecutorService u = uploader;
        uploader = null;
        u.execute(whenDone);
        u.shutdown();
    }

    @Override
    protected void doAbort() {
        if (uploader != null) {
            uploader.shutdownNow();
            uploader = null;
        }
    }

    private void upload(byte[] wav) {
        try {
            String text = client.transcribe(wav);
            consecutiveFailures.set(0);
            if (!text.isBlank()) {
                commit(text);
            }
        } catch (ScribeRelayException e) {
            recordFailure(e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected chunk upload error", e);
            recordFailure(e.getClass().getSimpleName());
        }
    }

    private void recordFailure(String reason) {
        int failures = consecutiveFailures.incrementAndGet();
        LOG.warn("Chunk upload failed ({} in a row): {}", failures, reason);
        if (failures >= MAX_CONSECUTIVE_FAILURES) {
            fail(FAILURE_MESSAGE);
        }
    }

    private static ExecutorService newUploader() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "chunk-upload");
            t.setDaemon(true);
            return t;
        });
    }
}
