package com.phillippitts.scriberelay.service.engine;

import com.phillippitts.scriberelay.client.TranscriptReconciler;
import com.phillippitts.scriberelay.domain.AudioFrame;
import com.phillippitts.scriberelay.service.audio.capture.AudioCapture;
import com.phillippitts.scriberelay.service.audio.capture.AudioCaptureFactory;
import com.phillippitts.scriberelay.service.audio.capture.FrameTicker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Base class of engines that read the microphone themselves and process frames on a timer.
 *
 * <p>Template methods:
 * <ul>
 *   <li>{@link #flushInterval()} - how often buffered audio is handed to {@link #processFrame}</li>
 *   <li>{@link #doStart()} - opens engine resources before capture starts</li>
 *   <li>{@link #processFrame(AudioFrame)} - consumes one drained frame</li>
 *   <li>{@link #doFinish(Runnable)} - flushes after the last frame; runs the callback when done</li>
 *   <li>{@link #doAbort()} - releases engine resources after a failure</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> lifecycle and frame processing are serialized on {@link #lock}.
 * Callbacks are invoked while holding it, so callers must not call back into the engine from
 * a callback.
 */
public abstract class AbstractCaptureEngine implements LiveTranscriptEngine {

    private static final Logger LOG = LogManager.getLogger(AbstractCaptureEngine.class);

    static final String MICROPHONE_FAILURE_MESSAGE = "Microphone unavailable";

    protected final Object lock = new Object();

    private final AudioCaptureFactory captureFactory;
    private final ScheduledExecutorService frameTimers;
    private AudioCapture capture;
    private FrameTicker ticker;
    private EngineCallbacks callbacks;
    private TranscriptReconciler reconciler;
    private boolean running;

    protected AbstractCaptureEngine(AudioCaptureFactory captureFactory, ScheduledExecutorService frameTimers) {
        this.captureFactory = Objects.requireNonNull(captureFactory, "captureFactory must not be null");
        this.frameTimers = Objects.requireNonNull(frameTimers, "frameTimers must not be null");
    }

    @Override
    public final void start(String committedSoFar, EngineCallbacks cb) {
        Objects.requireNonNull(cb, "callbacks must not be null");
        synchronized (lock) {
            if (running) {
                throw new IllegalStateException(kind() + " engine already running");
            }
            callbacks = cb;
            reconciler = new TranscriptReconciler();
            reconciler.seed(committedSoFar);
            try {
                doStart();
                AudioCapture c = captureFactory.create(kind().tag() + "-engine");
                capture = c;
                c.start(this::onCaptureFailure);
                FrameTicker t = new FrameTicker(frameTimers);
                ticker = t;
                running = true;
                t.start(flushInterval(), this::flush);
            } catch (RuntimeException e) {
                LOG.warn("{} engine failed to start: {}", kind(), e.toString());
                releaseLocked();
                doAbort();
                cb.onFailure(kind().label() + " failed to start");
                return;
            }
            LOG.info("{} engine started: flush={}ms", kind(), flushInterval().toMillis());
            cb.onReady();
        }
    }

    @Override
    public final void stop() {
        synchronized (lock) {
            if (!running) {
                return;
            }
            running = false;
            ticker.close();
            capture.stop();
            capture.drain().ifPresent(this::processSafely);
            capture = null;
            ticker = null;
            EngineCallbacks cb = callbacks;
            doFinish(() -> {
                LOG.info("{} engine stopped", kind());
                cb.onStopped();
            });
        }
    }

    public final boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    private void flush() {
        synchronized (lock) {
            if (!running) {
                return;
            }
            capture.drain().ifPresent(this::processSafely);
        }
    }

    private void processSafely(AudioFrame frame) {
        try {
            processFrame(frame);
        } catch (RuntimeException e) {
            LOG.warn("{} engine failed to process a frame: {}", kind(), e.toString());
            fail(kind().label() + " stopped unexpectedly");
        }
    }

    private void onCaptureFailure(String reason) {
        LOG.warn("{} engine capture failed: reason={}", kind(), reason);
        fail(MICROPHONE_FAILURE_MESSAGE);
    }

    /** Ends the session with a failure; no-op once stopped. */
    protected final void fail(String message) {
        synchronized (lock) {
            if (!running) {
                return;
            }
            running = false;
            releaseLocked();
            doAbort();
            callbacks.onFailure(message);
        }
    }

    /** Commits final text after removing overlap with what was already committed. */
    protected final void commit(String text) {
        synchronized (lock) {
            if (reconciler == null) {
                return;
            }
            reconciler.acceptFinal(null, text).ifPresent(callbacks::onCommitted);
        }
    }

    protected final void partial(String text) {
        synchronized (lock) {
            if (callbacks != null) {
                callbacks.onPartial(text);
            }
        }
    }

    private void releaseLocked() {
        if (ticker != null) {
            ticker.close();
            ticker = null;
        }
        if (capture != null) {
            capture.stop();
            capture.discard();
            capture = null;
        }
    }

    protected abstract Duration flushInterval();

    protected abstract void doStart();

    protected abstract void processFrame(AudioFrame frame);

    protected abstract void doFinish(Runnable whenDone);

    protected abstract void doAbort();
}
