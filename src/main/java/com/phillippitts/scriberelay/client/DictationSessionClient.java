package com.phillippitts.scriberelay.client;

import com.phillippitts.scriberelay.client.protocol.ClientTransport;
import com.phillippitts.scriberelay.client.protocol.DictationProtocol;
import com.phillippitts.scriberelay.client.protocol.ProtocolEvent;
import com.phillippitts.scriberelay.client.protocol.TransportConnection;
import com.phillippitts.scriberelay.client.protocol.TransportListener;
import com.phillippitts.scriberelay.config.client.ClientProperties;
import com.phillippitts.scriberelay.domain.AudioFrame;
import com.phillippitts.scriberelay.domain.SessionStats;
import com.phillippitts.scriberelay.exception.ProtocolDecodeException;
import com.phillippitts.scriberelay.service.audio.capture.AudioCapture;
import com.phillippitts.scriberelay.service.audio.capture.AudioCaptureFactory;
import com.phillippitts.scriberelay.service.audio.capture.FrameTicker;
import com.phillippitts.scriberelay.util.LogSanitizer;
import com.phillippitts.scriberelay.util.StateMachine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Streams microphone audio to a transcription endpoint and commits the final results.
 *
 * <p>Threading: transport callbacks, the send ticker, timeout timers and public calls all meet
 * under one lock. Every connect attempt gets an id; callbacks carrying an older id are stale
 * and ignored, which is how a socket that opens after a timeout or an abort is discarded.
 * Listener callbacks run after the lock is released.
 *
 * <p>Audio is buffered from {@link #start()} on. While CONNECTING the buffer keeps filling;
 * once LISTENING every tick sends it, or drops it when no input target has focus.
 *
 * <p>Transcript text never reaches the logs.
 */
public final class DictationSessionClient implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(DictationSessionClient.class);

    static final int MAX_CONSECUTIVE_DECODE_FAILURES = 5;
    static final String CAPTURE_OWNER = "dictation-client";

    static final String CONNECT_TIMEOUT_MESSAGE = "Connection timeout";
    static final String CONNECTION_LOST_MESSAGE = "Connection lost";
    static final String CONNECTION_ERROR_MESSAGE = "Connection error";
    static final String AUTH_FAILED_MESSAGE = "Authentication failed";
    static final String AUTH_TIMEOUT_MESSAGE = "Authentication timed out";
    static final String DECODE_FAILURE_MESSAGE = "Transcription stream unreadable";
    static final String MICROPHONE_FAILURE_MESSAGE = "Microphone unavailable";
    static final String START_FAILURE_MESSAGE = "Failed to start dictation";

    private final DictationProtocol protocol;
    private final ClientTransport transport;
    private final AudioCaptureFactory captureFactory;
    private final InputTargetProvider targets;
    private final DictationListener listener;
    private final ClientProperties props;
    private final ScheduledExecutorService timers;
    private final FrameTicker ticker;
    private final Clock clock;

    private final Object lock = new Object();
    private final StateMachine<ClientState> state = new StateMachine<>("dictation-client", ClientState.IDLE);
    private final TranscriptReconciler reconciler;

    private long attempt;
    private TransportConnection connection;
    private AudioCapture capture;
    private ScheduledFuture<?> connectTimeoutTask;
    private ScheduledFuture<?> stopTimeoutTask;
    private int consecutiveDecodeFailures;

    private long startedAt;
    private long stopRequestedAt;
    private long connectionTimeMs;
    private long stopToFinalTranscriptMs;
    private long audioBytesSent;
    private int partialCount;
    private int finalCount;

    DictationSessionClient(DictationProtocol protocol,
                           ClientTransport transport,
                           AudioCaptureFactory captureFactory,
                           InputTargetProvider targets,
                           DictationListener listener,
                           ClientProperties props,
                           ScheduledExecutorService timers,
                           FrameTicker ticker,
                           Clock clock) {
        this.protocol = Objects.requireNonNull(protocol, "protocol must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.captureFactory = Objects.requireNonNull(captureFactory, "captureFactory must not be null");
        this.targets = Objects.requireNonNull(targets, "targets must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.timers = Objects.requireNonNull(timers, "timers must not be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.reconciler = new TranscriptReconciler(props.getTailWindow());
        resetCounters();
    }

    /**
     * Opens the microphone and starts connecting.
     *
     * @return false if a session is already active
     */
    public boolean start() {
        List<Runnable> out = new ArrayList<>();
        synchronized (lock) {
            ClientState current = state.current();
            if (current != ClientState.IDLE && current != ClientState.ERROR) {
                LOG.debug("Start ignored in state {}", current);
                return false;
            }
            long id = ++attempt;
            resetCounters();
            reconciler.reset();
            moveTo(ClientState.CONNECTING, out);
            startedAt = clock.millis();
            try {
                AudioCapture c = captureFactory.create(CAPTURE_OWNER);
                capture = c;
                c.start(reason -> timers.execute(() -> onCaptureFailure(id, reason)));
                connectTimeoutTask = timers.schedule(() -> onConnectTimeout(id),
                        props.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
                connection = transport.connect(protocol.endpoint(), protocol.handshakeHeaders(),
                        new AttemptListener(id));
                ticker.start(props.getSendInterval(), () -> onTick(id));
                LOG.info("Dictation connecting: protocol={}, attempt={}", protocol.name(), id);
            } catch (RuntimeException e) {
                LOG.warn("Dictation start failed: {}", LogSanitizer.maskSecrets(e.toString()));
                failLocked(START_FAILURE_MESSAGE, out);
            }
        }
        dispatch(out);
        return true;
    }

    /**
     * Ends the session. While CONNECTING the attempt is aborted and the client returns to IDLE
     * at once. While LISTENING the microphone is released before this returns, the remaining
     * audio is flushed and the server is asked to finish; the session ends on {@code done},
     * on close, or after the stop timeout.
     */
    public void stop() {
        List<Runnable> out = new ArrayList<>();
        synchronized (lock) {
            ClientState current = state.current();
            if (current == ClientState.CONNECTING) {
                LOG.info("Stop while connecting: aborting attempt {}", attempt);
                attempt++;
                releaseResourcesLocked();
                moveTo(ClientState.IDLE, out);
            } else if (current == ClientState.LISTENING) {
                moveTo(ClientState.STOPPING, out);
                stopRequestedAt = clock.millis();
                ticker.stop();
                AudioCapture c = capture;
                if (c != null) {
                    c.stop();
                    c.drain().ifPresent(this::sendLocked);
                }
                protocol.sendStop(connection);
                long id = attempt;
                stopTimeoutTask = timers.schedule(() -> onStopTimeout(id),
                        props.getStopTimeout().toMillis(), TimeUnit.MILLISECONDS);
                LOG.info("Dictation stopping: audio-bytes={}", audioBytesSent);
            } else {
                LOG.debug("Stop ignored in state {}", current);
            }
        }
        dispatch(out);
    }

    /** Clears an error so the client reads IDLE again. */
    public void reset() {
        List<Runnable> out = new ArrayList<>();
        synchronized (lock) {
            if (state.is(ClientState.ERROR)) {
                moveTo(ClientState.IDLE, out);
            }
        }
        dispatch(out);
    }

    public ClientState state() {
        return state.current();
    }

    public String transcript() {
        synchronized (lock) {
            return reconciler.transcript();
        }
    }

    public ClientMetrics metrics() {
        synchronized (lock) {
            return new ClientMetrics(connectionTimeMs, stopToFinalTranscriptMs, audioBytesSent,
                    partialCount, finalCount);
        }
    }

    @Override
    public void close() {
        List<Runnable> out = new ArrayList<>();
        synchronized (lock) {
            attempt++;
            releaseResourcesLocked();
            if (state.is(ClientState.LISTENING)) {
                moveTo(ClientState.STOPPING, out);
            }
            if (!state.is(ClientState.IDLE)) {
                moveTo(ClientState.IDLE, out);
            }
        }
        ticker.close();
        dispatch(out);
    }

    // Package-private for tests: one send tick of the current attempt
    void tick() {
        long id;
        synchronized (lock) {
            id = attempt;
        }
        onTick(id);
    }

    private void onTick(long id) {
        List<Runnable> out = new ArrayList<>();
        synchronized (lock) {
            if (id != attempt || !state.is(ClientState.LISTENING) || capture == null) {
                // CONNECTING keeps buffering until the stream is ready.
                return;
            }
            Optional<InputTarget> target = targets.focusedTarget();
            if (target.isEmpty()) {
                capture.discard();
                out.add(listener::onNoTarget);
            } else {
                capture.drain().ifPresent(this::sendLocked);
            }
        }
        dispatch(out);
    }

    private void sendLocked(AudioFrame frame) {
        if (connection == null) {
            return;
        }
        protocol.sendAudio(connection, frame);
        audioBytesSent += frame.sizeBytes();
    }

    private void onOpen(long id, TransportConnection conn) {
        List<Runnable> out = new ArrayList<>();
        synchronized (lock) {
            if (id != attempt || !state.is(ClientState.CONNECTING)) {
                LOG.debug("Discarding late open of attempt {}", id);
                conn.close(1000, "Stale attempt");
                return;
            }
            connection = conn;
            protocol.onOpen(conn);
            if (protocol.readyOnOpen()) {
                becomeListeningLocked(out);
            }
        }
        dispatch(out);
    }

    private void onMessage(long id, Supplier<List<ProtocolEvent>> decoder) {
        List<Runnable> out = new ArrayList<>();
        synchronized (lock) {
            if (id != attempt || !state.current().isActive()) {
                return;
            }
            List<ProtocolEvent> events;
            try {
                events = decoder.get();
                consecutiveDecodeFailures = 0;
            } catch (ProtocolDecodeException e) {
                consecutiveDecodeFailures++;
                LOG.debug("Discarding undecodable message ({} in a row): {}",
                        consecutiveDecodeFailures, e.getMessage());
                if (consecutiveDecodeFailures >= MAX_CONSECUTIVE_DECODE_FAILURES) {
                    LOG.warn("Ending session after {} undecodable messages in a row", consecutiveDecodeFailures);
                    if (state.is(ClientState.STOPPING)) {
                        finishLocked(SessionStats.empty(), out);
                    } else {
                        failLocked(DECODE_FAILURE_MESSAGE, out);
                    }
                }
                events = List.of();
            }
            for (ProtocolEvent event : events) {
                if (!state.current().isActive()) {
                    break;
                }
                handleEventLocked(event, out);
            }
        }
        dispatch(out);
    }

    private void handleEventLocked(ProtocolEvent event, List<Runnable> out) {
        switch (event.kind()) {
            case AUTHENTICATED -> LOG.debug("Authenticated with {}", protocol.name());
            case READY -> {
                if (state.is(ClientState.CONNECTING)) {
                    becomeListeningLocked(out);
                }
            }
            case PARTIAL -> {
                partialCount++;
                String text = event.text();
                out.add(() -> listener.onPartial(text));
            }
            case FINAL -> {
                finalCount++;
                if (state.is(ClientState.STOPPING)) {
                    stopToFinalTranscriptMs = clock.millis() - stopRequestedAt;
                }
                reconciler.acceptFinal(event.resultId(), event.text()).ifPresent(committed -> {
                    String transcript = reconciler.transcript();
                    out.add(() -> deliver(committed, transcript));
                });
            }
            case DONE -> {
                if (state.is(ClientState.STOPPING)) {
                    finishLocked(event.stats(), out);
                } else {
                    LOG.debug("Ignoring done in state {}", state.current());
                }
            }
            case ERROR -> {
                String message = event.text();
                if (state.is(ClientState.STOPPING)) {
                    out.add(() -> listener.onError(message));
                } else {
                    failLocked(message, out);
                }
            }
            case UTTERANCE_END, PONG -> LOG.trace("{} from {}", event.kind(), protocol.name());
        }
    }

    private void deliver(String committed, String transcript) {
        targets.focusedTarget().ifPresent(target -> {
            if (!target.insert(committed)) {
                LOG.debug("Input target rejected {}", LogSanitizer.describe(committed));
            }
        });
        listener.onCommitted(committed, transcript);
    }

    private void onClose(long id, int code) {
        List<Runnable> out = new ArrayList<>();
        synchronized (lock) {
            if (id != attempt) {
                return;
            }
            ClientState current = state.current();
            if (current == ClientState.CONNECTING) {
                LOG.warn("Connection closed before ready: code={}", code);
                failLocked(closeMessage(code), out);
            } else if (current == ClientState.LISTENING) {
                LOG.warn("Connection closed unexpectedly: code={}", code);
                failLocked(CONNECTION_LOST_MESSAGE, out);
            } else if (current == ClientState.STOPPING) {
                LOG.debug("Connection closed while stopping: code={}", code);
                finishLocked(SessionStats.empty(), out);
            }
        }
        dispatch(out);
    }

    private static String closeMessage(int code) {
        return switch (code) {
            case 4001 -> AUTH_TIMEOUT_MESSAGE;
            case 4002 -> AUTH_FAILED_MESSAGE;
            default -> CONNECTION_ERROR_MESSAGE;
        };
    }

    private void onTransportError(long id, Exception error) {
        List<Runnable> out = new ArrayList<>();
        synchronized (lock) {
            if (id != attempt) {
                return;
            }
            LOG.warn("Transport error: {}", LogSanitizer.maskSecrets(String.valueOf(error)));
            ClientState current = state.current();
            if (current == ClientState.CONNECTING || current == ClientState.LISTENING) {
                failLocked(CONNECTION_ERROR_MESSAGE, out);
            }
        }
        dispatch(out);
    }

    private void onConnectTimeout(long id) {
        List<Runnable> out = new ArrayList<>();
        synchronized (lock) {
            if (id != attempt || !state.is(ClientState.CONNECTING)) {
                return;
            }
            LOG.warn("Dictation connect timed out after {} ms", props.getConnectTimeout().toMillis());
            attempt++;
            releaseResourcesLocked();
            moveTo(ClientState.IDLE, out);
            out.add(() -> listener.onError(CONNECT_TIMEOUT_MESSAGE));
        }
        dispatch(out);
    }

    private void onStopTimeout(long id) {
        List<Runnable> out = new ArrayList<>();
        synchronized (lock) {
            if (id != attempt || !state.is(ClientState.STOPPING)) {
                return;
            }
            LOG.warn("No done within {} ms; forcing cleanup", props.getStopTimeout().toMillis());
            finishLocked(SessionStats.empty(), out);
        }
        dispatch(out);
    }

    private void onCaptureFailure(long id, String reason) {
        List<Runnable> out = new ArrayList<>();
        synchronized (lock) {
            if (id != attempt) {
                return;
            }
            ClientState current = state.current();
            if (current == ClientState.CONNECTING || current == ClientState.LISTENING) {
                LOG.warn("Capture failed: reason={}", reason);
                failLocked(MICROPHONE_FAILURE_MESSAGE, out);
            }
        }
        dispatch(out);
    }

    private void becomeListeningLocked(List<Runnable> out) {
        cancel(connectTimeoutTask);
        connectTimeoutTask = null;
        connectionTimeMs = clock.millis() - startedAt;
        moveTo(ClientState.LISTENING, out);
        LOG.info("Dictation listening: protocol={}, connect={}ms", protocol.name(), connectionTimeMs);
    }

    private void finishLocked(SessionStats stats, List<Runnable> out) {
        releaseResourcesLocked();
        moveTo(ClientState.IDLE, out);
        LOG.info("Dictation finished: partials={}, finals={}, audio-bytes={}, stop-to-final={}ms",
                partialCount, finalCount, audioBytesSent, stopToFinalTranscriptMs);
        SessionStats reported = stats == null ? SessionStats.empty() : stats;
        out.add(() -> listener.onDone(reported));
    }

    private void failLocked(String message, List<Runnable> out) {
        LOG.warn("Dictation failed in state {}: {}", state.current(), message);
        releaseResourcesLocked();
        moveTo(ClientState.ERROR, out);
        out.add(() -> listener.onError(message));
    }

    private void releaseResourcesLocked() {
        cancel(connectTimeoutTask);
        cancel(stopTimeoutTask);
        connectTimeoutTask = null;
        stopTimeoutTask = null;
        ticker.stop();
        if (capture != null) {
            capture.stop();
            capture.discard();
            capture = null;
        }
        if (connection != null) {
            connection.close(1000, "Session ended");
            connection = null;
        }
    }

    private void moveTo(ClientState target, List<Runnable> out) {
        ClientState previous = state.current();
        if (state.transitionTo(target)) {
            out.add(() -> listener.onStateChanged(previous, target));
        }
    }

    private void resetCounters() {
        connectionTimeMs = -1;
        stopToFinalTranscriptMs = -1;
        audioBytesSent = 0;
        partialCount = 0;
        finalCount = 0;
        consecutiveDecodeFailures = 0;
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    private void dispatch(List<Runnable> out) {
        for (Runnable r : out) {
            try {
                r.run();
            } catch (RuntimeException e) {
                LOG.warn("Dictation listener failed: {}", e.toString());
            }
        }
    }

    private final class AttemptListener implements TransportListener {

        private final long id;

        AttemptListener(long id) {
            this.id = id;
        }

        @Override
        public void onOpen(TransportConnection conn) {
            DictationSessionClient.this.onOpen(id, conn);
        }

        @Override
        public void onText(String text) {
            onMessage(id, () -> protocol.decodeText(text));
        }

        @Override
        public void onBinary(byte[] data) {
            onMessage(id, () -> protocol.decodeBinary(data));
        }

        @Override
        public void onClose(int code, String reason) {
            DictationSessionClient.this.onClose(id, code);
        }

        @Override
        public void onError(Exception error) {
            onTransportError(id, error);
        }
    }
}
