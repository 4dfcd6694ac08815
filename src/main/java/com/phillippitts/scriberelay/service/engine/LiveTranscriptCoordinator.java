package com.phillippitts.scriberelay.service.engine;

import com.phillippitts.scriberelay.config.engine.EngineProperties;
import com.phillippitts.scriberelay.service.metrics.RelayMetrics;
import com.phillippitts.scriberelay.service.summary.SummaryThrottler;
import com.phillippitts.scriberelay.util.LogSanitizer;
import com.phillippitts.scriberelay.util.SerialExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Runs a live transcript session on the selected engine.
 *
 * <p>When the relay stream fails, the session moves to the next engine chosen by
 * {@link EngineSelector} and keeps the transcript committed so far. The switch is one-way for
 * the rest of the session. Committed text is also fed to the {@link SummaryThrottler}.
 *
 * <p>Engine calls (start, stop) run on a serial control executor, never from inside an engine
 * callback or while holding this coordinator's lock.
 */
@Component
public class LiveTranscriptCoordinator {

    private static final Logger LOG = LogManager.getLogger(LiveTranscriptCoordinator.class);

    static final String NO_ENGINE_MESSAGE = "No transcription engine available";

    private final EngineSelector selector;
    private final Map<LiveEngine, LiveTranscriptEngine> engines;
    private final SummaryThrottler summary;
    private final ApplicationEventPublisher publisher;
    private final RelayMetrics metrics;
    private final Executor control;
    private final Clock clock;

    private final Object lock = new Object();
    private final StringBuilder transcript = new StringBuilder();
    private LiveTranscriptListener listener = new LiveTranscriptListener() { };
    private EngineSignals signals;
    private LiveEngine active;
    private long generation;
    private boolean recording;
    private boolean stopping;

    @org.springframework.beans.factory.annotation.Autowired
    public LiveTranscriptCoordinator(EngineProperties props,
                                     RelayStreamingEngine relay,
                                     NativeRecognitionEngine nativeEngine,
                                     ChunkUploadEngine chunk,
                                     SummaryThrottler summary,
                                     ApplicationEventPublisher publisher,
                                     RelayMetrics metrics,
                                     @Qualifier("clientTimers") ScheduledExecutorService timers) {
        this(EngineOverride.parse(props.getForce()), engineMap(relay, nativeEngine, chunk), summary,
                publisher, metrics, new SerialExecutor(timers), Clock.systemUTC());
    }

    // Package-private for tests
    LiveTranscriptCoordinator(EngineOverride override,
                              Map<LiveEngine, LiveTranscriptEngine> engines,
                              SummaryThrottler summary,
                              ApplicationEventPublisher publisher,
                              RelayMetrics metrics,
                              Executor control,
                              Clock clock) {
        this.selector = new EngineSelector(Objects.requireNonNull(override, "override must not be null"));
        this.engines = new EnumMap<>(Objects.requireNonNull(engines, "engines must not be null"));
        for (LiveEngine kind : LiveEngine.values()) {
            if (!this.engines.containsKey(kind)) {
                throw new IllegalArgumentException("Missing engine: " + kind);
            }
        }
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.control = Objects.requireNonNull(control, "control must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Starts a session on the selected engine.
     *
     * @throws IllegalStateException when a session is already running
     */
    public void start(LiveTranscriptListener sessionListener) {
        Objects.requireNonNull(sessionListener, "listener must not be null");
        List<Runnable> notifications = new ArrayList<>();
        synchronized (lock) {
            if (recording) {
                throw new IllegalStateException("A live transcript session is already running");
            }
            generation++;
            recording = true;
            stopping = false;
            listener = sessionListener;
            transcript.setLength(0);
            summary.reset();
            selector.newSession();
            signals = EngineSignals.idle(engines.get(LiveEngine.RELAY).isAvailable(),
                    engines.get(LiveEngine.NATIVE).isAvailable()).withRecording(true);
            EngineState state = selector.evaluate(signals);
            if (state.active() == LiveEngine.RELAY) {
                signals = signals.withRelayConnecting();
                state = selector.evaluate(signals);
            }
            LOG.info("Live transcript session starting: engine={} forced={}", state.active(), state.debugForced());
            launchLocked(state.active(), notifications);
            notifyState(state, notifications);
        }
        dispatch(notifications);
    }

    /** Requests an orderly end; the listener receives {@code onStopped} once the engine drained. */
    public void stop() {
        LiveTranscriptEngine engine;
        synchronized (lock) {
            if (!recording || stopping) {
                return;
            }
            stopping = true;
            engine = engines.get(active);
            LOG.info("Live transcript session stopping: engine={}", active);
        }
        control.execute(engine::stop);
    }

    public boolean isRecording() {
        synchronized (lock) {
            return recording;
        }
    }

    /** Engine state of the running session, or the idle selection outside a session. */
    public EngineState engineState() {
        synchronized (lock) {
            if (recording && selector.current() != null) {
                return selector.current();
            }
        }
        EngineSignals idle = EngineSignals.idle(engines.get(LiveEngine.RELAY).isAvailable(),
                engines.get(LiveEngine.NATIVE).isAvailable());
        EngineSelector preview = new EngineSelector(selector.override());
        return preview.evaluate(idle);
    }

    public String transcript() {
        synchronized (lock) {
            return transcript.toString();
        }
    }

    public String runningSummary() {
        return summary.runningSummary();
    }

    private void launchLocked(LiveEngine kind, List<Runnable> notifications) {
        LiveTranscriptEngine engine = engines.get(kind);
        if (!engine.isAvailable()) {
            LOG.warn("Selected engine {} not available", kind);
            endLocked();
            LiveTranscriptListener l = listener;
            notifications.add(() -> l.onError(NO_ENGINE_MESSAGE));
            return;
        }
        active = kind;
        long gen = generation;
        String soFar = transcript.toString();
        control.execute(() -> {
            synchronized (lock) {
                if (gen != generation || active != kind) {
                    return;
                }
            }
            engine.start(soFar, new Callbacks(gen, kind));
        });
    }

    private void endLocked() {
        recording = false;
        stopping = false;
        active = null;
        signals = signals == null ? null : signals.withRecording(false);
    }

    private void notifyState(EngineState state, List<Runnable> notifications) {
        LiveTranscriptListener l = listener;
        notifications.add(() -> l.onEngineState(state));
    }

    private static void dispatch(List<Runnable> notifications) {
        for (Runnable r : notifications) {
            try {
                r.run();
            } catch (RuntimeException e) {
                LOG.warn("Live transcript listener failed: {}", e.toString());
            }
        }
    }

    private static Map<LiveEngine, LiveTranscriptEngine> engineMap(LiveTranscriptEngine... all) {
        Map<LiveEngine, LiveTranscriptEngine> map = new EnumMap<>(LiveEngine.class);
        for (LiveTranscriptEngine e : all) {
            map.put(e.kind(), e);
        }
        return map;
    }

    /** Callbacks bound to one engine run; stale runs are ignored. */
    private final class Callbacks implements EngineCallbacks {

        private final long gen;
        private final LiveEngine kind;

        Callbacks(long gen, LiveEngine kind) {
            this.gen = gen;
            this.kind = kind;
        }

        private boolean isCurrent() {
            return recording && gen == generation && active == kind;
        }

        @Override
        public void onReady() {
            List<Runnable> notifications = new ArrayList<>();
            synchronized (lock) {
                if (!isCurrent()) {
                    return;
                }
                signals = switch (kind) {
                    case RELAY -> signals.withRelayReady();
                    case NATIVE -> signals.withNativeListening(true);
                    case CHUNK -> signals;
                };
                notifyState(selector.evaluate(signals), notifications);
            }
            dispatch(notifications);
        }

        @Override
        public void onPartial(String text) {
            LiveTranscriptListener l;
            synchronized (lock) {
                if (!isCurrent()) {
                    return;
                }
                l = listener;
            }
            dispatch(List.of(() -> l.onPartial(text)));
        }

        @Override
        public void onCommitted(String text) {
            LiveTranscriptListener l;
            String full;
            synchronized (lock) {
                if (gen != generation || active != kind) {
                    return;
                }
                transcript.append(text);
                full = transcript.toString();
                l = listener;
            }
            summary.onTranscriptDelta(full);
            dispatch(List.of(() -> l.onTranscript(text, full)));
        }

        @Override
        public void onFailure(String message) {
            List<Runnable> notifications = new ArrayList<>();
            synchronized (lock) {
                if (!isCurrent()) {
                    return;
                }
                LiveTranscriptListener l = listener;
                if (stopping) {
                    LOG.warn("{} engine failed while stopping: {}", kind, LogSanitizer.maskSecrets(message));
                    finishLocked(notifications);
                } else if (kind == LiveEngine.RELAY) {
                    signals = signals.withRelayError();
                    EngineState state = selector.evaluate(signals);
                    if (state.active() != LiveEngine.RELAY && engines.get(state.active()).isAvailable()) {
                        LiveEngine next = state.active();
                        LOG.warn("Relay stream failed, switching to {}: {}", next, LogSanitizer.maskSecrets(message));
                        publisher.publishEvent(new EngineFallbackEvent(kind, next, state.fallbackWarning(),
                                clock.instant()));
                        metrics.engineFallback(kind.tag(), next.tag());
                        launchLocked(next, notifications);
                        notifyState(state, notifications);
                    } else {
                        endLocked();
                        notifications.add(() -> l.onError(message));
                    }
                } else {
                    LOG.warn("{} engine failed: {}", kind, LogSanitizer.maskSecrets(message));
                    endLocked();
                    notifications.add(() -> l.onError(message));
                }
            }
            dispatch(notifications);
        }

        @Override
        public void onStopped() {
            List<Runnable> notifications = new ArrayList<>();
            synchronized (lock) {
                if (!isCurrent()) {
                    return;
                }
                finishLocked(notifications);
            }
            dispatch(notifications);
        }

        private void finishLocked(List<Runnable> notifications) {
            String full = transcript.toString();
            LiveTranscriptListener l = listener;
            endLocked();
            LOG.info("Live transcript session finished: engine={} transcript={}", kind, LogSanitizer.describe(full));
            summary.flush(full);
            notifyState(selector.evaluate(signals), notifications);
            notifications.add(() -> l.onStopped(full));
        }
    }
}
