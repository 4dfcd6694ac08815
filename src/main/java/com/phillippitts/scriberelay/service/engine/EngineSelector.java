package com.phillippitts.scriberelay.service.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Chooses the live transcript engine from the debug override and live signals.
 *
 * <p>Automatic priority is RELAY, then NATIVE, then CHUNK. A forced engine is used unless it
 * cannot run (forced relay without a configured relay, forced native without a recognizer).
 *
 * <p>Fallback is one-directional within a session: once an engine lower in the priority order
 * has been active, later signals never promote back to a higher one, so a flapping network
 * does not make the session oscillate. {@link #newSession()} forgets that floor.
 *
 * <p>Thread-safe.
 */
public final class EngineSelector {

    private static final Logger LOG = LogManager.getLogger(EngineSelector.class);

    private final EngineOverride override;
    private LiveEngine floor;
    private boolean fallbackLogged;
    private EngineState current;

    public EngineSelector(EngineOverride override) {
        this.override = Objects.requireNonNull(override, "override must not be null");
    }

    /** Recomputes the engine state; call on every signal change. */
    public synchronized EngineState evaluate(EngineSignals signals) {
        Objects.requireNonNull(signals, "signals must not be null");
        LiveEngine preferred = preferred(signals);
        LiveEngine active = active(preferred, signals);
        if (floor != null && active.ordinal() < floor.ordinal()) {
            active = floor;
        }
        if (signals.recording() && (floor == null || active.ordinal() > floor.ordinal())) {
            floor = active;
        }

        boolean fellBack = signals.recording() && active != preferred;
        EngineStatus status = status(preferred, active, signals);
        String warning = fellBack ? fallbackWarning(preferred, active, signals) : null;
        if (fellBack && !fallbackLogged) {
            fallbackLogged = true;
            LOG.warn("Engine fallback: {} -> {} ({})", preferred, active, warning);
        }
        current = new EngineState(preferred, active, status, label(active, status), fellBack, warning,
                override != EngineOverride.AUTO);
        return current;
    }

    /** Last computed state, or null before the first evaluation. */
    public synchronized EngineState current() {
        return current;
    }

    /** Starts a new session: fallback history is cleared and selection starts from scratch. */
    public synchronized void newSession() {
        floor = null;
        fallbackLogged = false;
        current = null;
    }

    public EngineOverride override() {
        return override;
    }

    private LiveEngine preferred(EngineSignals s) {
        return override.engine().orElseGet(() -> {
            if (s.relayConfigured()) {
                return LiveEngine.RELAY;
            }
            if (s.nativeAvailable()) {
                return LiveEngine.NATIVE;
            }
            return LiveEngine.CHUNK;
        });
    }

    private LiveEngine active(LiveEngine preferred, EngineSignals s) {
        if (override != EngineOverride.AUTO) {
            if (preferred == LiveEngine.RELAY && !s.relayConfigured()) {
                LOG.debug("Forced relay but relay not configured - falling back");
                return s.nativeAvailable() ? LiveEngine.NATIVE : LiveEngine.CHUNK;
            }
            if (preferred == LiveEngine.NATIVE && !s.nativeAvailable()) {
                LOG.debug("Forced native but not available - falling back to chunk");
                return LiveEngine.CHUNK;
            }
            return preferred;
        }
        if (preferred == LiveEngine.RELAY && s.relayError()) {
            return s.nativeAvailable() ? LiveEngine.NATIVE : LiveEngine.CHUNK;
        }
        return preferred;
    }

    private static EngineStatus status(LiveEngine preferred, LiveEngine active, EngineSignals s) {
        if (!s.recording()) {
            return EngineStatus.IDLE;
        }
        if (active != preferred) {
            return EngineStatus.FALLBACK;
        }
        return switch (active) {
            case RELAY -> {
                if (s.relayConnecting()) {
                    yield EngineStatus.CONNECTING;
                }
                if (s.relayReady()) {
                    yield EngineStatus.READY;
                }
                yield s.relayError() ? EngineStatus.ERROR : EngineStatus.CONNECTING;
            }
            case NATIVE -> s.nativeListening() ? EngineStatus.READY : EngineStatus.CONNECTING;
            case CHUNK -> EngineStatus.READY;
        };
    }

    static String label(LiveEngine active, EngineStatus status) {
        String label = "Engine: " + active.label();
        if (status == EngineStatus.CONNECTING) {
            return label + " (connecting...)";
        }
        if (status == EngineStatus.FALLBACK) {
            return label + " [fallback]";
        }
        return label;
    }

    static String fallbackWarning(LiveEngine preferred, LiveEngine active, EngineSignals s) {
        if (preferred == LiveEngine.RELAY) {
            return s.relayError()
                    ? "Relay unreachable - falling back to " + active.label()
                    : "Relay not configured - using " + active.label();
        }
        if (preferred == LiveEngine.NATIVE) {
            return "Native recognition not available - falling back to " + active.label();
        }
        return null;
    }
}
