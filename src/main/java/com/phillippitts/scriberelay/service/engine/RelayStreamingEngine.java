package com.phillippitts.scriberelay.service.engine;

import com.phillippitts.scriberelay.client.ClientState;
import com.phillippitts.scriberelay.client.DictationClientFactory;
import com.phillippitts.scriberelay.client.DictationListener;
import com.phillippitts.scriberelay.client.DictationSessionClient;
import com.phillippitts.scriberelay.domain.SessionStats;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Low-latency strategy: a {@link DictationSessionClient} streaming to the relay.
 */
@Component
public class RelayStreamingEngine implements LiveTranscriptEngine {

    private static final Logger LOG = LogManager.getLogger(RelayStreamingEngine.class);

    private final DictationClientFactory clients;
    private DictationSessionClient client;
    private boolean stopRequested;

    public RelayStreamingEngine(DictationClientFactory clients) {
        this.clients = Objects.requireNonNull(clients, "clients must not be null");
    }

    @Override
    public LiveEngine kind() {
        return LiveEngine.RELAY;
    }

    @Override
    public boolean isAvailable() {
        return clients.isConfigured();
    }

    @Override
    public synchronized void start(String committedSoFar, EngineCallbacks callbacks) {
        Objects.requireNonNull(callbacks, "callbacks must not be null");
        if (client != null) {
            throw new IllegalStateException("Relay engine already running");
        }
        DictationSessionClient c = clients.create(new Adapter(callbacks));
        client = c;
        stopRequested = false;
        c.start();
    }

    @Override
    public void stop() {
        DictationSessionClient c;
        synchronized (this) {
            c = client;
            stopRequested = true;
        }
        if (c != null) {
            c.stop();
        }
    }

    private synchronized DictationSessionClient current() {
        return client;
    }

    private synchronized boolean isStopRequested() {
        return stopRequested;
    }

    private void release(DictationSessionClient finished) {
        synchronized (this) {
            if (client != finished) {
                return;
            }
            client = null;
        }
        finished.close();
    }

    private final class Adapter implements DictationListener {

        private final EngineCallbacks callbacks;

        Adapter(EngineCallbacks callbacks) {
            this.callbacks = callbacks;
        }

        @Override
        public void onStateChanged(ClientState previous, ClientState current) {
            if (current == ClientState.LISTENING) {
                callbacks.onReady();
            } else if (current == ClientState.IDLE && previous == ClientState.CONNECTING && isStopRequested()) {
                // Stopped before ready: no done will follow.
                DictationSessionClient c = current();
                callbacks.onStopped();
                if (c != null) {
                    release(c);
                }
            }
        }

        @Override
        public void onPartial(String text) {
            callbacks.onPartial(text);
        }

        @Override
        public void onCommitted(String committed, String transcript) {
            callbacks.onCommitted(committed);
        }

        @Override
        public void onError(String message) {
            DictationSessionClient c = current();
            if (c != null && c.state() == ClientState.STOPPING) {
                LOG.debug("Relay error while stopping: {}", message);
                return;
            }
            callbacks.onFailure(message);
            if (c != null) {
                release(c);
            }
        }

        @Override
        public void onDone(SessionStats stats) {
            DictationSessionClient c = current();
            callbacks.onStopped();
            if (c != null) {
                release(c);
            }
        }
    }
}
