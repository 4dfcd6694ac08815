package com.phillippitts.scriberelay.relay;

import com.phillippitts.scriberelay.config.relay.RelayProperties;
import com.phillippitts.scriberelay.domain.SessionStats;
import com.phillippitts.scriberelay.exception.AuthenticationFailedException;
import com.phillippitts.scriberelay.relay.auth.TokenVerifier;
import com.phillippitts.scriberelay.relay.auth.VerifiedUser;
import com.phillippitts.scriberelay.relay.upstream.UpstreamConnection;
import com.phillippitts.scriberelay.relay.upstream.UpstreamConnector;
import com.phillippitts.scriberelay.relay.upstream.UpstreamEvent;
import com.phillippitts.scriberelay.relay.upstream.UpstreamListener;
import com.phillippitts.scriberelay.relay.upstream.UpstreamResultClassifier;
import com.phillippitts.scriberelay.service.metrics.RelayMetrics;
import com.phillippitts.scriberelay.util.SerialExecutor;
import com.phillippitts.scriberelay.util.StateMachine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Supervises one client connection: authentication, the upstream engine connection,
 * audio forwarding, result relaying and the stop/flush handshake.
 *
 * <p>Every input (client text and binary frames, upstream callbacks, timers) is posted into a
 * per-session {@link SerialExecutor}, so handlers run one at a time in arrival order and the
 * mutable fields below need no further locking.
 *
 * <p>Logs are keyed by session id through {@link ThreadContext} and never contain tokens,
 * transcript text or audio.
 */
public final class RelaySession {

    private static final Logger LOG = LogManager.getLogger(RelaySession.class);

    static final String MDC_SESSION_ID = "sessionId";
    static final String AUTH_FAILED_MESSAGE = "Authentication failed";
    static final String UPSTREAM_FAILED_MESSAGE = "Upstream engine connection failed";
    static final String UPSTREAM_CLOSED_MESSAGE = "Upstream engine connection closed";

    private final String id;
    private final ClientChannel client;
    private final RelayProperties props;
    private final OriginPolicy originPolicy;
    private final TokenVerifier verifier;
    private final UpstreamConnector connector;
    private final ScheduledExecutorService timers;
    private final Executor loop;
    private final RelayMetrics metrics;
    private final Consumer<RelaySession> onClosed;
    private final Clock clock;
    private final Instant createdAt;
    private final StateMachine<RelaySessionState> state;

    // Confined to the session loop
    private String userId;
    private UpstreamConnection upstream;
    private boolean upstreamOpen;
    private boolean streamed;
    private long upstreamStartMillis;
    private long audioBytesSent;
    private int partialCount;
    private int finalCount;
    private int finalTranscriptLength;
    private boolean doneSent;
    private boolean released;
    private ScheduledFuture<?> authTimer;
    private ScheduledFuture<?> flushTimer;
    private ScheduledFuture<?> keepAliveTimer;

    RelaySession(String id,
                 ClientChannel client,
                 RelayProperties props,
                 TokenVerifier verifier,
                 UpstreamConnector connector,
                 ScheduledExecutorService timers,
                 Executor backingExecutor,
                 RelayMetrics metrics,
                 Consumer<RelaySession> onClosed,
                 Clock clock) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.originPolicy = new OriginPolicy(props.getAllowedOrigins());
        this.verifier = Objects.requireNonNull(verifier, "verifier must not be null");
        this.connector = Objects.requireNonNull(connector, "connector must not be null");
        this.timers = Objects.requireNonNull(timers, "timers must not be null");
        this.loop = new SerialExecutor(Objects.requireNonNull(backingExecutor, "backingExecutor must not be null"));
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.onClosed = Objects.requireNonNull(onClosed, "onClosed must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.createdAt = clock.instant();
        this.state = new StateMachine<>("relay-session-" + id, RelaySessionState.NEW);
    }

    public String id() {
        return id;
    }

    public RelaySessionState state() {
        return state.current();
    }

    public Instant createdAt() {
        return createdAt;
    }

    // ---- inbound events, posted into the session loop ----

    public void start(String origin) {
        post(() -> handleStart(origin));
    }

    public void onClientText(String text) {
        post(() -> handleClientText(text));
    }

    public void onClientBinary(byte[] frame) {
        post(() -> handleClientBinary(frame));
    }

    public void onClientClosed(int code) {
        post(() -> handleClientClosed(code));
    }

    /** Closes the session on application shutdown. */
    public void shutdown() {
        post(() -> {
            LOG.info("Closing session on shutdown");
            client.close(CloseCodes.GOING_AWAY, "Server shutting down");
            release(RelaySessionState.CLOSED);
        });
    }

    private void post(Runnable task) {
        loop.execute(() -> {
            ThreadContext.put(MDC_SESSION_ID, id);
            try {
                task.run();
            } finally {
                ThreadContext.remove(MDC_SESSION_ID);
            }
        });
    }

    // ---- handlers ----

    private void handleStart(String origin) {
        LOG.info("Client connected");
        metrics.sessionOpened();
        if (!originPolicy.isAllowed(origin)) {
            LOG.warn("Origin not allowed");
            metrics.sessionRejected("origin");
            state.transitionTo(RelaySessionState.CLOSED);
            client.close(CloseCodes.ORIGIN_NOT_ALLOWED, "Origin not allowed");
            release(RelaySessionState.CLOSED);
            return;
        }
        state.require(RelaySessionState.AWAITING_AUTH);
        authTimer = timers.schedule(() -> post(this::handleAuthTimeout),
                props.getAuthTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void handleAuthTimeout() {
        if (!state.transition(RelaySessionState.AWAITING_AUTH, RelaySessionState.AUTH_TIMEOUT)) {
            return;
        }
        LOG.warn("Auth timeout - closing");
        metrics.sessionRejected("auth_timeout");
        client.close(CloseCodes.AUTH_TIMEOUT, "Authentication timeout");
        release(RelaySessionState.AUTH_TIMEOUT);
    }

    private void handleClientText(String text) {
        RelayMessages.ClientMessage msg = RelayMessages.parseClientMessage(text).orElse(null);
        if (msg == null) {
            LOG.warn("Invalid message format ({} chars)", text == null ? 0 : text.length());
            return;
        }
        switch (msg.type()) {
            case "auth" -> handleAuth(msg.accessToken());
            case "stop" -> handleStop();
            case "ping" -> client.sendText(RelayMessages.pong());
            default -> LOG.debug("Ignoring client message type '{}'", msg.type());
        }
    }

    private void handleAuth(String accessToken) {
        if (!state.is(RelaySessionState.AWAITING_AUTH)) {
            LOG.warn("Auth message ignored in state {}", state.current());
            return;
        }
        VerifiedUser user;
        try {
            user = verifier.verify(accessToken);
        } catch (AuthenticationFailedException e) {
            LOG.warn("Auth failed");
            metrics.sessionRejected("auth_failed");
            client.sendText(RelayMessages.error(AUTH_FAILED_MESSAGE));
            state.transitionTo(RelaySessionState.CLOSED);
            client.close(CloseCodes.AUTH_FAILED, AUTH_FAILED_MESSAGE);
            release(RelaySessionState.CLOSED);
            return;
        }
        cancel(authTimer);
        state.require(RelaySessionState.AUTHENTICATED);
        userId = user.userId();
        LOG.info("Authenticated");
        client.sendText(RelayMessages.authenticated());
        connectUpstream();
    }

    private void connectUpstream() {
        LOG.info("Connecting upstream engine");
        upstreamStartMillis = clock.millis();
        try {
            upstream = connector.connect(new LoopUpstreamListener());
        } catch (RuntimeException e) {
            LOG.warn("Upstream connect failed: {}", e.getClass().getSimpleName());
            handleUpstreamError(e);
        }
    }

    private void handleUpstreamOpen() {
        if (!state.transition(RelaySessionState.AUTHENTICATED, RelaySessionState.STREAMING)) {
            // Stopped or failed while connecting; the late socket is not wanted.
            LOG.debug("Upstream opened in state {}; closing it", state.current());
            closeUpstream();
            return;
        }
        upstreamOpen = true;
        streamed = true;
        LOG.info("Upstream engine connected");
        client.sendText(RelayMessages.ready());
        long interval = props.getKeepAliveInterval().toMillis();
        keepAliveTimer = timers.scheduleAtFixedRate(() -> post(this::sendKeepAlive),
                interval, interval, TimeUnit.MILLISECONDS);
    }

    private void sendKeepAlive() {
        if (upstreamOpen && state.is(RelaySessionState.STREAMING)) {
            upstream.sendControl(RelayMessages.keepAlive());
        }
    }

    private void handleClientBinary(byte[] frame) {
        RelaySessionState current = state.current();
        if (current == RelaySessionState.NEW || current == RelaySessionState.AWAITING_AUTH) {
            LOG.warn("Audio received before auth");
            metrics.audioDropped("before_auth");
            return;
        }
        if (current != RelaySessionState.STREAMING || !upstreamOpen) {
            metrics.audioDropped("not_streaming");
            return;
        }
        upstream.sendAudio(frame);
        audioBytesSent += frame.length;
        metrics.audioForwarded(frame.length);
    }

    private void handleUpstreamMessage(String raw) {
        RelaySessionState current = state.current();
        if (current != RelaySessionState.STREAMING && current != RelaySessionState.FINALIZING) {
            return;
        }
        UpstreamEvent event = UpstreamResultClassifier.classify(raw);
        switch (event.kind()) {
            case PARTIAL -> {
                partialCount++;
                metrics.resultRelayed("partial");
                client.sendText(RelayMessages.partial(event.text()));
            }
            case FINAL -> {
                finalCount++;
                finalTranscriptLength += event.text().length();
                metrics.resultRelayed("final");
                client.sendText(RelayMessages.fin(event.text(), event.speechFinal()));
            }
            case UTTERANCE_END -> {
                metrics.resultRelayed("utterance_end");
                client.sendText(RelayMessages.utteranceEnd());
            }
            case METADATA -> LOG.debug("Upstream metadata received");
            default -> {
                // Non-JSON and unknown message types are not relayed.
            }
        }
    }

    private void handleStop() {
        RelaySessionState current = state.current();
        LOG.info("Stop received in state {}", current);
        switch (current) {
            case STREAMING -> {
                state.require(RelaySessionState.FINALIZING);
                cancel(keepAliveTimer);
                upstream.sendControl(RelayMessages.closeStream());
                flushTimer = timers.schedule(() -> post(this::handleFlushTimeout),
                        props.getFlushGrace().toMillis(), TimeUnit.MILLISECONDS);
            }
            case FINALIZING -> LOG.debug("Stop already in progress");
            case AUTH_TIMEOUT -> LOG.debug("Stop after auth timeout ignored");
            default -> finish();
        }
    }

    private void handleFlushTimeout() {
        if (state.is(RelaySessionState.FINALIZING)) {
            LOG.debug("Flush grace expired; closing upstream");
            finish();
        }
    }

    private void handleUpstreamClosed(int code) {
        boolean wasOpen = upstreamOpen;
        upstreamOpen = false;
        upstream = null;
        cancel(keepAliveTimer);
        LOG.info("Upstream engine closed: code={}", code);
        switch (state.current()) {
            case FINALIZING -> finish();
            case STREAMING, AUTHENTICATED -> {
                metrics.upstreamFailure(wasOpen ? "closed" : "connect_closed");
                client.sendText(RelayMessages.error(wasOpen ? UPSTREAM_CLOSED_MESSAGE : UPSTREAM_FAILED_MESSAGE));
                state.transitionTo(RelaySessionState.CLOSED);
            }
            default -> {
                // Already closed or never authenticated.
            }
        }
    }

    private void handleUpstreamError(Exception error) {
        LOG.warn("Upstream engine error: {}", error.getClass().getSimpleName());
        closeUpstream();
        switch (state.current()) {
            case FINALIZING -> finish();
            case STREAMING, AUTHENTICATED -> {
                metrics.upstreamFailure("error");
                client.sendText(RelayMessages.error(UPSTREAM_FAILED_MESSAGE));
                state.transitionTo(RelaySessionState.CLOSED);
            }
            default -> {
                // Nothing to report.
            }
        }
    }

    private void handleClientClosed(int code) {
        LOG.info("Client disconnected: code={}, bytes={}, finals={}", code, audioBytesSent, finalCount);
        RelaySessionState current = state.current();
        if (!current.isTerminal()) {
            state.transitionTo(RelaySessionState.CLOSED);
        }
        release(state.current());
    }

    /** Sends {@code done} exactly once, closes the upstream and ends the session. */
    private void finish() {
        if (doneSent) {
            return;
        }
        doneSent = true;
        cancel(flushTimer);
        cancel(keepAliveTimer);
        closeUpstream();
        // A session whose upstream never opened reports zeroed counters.
        SessionStats stats = streamed ? stats() : SessionStats.empty();
        client.sendText(RelayMessages.done(stats));
        LOG.info("Session done: durationMs={}, bytes={}, partials={}, finals={}",
                stats.durationMs(), stats.audioBytesSent(), stats.partialCount(), stats.finalCount());
        state.transitionTo(RelaySessionState.CLOSED);
        client.close(CloseCodes.NORMAL, "Session complete");
        release(RelaySessionState.CLOSED);
    }

    SessionStats stats() {
        long duration = upstreamStartMillis == 0 ? 0 : clock.millis() - upstreamStartMillis;
        return new SessionStats(duration, audioBytesSent, partialCount, finalCount, finalTranscriptLength);
    }

    private void closeUpstream() {
        upstreamOpen = false;
        if (upstream != null) {
            UpstreamConnection c = upstream;
            upstream = null;
            try {
                c.close();
            } catch (RuntimeException e) {
                LOG.debug("Closing upstream failed: {}", e.toString());
            }
        }
    }

    /** Frees timers and the upstream socket and deregisters the session. Runs once. */
    private void release(RelaySessionState finalState) {
        if (released) {
            return;
        }
        released = true;
        cancel(authTimer);
        cancel(flushTimer);
        cancel(keepAliveTimer);
        closeUpstream();
        if (!state.current().isTerminal()) {
            state.transitionTo(finalState);
        }
        metrics.sessionClosed(clock.millis() - createdAt.toEpochMilli());
        onClosed.accept(this);
    }

    private static void cancel(ScheduledFuture<?> timer) {
        if (timer != null) {
            timer.cancel(false);
        }
    }

    String userId() {
        return userId;
    }

    /** Routes upstream socket callbacks into the session loop. */
    private final class LoopUpstreamListener implements UpstreamListener {

        @Override
        public void onOpen() {
            post(RelaySession.this::handleUpstreamOpen);
        }

        @Override
        public void onMessage(String text) {
            post(() -> handleUpstreamMessage(text));
        }

        @Override
        public void onClose(int code, String reason) {
            post(() -> handleUpstreamClosed(code));
        }

        @Override
        public void onError(Exception error) {
            post(() -> handleUpstreamError(error));
        }
    }
}
