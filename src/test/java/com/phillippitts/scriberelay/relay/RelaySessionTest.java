package com.phillippitts.scriberelay.relay;

import com.phillippitts.scriberelay.config.relay.RelayProperties;
import com.phillippitts.scriberelay.exception.AuthenticationFailedException;
import com.phillippitts.scriberelay.relay.auth.TokenVerifier;
import com.phillippitts.scriberelay.relay.auth.VerifiedUser;
import com.phillippitts.scriberelay.service.metrics.RelayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class RelaySessionTest {

    private static final String VALID_TOKEN = "valid-token";

    private static final String PARTIAL = """
            {"type":"Results","is_final":false,"channel":{"alternatives":[{"transcript":"hel"}]}}""";
    private static final String FINAL = """
            {"type":"Results","is_final":true,"speech_final":true,"channel":{"alternatives":[{"transcript":"hello"}]}}""";

    private final FakeClientChannel client = new FakeClientChannel();
    private final FakeUpstreamConnector connector = new FakeUpstreamConnector();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final List<RelaySession> released = new CopyOnWriteArrayList<>();
    private final TokenVerifier verifier = token -> {
        if (!VALID_TOKEN.equals(token)) {
            throw new AuthenticationFailedException("Authentication failed");
        }
        return new VerifiedUser("user-42");
    };

    private RelayProperties props;
    private ScheduledExecutorService timers;

    @BeforeEach
    void setUp() {
        props = new RelayProperties();
        props.setAuthTimeout(Duration.ofSeconds(30));
        props.setFlushGrace(Duration.ofSeconds(30));
        timers = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        timers.shutdownNow();
    }

    private RelaySession newSession() {
        return new RelaySession("s1", client, props, verifier, connector, timers, Runnable::run,
                new RelayMetrics(registry), released::add, Clock.systemUTC());
    }

    private RelaySession streaming() {
        RelaySession session = newSession();
        session.start(null);
        session.onClientText(auth(VALID_TOKEN));
        connector.last().open();
        assertThat(session.state()).isEqualTo(RelaySessionState.STREAMING);
        return session;
    }

    private static String auth(String token) {
        return new JSONObject().put("type", "auth").put("access_token", token).toString();
    }

    private static String type(String type) {
        return new JSONObject().put("type", type).toString();
    }

    private double counter(String name, String tag, String value) {
        return registry.get(name).tag(tag, value).counter().count();
    }

    @Test
    void closesWith4001WhenNoAuthArrives() {
        props.setAuthTimeout(Duration.ofMillis(100));
        RelaySession session = newSession();

        session.start(null);

        await().atMost(2, SECONDS).until(() -> client.closeCode() == CloseCodes.AUTH_TIMEOUT);
        assertThat(session.state()).isEqualTo(RelaySessionState.AUTH_TIMEOUT);
        assertThat(released).containsExactly(session);
        assertThat(connector.connections).isEmpty();
        assertThat(counter("scriberelay.relay.sessions.rejected", "reason", "auth_timeout")).isEqualTo(1.0);
    }

    @Test
    void audioBeforeAuthIsDropped() {
        RelaySession session = newSession();
        session.start(null);

        session.onClientBinary(new byte[320]);

        assertThat(session.state()).isEqualTo(RelaySessionState.AWAITING_AUTH);
        assertThat(connector.connections).isEmpty();
        assertThat(counter("scriberelay.relay.audio.dropped", "reason", "before_auth")).isEqualTo(1.0);
    }

    @Test
    void invalidTokenGetsErrorThenClose4002() {
        RelaySession session = newSession();
        session.start(null);

        session.onClientText(auth("forged"));

        assertThat(client.types()).containsExactly("error");
        assertThat(client.last("error").getString("error")).isEqualTo("Authentication failed");
        assertThat(client.closeCode()).isEqualTo(CloseCodes.AUTH_FAILED);
        assertThat(session.state()).isEqualTo(RelaySessionState.CLOSED);
        assertThat(connector.connections).isEmpty();
        assertThat(released).containsExactly(session);
    }

    @Test
    void validTokenConnectsUpstreamAndReportsReadyOnOpen() {
        RelaySession session = newSession();
        session.start(null);

        session.onClientText(auth(VALID_TOKEN));

        assertThat(session.state()).isEqualTo(RelaySessionState.AUTHENTICATED);
        assertThat(session.userId()).isEqualTo("user-42");
        assertThat(client.types()).containsExactly("authenticated");
        assertThat(connector.connections).hasSize(1);

        connector.last().open();

        assertThat(session.state()).isEqualTo(RelaySessionState.STREAMING);
        assertThat(client.types()).containsExactly("authenticated", "ready");
    }

    @Test
    void audioIsDroppedUntilUpstreamIsOpen() {
        RelaySession session = newSession();
        session.start(null);
        session.onClientText(auth(VALID_TOKEN));

        session.onClientBinary(new byte[320]);

        assertThat(connector.last().audio()).isEmpty();
        assertThat(counter("scriberelay.relay.audio.dropped", "reason", "not_streaming")).isEqualTo(1.0);
    }

    @Test
    void audioIsForwardedUnchangedWhileStreaming() {
        RelaySession session = streaming();
        byte[] frame = {1, 2, 3, 4, 5, 6};

        session.onClientBinary(frame);
        session.onClientBinary(new byte[]{7, 8});

        assertThat(connector.last().audio()).containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(session.stats().audioBytesSent()).isEqualTo(8);
    }

    @Test
    void upstreamResultsAreRelayedAsClientEvents() {
        RelaySession session = streaming();
        FakeUpstreamConnector.FakeUpstream upstream = connector.last();

        upstream.message(PARTIAL);
        upstream.message(FINAL);
        upstream.message("{\"type\":\"UtteranceEnd\"}");
        upstream.message("{\"type\":\"Metadata\",\"request_id\":\"r\"}");
        upstream.message("not json");

        assertThat(client.types()).containsExactly("authenticated", "ready", "partial", "final", "utterance_end");
        assertThat(client.last("partial").getString("text")).isEqualTo("hel");
        JSONObject fin = client.last("final");
        assertThat(fin.getString("text")).isEqualTo("hello");
        assertThat(fin.getBoolean("speech_final")).isTrue();
        assertThat(session.stats().partialCount()).isEqualTo(1);
        assertThat(session.stats().finalCount()).isEqualTo(1);
        assertThat(session.stats().finalTranscriptLength()).isEqualTo(5);
    }

    @Test
    void stopFlushesUpstreamAndSendsDoneWhenEngineCloses() {
        RelaySession session = streaming();
        FakeUpstreamConnector.FakeUpstream upstream = connector.last();
        session.onClientBinary(new byte[640]);

        session.onClientText(type("stop"));

        assertThat(session.state()).isEqualTo(RelaySessionState.FINALIZING);
        assertThat(upstream.controls).contains(type("CloseStream"));

        upstream.message(FINAL);
        upstream.closeFromEngine(1000);

        assertThat(client.types()).containsExactly("authenticated", "ready", "final", "done");
        JSONObject stats = client.last("done").getJSONObject("stats");
        assertThat(stats.getLong("audioBytesSent")).isEqualTo(640);
        assertThat(stats.getInt("finalCount")).isEqualTo(1);
        assertThat(client.closeCode()).isEqualTo(CloseCodes.NORMAL);
        assertThat(client.closeReason()).isEqualTo("Session complete");
        assertThat(session.state()).isEqualTo(RelaySessionState.CLOSED);
        assertThat(released).containsExactly(session);
    }

    @Test
    void flushGraceExpiryFinishesSession() {
        props.setFlushGrace(Duration.ofMillis(100));
        RelaySession session = streaming();

        session.onClientText(type("stop"));

        await().atMost(2, SECONDS).until(() -> client.types().contains("done"));
        assertThat(connector.last().closed()).isTrue();
        assertThat(session.state()).isEqualTo(RelaySessionState.CLOSED);
    }

    @Test
    void doneIsSentOnlyOnce() {
        RelaySession session = streaming();
        session.onClientText(type("stop"));
        session.onClientText(type("stop"));

        connector.last().closeFromEngine(1000);
        session.onClientText(type("stop"));

        assertThat(client.types().stream().filter("done"::equals)).hasSize(1);
    }

    @Test
    void stopBeforeUpstreamOpensReportsZeroStats() {
        RelaySession session = newSession();
        session.start(null);
        session.onClientText(auth(VALID_TOKEN));
        FakeUpstreamConnector.FakeUpstream upstream = connector.last();

        session.onClientText(type("stop"));

        JSONObject stats = client.last("done").getJSONObject("stats");
        assertThat(stats.getLong("durationMs")).isZero();
        assertThat(stats.getInt("finalCount")).isZero();
        assertThat(upstream.closed()).isTrue();

        upstream.open();
        assertThat(client.types()).doesNotContain("ready");
    }

    @Test
    void upstreamCloseWhileStreamingIsReportedToClient() {
        RelaySession session = streaming();

        connector.last().closeFromEngine(1011);

        assertThat(client.last("error").getString("error")).isEqualTo(RelaySession.UPSTREAM_CLOSED_MESSAGE);
        assertThat(session.state()).isEqualTo(RelaySessionState.CLOSED);
        assertThat(counter("scriberelay.relay.upstream.failures", "reason", "closed")).isEqualTo(1.0);
    }

    @Test
    void upstreamErrorWhileConnectingIsReportedToClient() {
        RelaySession session = newSession();
        session.start(null);
        session.onClientText(auth(VALID_TOKEN));

        connector.last().listener.onError(new java.io.IOException("handshake refused"));

        assertThat(client.last("error").getString("error")).isEqualTo(RelaySession.UPSTREAM_FAILED_MESSAGE);
        assertThat(connector.last().closed()).isTrue();
        assertThat(session.state()).isEqualTo(RelaySessionState.CLOSED);
    }

    @Test
    void connectorFailureIsReportedToClient() {
        connector.connectFailure = new IllegalStateException("no api key");
        RelaySession session = newSession();
        session.start(null);

        session.onClientText(auth(VALID_TOKEN));

        assertThat(client.last("error").getString("error")).isEqualTo(RelaySession.UPSTREAM_FAILED_MESSAGE);
    }

    @Test
    void clientDisconnectReleasesUpstream() {
        RelaySession session = streaming();

        session.onClientClosed(1001);

        assertThat(connector.last().closed()).isTrue();
        assertThat(session.state()).isEqualTo(RelaySessionState.CLOSED);
        assertThat(released).containsExactly(session);
    }

    @Test
    void disallowedOriginIsClosedWith4003() {
        props.setAllowedOrigins(List.of("http://localhost:3000"));
        RelaySession session = newSession();

        session.start("https://evil.example");

        assertThat(client.closeCode()).isEqualTo(CloseCodes.ORIGIN_NOT_ALLOWED);
        assertThat(released).containsExactly(session);
    }

    @Test
    void allowedOriginProceedsToAuth() {
        props.setAllowedOrigins(List.of("http://localhost:3000"));
        RelaySession session = newSession();

        session.start("http://localhost:3000");

        assertThat(session.state()).isEqualTo(RelaySessionState.AWAITING_AUTH);
    }

    @Test
    void pingIsAnsweredAndGarbageIgnored() {
        RelaySession session = newSession();
        session.start(null);

        session.onClientText(type("ping"));
        session.onClientText("{{{");

        assertThat(client.types()).containsExactly("pong");
        assertThat(session.state()).isEqualTo(RelaySessionState.AWAITING_AUTH);
    }

    @Test
    void keepAliveIsSentWhileStreaming() {
        props.setKeepAliveInterval(Duration.ofMillis(50));
        streaming();

        await().atMost(2, SECONDS).until(() -> connector.last().controls.contains(type("KeepAlive")));
    }

    @Test
    void shutdownClosesClientAsGoingAway() {
        RelaySession session = streaming();

        session.shutdown();

        assertThat(client.closeCode()).isEqualTo(CloseCodes.GOING_AWAY);
        assertThat(connector.last().closed()).isTrue();
    }
}
