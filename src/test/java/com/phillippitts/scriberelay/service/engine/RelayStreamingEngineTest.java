package com.phillippitts.scriberelay.service.engine;

import com.phillippitts.scriberelay.client.DictationClientFactory;
import com.phillippitts.scriberelay.client.InputTargetProvider;
import com.phillippitts.scriberelay.config.client.ClientProperties;
import com.phillippitts.scriberelay.testutil.FakeAudioCaptureFactory;
import com.phillippitts.scriberelay.testutil.FakeTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelayStreamingEngineTest {

    private final FakeTransport transport = new FakeTransport();
    private final FakeAudioCaptureFactory captures = new FakeAudioCaptureFactory();
    private final List<String> inserted = new CopyOnWriteArrayList<>();
    private final RecordingCallbacks callbacks = new RecordingCallbacks();

    private ScheduledExecutorService timers;
    private ScheduledExecutorService frameTimers;
    private RelayStreamingEngine engine;

    @BeforeEach
    void setUp() {
        timers = Executors.newSingleThreadScheduledExecutor();
        frameTimers = Executors.newSingleThreadScheduledExecutor();
        engine = new RelayStreamingEngine(factory("ws://localhost/dictate"));
    }

    @AfterEach
    void tearDown() {
        engine.stop();
        timers.shutdownNow();
        frameTimers.shutdownNow();
    }

    private DictationClientFactory factory(String relayUrl) {
        ClientProperties props = new ClientProperties(ClientProperties.Dialect.RELAY, relayUrl, "token", null,
                Duration.ofSeconds(30), Duration.ofSeconds(30), Duration.ofHours(1), 80);
        InputTargetProvider targets = () -> Optional.of(inserted::add);
        return new DictationClientFactory(props, transport, captures, targets, timers, frameTimers);
    }

    private FakeTransport.Attempt ready() {
        engine.start("", callbacks);
        FakeTransport.Attempt attempt = transport.last();
        attempt.open();
        attempt.text("{\"type\":\"ready\"}");
        return attempt;
    }

    @Test
    void availableOnlyWithRelayUrl() {
        assertThat(engine.isAvailable()).isTrue();
        assertThat(new RelayStreamingEngine(factory(" ")).isAvailable()).isFalse();
        assertThat(engine.kind()).isEqualTo(LiveEngine.RELAY);
    }

    @Test
    void reportsReadyPartialsAndCommits() {
        FakeTransport.Attempt attempt = ready();

        attempt.text("{\"type\":\"partial\",\"text\":\"blood pre\"}");
        attempt.text("{\"type\":\"final\",\"text\":\"Blood pressure normal\"}");

        assertThat(callbacks.events).containsExactly(
                "ready", "partial:blood pre", "committed:Blood pressure normal ");
        assertThat(inserted).containsExactly("Blood pressure normal ");
    }

    @Test
    void stopFinishesOnDone() {
        FakeTransport.Attempt attempt = ready();

        engine.stop();
        attempt.text("{\"type\":\"done\",\"stats\":{\"finalCount\":0}}");

        assertThat(callbacks.stopped.get()).isEqualTo(1);
        assertThat(callbacks.failures).isEmpty();

        // A new session can start once the previous client is released
        engine.start("", new RecordingCallbacks());
        assertThat(transport.attempts()).hasSize(2);
    }

    @Test
    void stopBeforeReadyFinishesImmediately() {
        engine.start("", callbacks);

        engine.stop();

        assertThat(callbacks.stopped.get()).isEqualTo(1);
        assertThat(callbacks.ready.get()).isZero();
    }

    @Test
    void connectionLossIsReportedAsFailure() {
        FakeTransport.Attempt attempt = ready();

        attempt.closeFromServer(1006, "");

        assertThat(callbacks.failures).containsExactly("Connection lost");
        assertThat(callbacks.stopped.get()).isZero();
    }

    @Test
    void serverErrorIsReportedAsFailure() {
        engine.start("", callbacks);
        FakeTransport.Attempt attempt = transport.last();
        attempt.open();

        attempt.text("{\"type\":\"error\",\"error\":\"Authentication failed\"}");

        assertThat(callbacks.failures).containsExactly("Authentication failed");
    }

    @Test
    void secondStartWhileRunningThrows() {
        engine.start("", callbacks);

        assertThatThrownBy(() -> engine.start("", new RecordingCallbacks()))
                .isInstanceOf(IllegalStateException.class);
    }
}
