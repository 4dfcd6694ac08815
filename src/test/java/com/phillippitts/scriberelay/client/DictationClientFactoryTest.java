package com.phillippitts.scriberelay.client;

import com.phillippitts.scriberelay.client.protocol.EventStreamProtocol;
import com.phillippitts.scriberelay.client.protocol.RelayProtocol;
import com.phillippitts.scriberelay.config.client.ClientProperties;
import com.phillippitts.scriberelay.testutil.FakeAudioCaptureFactory;
import com.phillippitts.scriberelay.testutil.FakeTransport;
import com.phillippitts.scriberelay.testutil.RecordingDictationListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

class DictationClientFactoryTest {

    private final ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor();
    private final ScheduledExecutorService frameTimers = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        timers.shutdownNow();
        frameTimers.shutdownNow();
    }

    private DictationClientFactory factory(ClientProperties.Dialect dialect, String relayUrl, String eventStreamUrl) {
        ClientProperties props = new ClientProperties(dialect, relayUrl, "token", eventStreamUrl,
                Duration.ofSeconds(8), Duration.ofSeconds(3), Duration.ofMillis(100), 80);
        return new DictationClientFactory(props, new FakeTransport(), new FakeAudioCaptureFactory(),
                Optional::empty, timers, frameTimers);
    }

    @Test
    void relayDialectNeedsRelayUrl() {
        assertThat(factory(ClientProperties.Dialect.RELAY, "ws://localhost/dictate", null).isConfigured()).isTrue();
        assertThat(factory(ClientProperties.Dialect.RELAY, "", "wss://stream.example").isConfigured()).isFalse();
    }

    @Test
    void eventStreamDialectNeedsEventStreamUrl() {
        assertThat(factory(ClientProperties.Dialect.EVENT_STREAM, "ws://localhost/dictate", null).isConfigured())
                .isFalse();
        assertThat(factory(ClientProperties.Dialect.EVENT_STREAM, null, "wss://stream.example").isConfigured())
                .isTrue();
    }

    @Test
    void protocolFollowsDialect() {
        assertThat(factory(ClientProperties.Dialect.RELAY, "ws://localhost/dictate", null).protocol())
                .isInstanceOf(RelayProtocol.class);
        assertThat(factory(ClientProperties.Dialect.EVENT_STREAM, null, "wss://stream.example").protocol())
                .isInstanceOf(EventStreamProtocol.class);
    }

    @Test
    void createsIdleClients() {
        DictationSessionClient client = factory(ClientProperties.Dialect.RELAY, "ws://localhost/dictate", null)
                .create(new RecordingDictationListener());

        assertThat(client.state()).isEqualTo(ClientState.IDLE);
        client.close();
    }
}
