package com.phillippitts.scriberelay.service.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RelayMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final RelayMetrics metrics = new RelayMetrics(registry);

    @Test
    void countsSessionsAndRejectionsByReason() {
        metrics.sessionOpened();
        metrics.sessionOpened();
        metrics.sessionRejected("origin");
        metrics.sessionRejected("auth_failed");
        metrics.sessionRejected("auth_failed");

        assertThat(registry.get("scriberelay.relay.sessions.opened").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("scriberelay.relay.sessions.rejected").tag("reason", "origin").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("scriberelay.relay.sessions.rejected").tag("reason", "auth_failed").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void accumulatesForwardedAudioBytes() {
        metrics.audioForwarded(3200);
        metrics.audioForwarded(640);

        assertThat(registry.get("scriberelay.relay.audio.bytes").counter().count()).isEqualTo(3840.0);
    }

    @Test
    void recordsSessionDuration() {
        metrics.sessionClosed(1500);

        assertThat(registry.get("scriberelay.relay.session.duration").timer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(1500.0);
    }

    @Test
    void tagsFallbacksWithBothEngines() {
        metrics.engineFallback("relay", "chunk");

        assertThat(registry.get("scriberelay.engine.fallbacks").tag("from", "relay").tag("to", "chunk")
                .counter().count()).isEqualTo(1.0);
    }
}
