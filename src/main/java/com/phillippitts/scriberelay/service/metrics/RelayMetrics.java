package com.phillippitts.scriberelay.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for relay sessions and live transcript engines.
 *
 * <p>Tracks:
 * <ul>
 *   <li>session lifecycle (opened, rejected, closed with duration)</li>
 *   <li>audio bytes forwarded upstream</li>
 *   <li>transcript results by kind</li>
 *   <li>upstream failures and engine fallbacks</li>
 * </ul>
 *
 * <p>Tags carry categories only, never user ids or transcript content.
 */
@Component
public class RelayMetrics {

    private static final String METRIC_PREFIX = "scriberelay";

    private final MeterRegistry registry;

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void sessionOpened() {
        Counter.builder(METRIC_PREFIX + ".relay.sessions.opened")
                .description("Client WebSocket sessions accepted")
                .register(registry)
                .increment();
    }

    /**
     * Counts sessions rejected before streaming.
     *
     * @param reason origin, auth_timeout or auth_failed
     */
    public void sessionRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".relay.sessions.rejected")
                .description("Sessions closed before streaming started")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void sessionClosed(long durationMillis) {
        Timer.builder(METRIC_PREFIX + ".relay.session.duration")
                .description("Lifetime of relay sessions")
                .register(registry)
                .record(durationMillis, TimeUnit.MILLISECONDS);
    }

    public void audioForwarded(int bytes) {
        Counter.builder(METRIC_PREFIX + ".relay.audio.bytes")
                .description("Audio bytes forwarded to the upstream engine")
                .baseUnit("bytes")
                .register(registry)
                .increment(bytes);
    }

    /**
     * @param reason before_auth or not_streaming
     */
    public void audioDropped(String reason) {
        Counter.builder(METRIC_PREFIX + ".relay.audio.dropped")
                .description("Client audio frames not forwarded")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param kind partial, final or utterance_end
     */
    public void resultRelayed(String kind) {
        Counter.builder(METRIC_PREFIX + ".relay.results")
                .description("Transcript events relayed to clients")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void upstreamFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".relay.upstream.failures")
                .description("Upstream engine connection failures")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records a live engine switch.
     *
     * @param from engine that failed or was unavailable
     * @param to   engine that took over
     */
    public void engineFallback(String from, String to) {
        Counter.builder(METRIC_PREFIX + ".engine.fallbacks")
                .description("Live transcript engine fallbacks")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome success or failure
     */
    public void summaryCall(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".summary.latency")
                .description("Running summary request latency")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
