package com.phillippitts.scriberelay.relay;

import com.phillippitts.scriberelay.config.relay.RelayProperties;
import com.phillippitts.scriberelay.relay.auth.TokenVerifier;
import com.phillippitts.scriberelay.relay.upstream.UpstreamConnector;
import com.phillippitts.scriberelay.service.metrics.RelayMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Creates relay sessions wired to the shared event-loop pool, timer scheduler and registry.
 */
@Component
public class RelaySessionFactory {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final RelayProperties props;
    private final TokenVerifier verifier;
    private final UpstreamConnector connector;
    private final ScheduledExecutorService timers;
    private final Executor relayExecutor;
    private final RelayMetrics metrics;
    private final SessionRegistry registry;

    public RelaySessionFactory(RelayProperties props,
                               TokenVerifier verifier,
                               UpstreamConnector connector,
                               @Qualifier("relayTimers") ScheduledExecutorService timers,
                               @Qualifier("relayExecutor") Executor relayExecutor,
                               RelayMetrics metrics,
                               SessionRegistry registry) {
        this.props = props;
        this.verifier = verifier;
        this.connector = connector;
        this.timers = timers;
        this.relayExecutor = relayExecutor;
        this.metrics = metrics;
        this.registry = registry;
    }

    /** Creates and registers a session; it deregisters itself when released. */
    public RelaySession create(ClientChannel channel) {
        RelaySession session = new RelaySession(newSessionId(), channel, props, verifier, connector,
                timers, relayExecutor, metrics, registry::remove, Clock.systemUTC());
        registry.register(session);
        return session;
    }

    static String newSessionId() {
        return Long.toString(RANDOM.nextLong() & Long.MAX_VALUE, 36);
    }
}
