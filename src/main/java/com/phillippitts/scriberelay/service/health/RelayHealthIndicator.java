package com.phillippitts.scriberelay.service.health;

import com.phillippitts.scriberelay.config.relay.UpstreamProperties;
import com.phillippitts.scriberelay.relay.SessionRegistry;
import com.phillippitts.scriberelay.service.engine.EngineState;
import com.phillippitts.scriberelay.service.engine.LiveTranscriptCoordinator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Health of the relay and the live transcript engines.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: upstream API key present</li>
 *   <li>DOWN: no upstream API key, so no session can stream</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class RelayHealthIndicator implements HealthIndicator {

    private final SessionRegistry sessions;
    private final UpstreamProperties upstream;
    private final LiveTranscriptCoordinator coordinator;

    public RelayHealthIndicator(SessionRegistry sessions,
                                UpstreamProperties upstream,
                                LiveTranscriptCoordinator coordinator) {
        this.sessions = sessions;
        this.upstream = upstream;
        this.coordinator = coordinator;
    }

    @Override
    public Health health() {
        EngineState engine = coordinator.engineState();
        Health.Builder builder = upstream.isConfigured() ? Health.up() : Health.down();
        builder.withDetail("status", upstream.isConfigured() ? "Relay operational" : "Upstream API key missing")
                .withDetail("sessions", sessions.size())
                .withDetail("upstreamConfigured", upstream.isConfigured())
                .withDetail("liveEngine", engine.active().tag())
                .withDetail("liveEngineStatus", engine.status().name().toLowerCase(Locale.ROOT));
        return builder.build();
    }
}
