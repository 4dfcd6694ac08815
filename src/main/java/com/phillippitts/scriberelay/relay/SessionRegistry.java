package com.phillippitts.scriberelay.relay;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-mostly index of live relay sessions. The only state shared between sessions.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final Map<String, RelaySession> sessions = new ConcurrentHashMap<>();

    public SessionRegistry(MeterRegistry meterRegistry) {
        Gauge.builder("scriberelay.relay.sessions.active", sessions, Map::size)
                .description("Relay sessions currently registered")
                .register(meterRegistry);
    }

    public void register(RelaySession session) {
        sessions.put(session.id(), session);
    }

    public void remove(RelaySession session) {
        sessions.remove(session.id(), session);
    }

    public Optional<RelaySession> find(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    public int size() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${relay.registry-log-interval:PT1M}")
    void logSummary() {
        if (!sessions.isEmpty()) {
            LOG.info("Relay sessions active: {}", sessions.size());
        }
    }

    @PreDestroy
    public void closeAll() {
        List<RelaySession> open = List.copyOf(sessions.values());
        if (!open.isEmpty()) {
            LOG.info("Shutting down with {} active session(s)", open.size());
        }
        open.forEach(RelaySession::shutdown);
    }
}
