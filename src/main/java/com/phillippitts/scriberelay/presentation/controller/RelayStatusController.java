package com.phillippitts.scriberelay.presentation.controller;

import com.phillippitts.scriberelay.relay.SessionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Load-balancer health check and service banner.
 */
@RestController
class RelayStatusController {

    private static final Logger LOG = LogManager.getLogger(RelayStatusController.class);

    static final String SERVICE_NAME = "scribe-relay";

    private final SessionRegistry registry;
    private final Clock clock;
    private final long startedAtMillis;

    @org.springframework.beans.factory.annotation.Autowired
    RelayStatusController(SessionRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    // Package-private for tests
    RelayStatusController(SessionRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
        this.startedAtMillis = clock.millis();
    }

    @GetMapping({"/health", "/health/"})
    ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("sessions", registry.size());
        body.put("uptime", (clock.millis() - startedAtMillis) / 1000.0);
        LOG.debug("Health check: sessions={}", registry.size());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/")
    ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of("service", SERVICE_NAME, "status", "running"));
    }
}
