package com.phillippitts.scriberelay.service.events;

import com.phillippitts.scriberelay.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.scriberelay.service.engine.EngineFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.reason();
        if (!shouldLog(key)) {
            return;
        }
        if ("BUFFER_OVERFLOW".equals(e.reason())) {
            LOG.warn("Capture error: reason={}, owner={}. Audio is not being sent fast enough.",
                    e.reason(), e.owner());
        } else {
            LOG.warn("Capture error: reason={}, owner={}. Check microphone device & permissions.",
                    e.reason(), e.owner());
        }
    }

    @EventListener
    void onEngineFallback(EngineFallbackEvent e) {
        String key = "fallback-" + e.from().tag() + '-' + e.to().tag();
        if (shouldLog(key)) {
            LOG.warn("Live transcript engine fallback: {} -> {} ({})", e.from(), e.to(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
