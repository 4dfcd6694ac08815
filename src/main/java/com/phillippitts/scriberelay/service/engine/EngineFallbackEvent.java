package com.phillippitts.scriberelay.service.engine;

import java.time.Instant;

/**
 * Published when a live session switches to a lower-priority engine.
 *
 * @param from    engine that failed
 * @param to      engine that took over
 * @param reason  user-facing warning
 */
public record EngineFallbackEvent(LiveEngine from, LiveEngine to, String reason, Instant timestamp) {
}
