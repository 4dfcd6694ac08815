package com.phillippitts.scriberelay.service.engine;

/**
 * Result of one engine selection.
 *
 * @param preferred       engine selection aims for
 * @param active          engine actually in use
 * @param status          status of the active engine
 * @param label           text for the engine indicator, e.g. {@code Engine: Relay stream [fallback]}
 * @param didFallback     active differs from preferred during this session
 * @param fallbackWarning user-facing reason for the fallback, or null
 * @param debugForced     selection is pinned by {@code engine.force}
 */
public record EngineState(
        LiveEngine preferred,
        LiveEngine active,
        EngineStatus status,
        String label,
        boolean didFallback,
        String fallbackWarning,
        boolean debugForced
) {
}
