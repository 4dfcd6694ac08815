package com.phillippitts.scriberelay.service.engine;

/**
 * One live transcript strategy. A started engine reports through its callbacks until it
 * calls {@link EngineCallbacks#onStopped()} or {@link EngineCallbacks#onFailure(String)}.
 */
public interface LiveTranscriptEngine {

    LiveEngine kind();

    /** True when the engine can run in this environment and configuration. */
    boolean isAvailable();

    /**
     * Starts a session.
     *
     * @param committedSoFar transcript committed by an engine that ran earlier in the same
     *                       session; used to avoid repeating its last words
     */
    void start(String committedSoFar, EngineCallbacks callbacks);

    /** Requests an orderly end; idempotent. */
    void stop();
}
