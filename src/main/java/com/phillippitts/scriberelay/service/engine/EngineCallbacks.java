package com.phillippitts.scriberelay.service.engine;

/**
 * Events raised by a running {@link LiveTranscriptEngine}. Invoked on engine threads.
 */
public interface EngineCallbacks {

    /** The engine is consuming audio. */
    void onReady();

    void onPartial(String text);

    /** Text committed by the engine, overlap already removed, with trailing space. */
    void onCommitted(String text);

    /**
     * The engine cannot continue this session.
     *
     * @param message user-safe reason
     */
    void onFailure(String message);

    /** The engine finished after {@link LiveTranscriptEngine#stop()}. */
    void onStopped();
}
