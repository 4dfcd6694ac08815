package com.phillippitts.scriberelay.service.engine;

/**
 * Observer of a live transcript session. All methods default to no-ops.
 */
public interface LiveTranscriptListener {

    default void onEngineState(EngineState state) {
    }

    default void onPartial(String text) {
    }

    /**
     * @param committed   text just committed
     * @param transcript  full transcript of the session so far
     */
    default void onTranscript(String committed, String transcript) {
    }

    /** The session ended because no engine could continue. */
    default void onError(String message) {
    }

    default void onStopped(String transcript) {
    }
}
