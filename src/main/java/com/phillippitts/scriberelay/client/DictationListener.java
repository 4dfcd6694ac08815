package com.phillippitts.scriberelay.client;

import com.phillippitts.scriberelay.domain.SessionStats;

/**
 * Receives dictation client events. Callbacks run on client threads and must not block.
 * Transcript text passed here must not be logged.
 */
public interface DictationListener {

    default void onStateChanged(ClientState previous, ClientState current) {
    }

    /** Latest partial text; replaces any earlier partial. */
    default void onPartial(String text) {
    }

    /**
     * Newly committed text after overlap removal.
     *
     * @param committed  text appended by this result, with trailing space
     * @param transcript whole committed transcript so far
     */
    default void onCommitted(String committed, String transcript) {
    }

    /** Audio was discarded because no input target had focus. */
    default void onNoTarget() {
    }

    /** User-safe error message. */
    default void onError(String message) {
    }

    /** Session finished; {@code stats} is empty when the server reported none. */
    default void onDone(SessionStats stats) {
    }
}
