package com.phillippitts.scriberelay.client.protocol;

import com.phillippitts.scriberelay.domain.SessionStats;

/**
 * Dialect-neutral event decoded from a server message.
 *
 * @param kind        what happened
 * @param text        transcript text for PARTIAL/FINAL, user-safe message for ERROR, else null
 * @param resultId    engine result id for FINAL, when the dialect provides one
 * @param speechFinal whether a FINAL closes an utterance
 * @param stats       session statistics for DONE
 */
public record ProtocolEvent(Kind kind, String text, String resultId, boolean speechFinal, SessionStats stats) {

    public enum Kind { AUTHENTICATED, READY, PARTIAL, FINAL, UTTERANCE_END, DONE, ERROR, PONG }

    public static ProtocolEvent of(Kind kind) {
        return new ProtocolEvent(kind, null, null, false, null);
    }

    public static ProtocolEvent partial(String text) {
        return new ProtocolEvent(Kind.PARTIAL, text, null, false, null);
    }

    public static ProtocolEvent fin(String text, String resultId, boolean speechFinal) {
        return new ProtocolEvent(Kind.FINAL, text, resultId, speechFinal, null);
    }

    public static ProtocolEvent done(SessionStats stats) {
        return new ProtocolEvent(Kind.DONE, null, null, false, stats);
    }

    public static ProtocolEvent error(String message) {
        return new ProtocolEvent(Kind.ERROR, message, null, false, null);
    }
}
