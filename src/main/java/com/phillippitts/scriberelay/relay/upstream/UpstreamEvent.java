package com.phillippitts.scriberelay.relay.upstream;

/**
 * Classified upstream message.
 *
 * @param kind        what the relay should do with it
 * @param text        transcript text for PARTIAL and FINAL, otherwise ""
 * @param speechFinal end-of-utterance flag carried by FINAL results
 */
public record UpstreamEvent(Kind kind, String text, boolean speechFinal) {

    public enum Kind {
        PARTIAL,
        FINAL,
        UTTERANCE_END,
        METADATA,
        IGNORED
    }

    static final UpstreamEvent IGNORED = new UpstreamEvent(Kind.IGNORED, "", false);
}
