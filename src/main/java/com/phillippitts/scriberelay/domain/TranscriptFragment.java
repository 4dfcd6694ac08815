package com.phillippitts.scriberelay.domain;

import java.util.List;
import java.util.Objects;

/**
 * A recognition result from a streaming engine.
 *
 * <p>Partial fragments may be revised by later ones; final fragments are committed at most
 * once per {@code resultId}. Engines that do not assign ids (the relay dialect, the native
 * recognizer) leave {@code resultId} null and are not deduplicated by id.
 *
 * @param resultId     engine-assigned id, or null
 * @param partial      true while the engine may still revise the text
 * @param speechFinal  true when the engine detected the end of an utterance
 * @param startSeconds offset of the first word, in seconds from stream start
 * @param endSeconds   offset of the last word, in seconds from stream start
 * @param alternatives candidate transcripts, best first (at least one)
 */
public record TranscriptFragment(
        String resultId,
        boolean partial,
        boolean speechFinal,
        double startSeconds,
        double endSeconds,
        List<String> alternatives
) {

    public TranscriptFragment {
        Objects.requireNonNull(alternatives, "alternatives must not be null");
        if (alternatives.isEmpty()) {
            throw new IllegalArgumentException("A fragment needs at least one alternative");
        }
        alternatives = List.copyOf(alternatives);
    }

    public static TranscriptFragment partial(String text) {
        return new TranscriptFragment(null, true, false, 0, 0, List.of(text));
    }

    public static TranscriptFragment fin(String text, boolean speechFinal) {
        return new TranscriptFragment(null, false, speechFinal, 0, 0, List.of(text));
    }

    /** Best alternative. */
    public String text() {
        return alternatives.get(0);
    }

    public boolean isFinal() {
        return !partial;
    }
}
