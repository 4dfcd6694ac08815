package com.phillippitts.scriberelay.client;

import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Commits finalized transcript fragments into an append-only transcript, removing text that
 * repeats the end of what was already committed.
 *
 * <p>Streaming engines often re-emit the last words of one final result at the start of the
 * next. The reconciler keeps a short trailing window of committed text and strips the longest
 * suffix of that window which equals (ignoring case) a prefix of the incoming text.
 *
 * <p>Not thread-safe; callers serialize access.
 */
public final class TranscriptReconciler {

    public static final int DEFAULT_WINDOW = 80;

    private final int window;
    private final StringBuilder transcript = new StringBuilder();
    private final Set<String> committedResultIds = new HashSet<>();
    private String tail = "";

    public TranscriptReconciler() {
        this(DEFAULT_WINDOW);
    }

    public TranscriptReconciler(int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.window = window;
    }

    /**
     * Offers one final result.
     *
     * @param resultId engine result id, or null when the dialect has none
     * @param text     final text as received
     * @return the text actually committed (with a trailing space), or empty when nothing new
     */
    public Optional<String> acceptFinal(String resultId, String text) {
        if (resultId != null && !committedResultIds.add(resultId)) {
            return Optional.empty();
        }
        String candidate = text == null ? "" : text.trim();
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        int overlap = overlapLength(tail.stripTrailing(), candidate);
        if (overlap > 0) {
            candidate = candidate.substring(overlap).stripLeading();
        }
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        String committed = candidate + " ";
        transcript.append(committed);
        tail = lastChars(tail + committed, window);
        return Optional.of(committed);
    }

    /** Length of the longest suffix of {@code tail} equal to a prefix of {@code text}, ignoring case. */
    static int overlapLength(String tail, String text) {
        int max = Math.min(tail.length(), text.length());
        String lowerTail = tail.toLowerCase(Locale.ROOT);
        String lowerText = text.toLowerCase(Locale.ROOT);
        for (int len = max; len > 0; len--) {
            if (lowerTail.regionMatches(lowerTail.length() - len, lowerText, 0, len)) {
                return len;
            }
        }
        return 0;
    }

    /**
     * Continues from text committed elsewhere (for example by an engine that failed over);
     * the overlap window is primed with its tail.
     */
    public void seed(String committed) {
        reset();
        if (committed != null && !committed.isEmpty()) {
            transcript.append(committed);
            tail = lastChars(committed, window);
        }
    }

    public void reset() {
        transcript.setLength(0);
        committedResultIds.clear();
        tail = "";
    }

    public String transcript() {
        return transcript.toString();
    }

    public String tail() {
        return tail;
    }

    public int window() {
        return window;
    }

    private static String lastChars(String s, int n) {
        return s.length() <= n ? s : s.substring(s.length() - n);
    }
}
