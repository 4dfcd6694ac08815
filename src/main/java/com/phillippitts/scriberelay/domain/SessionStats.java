package com.phillippitts.scriberelay.domain;

import org.json.JSONObject;

/**
 * Counters reported to the client in the {@code done} message when a relay session ends.
 */
public record SessionStats(
        long durationMs,
        long audioBytesSent,
        int partialCount,
        int finalCount,
        int finalTranscriptLength
) {

    private static final SessionStats EMPTY = new SessionStats(0, 0, 0, 0, 0);

    public static SessionStats empty() {
        return EMPTY;
    }

    public JSONObject toJson() {
        return new JSONObject()
                .put("durationMs", durationMs)
                .put("audioBytesSent", audioBytesSent)
                .put("partialCount", partialCount)
                .put("finalCount", finalCount)
                .put("finalTranscriptLength", finalTranscriptLength);
    }

    /** Lenient parse of a {@code stats} object; missing fields read as zero. */
    public static SessionStats fromJson(JSONObject json) {
        if (json == null) {
            return EMPTY;
        }
        return new SessionStats(
                json.optLong("durationMs", 0),
                json.optLong("audioBytesSent", 0),
                json.optInt("partialCount", 0),
                json.optInt("finalCount", 0),
                json.optInt("finalTranscriptLength", 0));
    }
}
