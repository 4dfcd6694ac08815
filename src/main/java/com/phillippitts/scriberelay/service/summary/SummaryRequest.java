package com.phillippitts.scriberelay.service.summary;

import org.json.JSONObject;

import java.util.Objects;

/**
 * One summarization call: only the new transcript text and the previous summary are sent.
 *
 * @param transcriptDelta transcript appended since the last successful summary
 * @param runningSummary  previous summary, empty on the first call
 * @param preferences     note style preferences, may be null
 */
public record SummaryRequest(String transcriptDelta, String runningSummary, String preferences) {

    public SummaryRequest {
        Objects.requireNonNull(transcriptDelta, "transcriptDelta must not be null");
        runningSummary = runningSummary == null ? "" : runningSummary;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject()
                .put("transcriptDelta", transcriptDelta)
                .put("runningSummary", runningSummary);
        if (preferences != null && !preferences.isBlank()) {
            json.put("preferences", preferences);
        }
        return json;
    }
}
