package com.phillippitts.scriberelay.relay.upstream;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Classifies upstream engine JSON by its {@code type} field.
 *
 * <p>{@code Results} with {@code is_final=false} and non-empty text become PARTIAL;
 * with {@code is_final=true} they become FINAL (even when empty, so the final count matches
 * the engine's). Anything unparseable is IGNORED.
 *
 * <p>Thread-safe: stateless.
 */
public final class UpstreamResultClassifier {

    private UpstreamResultClassifier() {
    }

    public static UpstreamEvent classify(String raw) {
        if (raw == null || raw.isBlank()) {
            return UpstreamEvent.IGNORED;
        }
        JSONObject msg;
        try {
            msg = new JSONObject(raw);
        } catch (JSONException e) {
            return UpstreamEvent.IGNORED;
        }
        String type = msg.optString("type", "");
        switch (type) {
            case "Results":
                return classifyResults(msg);
            case "UtteranceEnd":
                return new UpstreamEvent(UpstreamEvent.Kind.UTTERANCE_END, "", false);
            case "Metadata":
                return new UpstreamEvent(UpstreamEvent.Kind.METADATA, "", false);
            default:
                return UpstreamEvent.IGNORED;
        }
    }

    private static UpstreamEvent classifyResults(JSONObject msg) {
        String transcript = firstTranscript(msg.optJSONObject("channel"));
        if (msg.optBoolean("is_final", false)) {
            return new UpstreamEvent(UpstreamEvent.Kind.FINAL, transcript, msg.optBoolean("speech_final", false));
        }
        if (transcript.isEmpty()) {
            return UpstreamEvent.IGNORED;
        }
        return new UpstreamEvent(UpstreamEvent.Kind.PARTIAL, transcript, false);
    }

    private static String firstTranscript(JSONObject channel) {
        if (channel == null) {
            return "";
        }
        JSONArray alternatives = channel.optJSONArray("alternatives");
        if (alternatives == null || alternatives.isEmpty()) {
            return "";
        }
        JSONObject first = alternatives.optJSONObject(0);
        return first == null ? "" : first.optString("transcript", "");
    }
}
