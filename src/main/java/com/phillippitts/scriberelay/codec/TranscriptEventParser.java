package com.phillippitts.scriberelay.codec;

import com.phillippitts.scriberelay.domain.TranscriptFragment;
import com.phillippitts.scriberelay.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns event-stream {@code TranscriptEvent} and exception frames into domain values.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
public final class TranscriptEventParser {

    private static final Logger LOG = LogManager.getLogger(TranscriptEventParser.class);

    static final String INVALID_SIGNATURE = "InvalidSignatureException";

    private TranscriptEventParser() {
    }

    /**
     * Extracts the transcript results of a {@code TranscriptEvent}.
     *
     * @return fragments in payload order; empty for other event types or malformed JSON
     */
    public static List<TranscriptFragment> parse(EventStreamMessage message) {
        if (!"event".equals(message.messageType()) || !"TranscriptEvent".equals(message.eventType())) {
            return List.of();
        }
        return parsePayload(message.payload());
    }

    static List<TranscriptFragment> parsePayload(byte[] payload) {
        try {
            JSONObject root = new JSONObject(new String(payload, StandardCharsets.UTF_8));
            JSONObject transcript = root.optJSONObject("Transcript");
            JSONArray results = transcript == null ? null : transcript.optJSONArray("Results");
            if (results == null) {
                return List.of();
            }
            List<TranscriptFragment> out = new ArrayList<>(results.length());
            for (int i = 0; i < results.length(); i++) {
                JSONObject r = results.optJSONObject(i);
                if (r != null) {
                    out.add(toFragment(r));
                }
            }
            return out;
        } catch (JSONException e) {
            LOG.debug("Ignoring malformed TranscriptEvent payload ({} bytes)", payload.length);
            return List.of();
        }
    }

    private static TranscriptFragment toFragment(JSONObject r) {
        List<String> alternatives = new ArrayList<>();
        JSONArray alts = r.optJSONArray("Alternatives");
        if (alts != null) {
            for (int i = 0; i < alts.length(); i++) {
                JSONObject alt = alts.optJSONObject(i);
                alternatives.add(alt == null ? "" : alt.optString("Transcript", ""));
            }
        }
        if (alternatives.isEmpty()) {
            alternatives.add("");
        }
        return new TranscriptFragment(
                r.optString("ResultId", ""),
                r.optBoolean("IsPartial", false),
                false,
                r.optDouble("StartTime", 0),
                r.optDouble("EndTime", 0),
                alternatives);
    }

    /**
     * Maps an exception frame to text that is safe to show to the user.
     */
    public static String userFacingError(EventStreamMessage message) {
        String code;
        try {
            JSONObject body = new JSONObject(new String(message.payload(), StandardCharsets.UTF_8));
            code = firstNonBlank(body.optString("Code", null), body.optString("ErrorCode", null),
                    message.exceptionType(), "Unknown");
            String raw = firstNonBlank(body.optString("Message", null), body.optString("message", null), "");
            LOG.warn("Engine exception: code={}, type={}, message={}",
                    code, message.exceptionType(), LogSanitizer.maskSecrets(raw));
        } catch (JSONException e) {
            LOG.warn("Engine exception with unreadable payload: type={}", message.exceptionType());
            return "Transcription error";
        }
        if (INVALID_SIGNATURE.equals(code)) {
            return "Authentication failed - please try again";
        }
        return "Transcription error: " + LogSanitizer.maskSecrets(code);
    }

    private static String firstNonBlank(String... candidates) {
        for (String c : candidates) {
            if (c != null && !c.isBlank()) {
                return c;
            }
        }
        return null;
    }
}
