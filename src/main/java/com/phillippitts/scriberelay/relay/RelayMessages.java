package com.phillippitts.scriberelay.relay;

import com.phillippitts.scriberelay.domain.SessionStats;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Optional;

/**
 * JSON messages of the client/relay protocol.
 */
final class RelayMessages {

    /** Parsed client control message. {@code accessToken} is only set for {@code auth}. */
    record ClientMessage(String type, String accessToken) {
    }

    private RelayMessages() {
    }

    static Optional<ClientMessage> parseClientMessage(String text) {
        try {
            JSONObject json = new JSONObject(text);
            return Optional.of(new ClientMessage(json.optString("type", ""), json.optString("access_token", null)));
        } catch (JSONException e) {
            return Optional.empty();
        }
    }

    static String authenticated() {
        return type("authenticated");
    }

    static String ready() {
        return type("ready");
    }

    static String pong() {
        return type("pong");
    }

    static String utteranceEnd() {
        return type("utterance_end");
    }

    static String partial(String text) {
        return new JSONObject().put("type", "partial").put("text", text).toString();
    }

    static String fin(String text, boolean speechFinal) {
        return new JSONObject()
                .put("type", "final")
                .put("text", text)
                .put("speech_final", speechFinal)
                .toString();
    }

    static String done(SessionStats stats) {
        return new JSONObject().put("type", "done").put("stats", stats.toJson()).toString();
    }

    static String error(String message) {
        return new JSONObject().put("type", "error").put("error", message).toString();
    }

    static String keepAlive() {
        return type("KeepAlive");
    }

    static String closeStream() {
        return type("CloseStream");
    }

    private static String type(String type) {
        return new JSONObject().put("type", type).toString();
    }
}
