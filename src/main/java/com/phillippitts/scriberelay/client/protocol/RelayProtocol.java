package com.phillippitts.scriberelay.client.protocol;

import com.phillippitts.scriberelay.domain.AudioFrame;
import com.phillippitts.scriberelay.domain.SessionStats;
import com.phillippitts.scriberelay.exception.ProtocolDecodeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Relay dialect: JSON control messages, raw PCM16LE binary frames, JSON transcript events.
 *
 * <p>The first message after open is {@code {"type":"auth","access_token":...}}; audio may flow
 * once the relay answers {@code ready}.
 */
public final class RelayProtocol implements DictationProtocol {

    private static final Logger LOG = LogManager.getLogger(RelayProtocol.class);

    private final URI relayUri;
    private final Supplier<String> accessToken;

    public RelayProtocol(URI relayUri, Supplier<String> accessToken) {
        this.relayUri = Objects.requireNonNull(relayUri, "relayUri must not be null");
        this.accessToken = Objects.requireNonNull(accessToken, "accessToken must not be null");
    }

    @Override
    public String name() {
        return "relay";
    }

    @Override
    public URI endpoint() {
        return relayUri;
    }

    @Override
    public Map<String, String> handshakeHeaders() {
        return Map.of();
    }

    @Override
    public void onOpen(TransportConnection connection) {
        String token = accessToken.get();
        connection.sendText(new JSONObject()
                .put("type", "auth")
                .put("access_token", token == null ? "" : token)
                .toString());
    }

    @Override
    public boolean readyOnOpen() {
        return false;
    }

    @Override
    public void sendAudio(TransportConnection connection, AudioFrame frame) {
        connection.sendBinary(frame.pcm());
    }

    @Override
    public void sendStop(TransportConnection connection) {
        connection.sendText(new JSONObject().put("type", "stop").toString());
    }

    @Override
    public List<ProtocolEvent> decodeText(String text) {
        JSONObject json;
        try {
            json = new JSONObject(text);
        } catch (JSONException e) {
            throw new ProtocolDecodeException("Relay message is not a JSON object", e);
        }
        String type = json.optString("type", "");
        switch (type) {
            case "authenticated":
                return List.of(ProtocolEvent.of(ProtocolEvent.Kind.AUTHENTICATED));
            case "ready":
                return List.of(ProtocolEvent.of(ProtocolEvent.Kind.READY));
            case "pong":
                return List.of(ProtocolEvent.of(ProtocolEvent.Kind.PONG));
            case "partial":
                return List.of(ProtocolEvent.partial(json.optString("text", "")));
            case "final":
                return List.of(ProtocolEvent.fin(json.optString("text", ""), null,
                        json.optBoolean("speech_final", false)));
            case "utterance_end":
                return List.of(ProtocolEvent.of(ProtocolEvent.Kind.UTTERANCE_END));
            case "done":
                return List.of(ProtocolEvent.done(SessionStats.fromJson(json.optJSONObject("stats"))));
            case "error":
                return List.of(ProtocolEvent.error(json.optString("error", "Transcription error")));
            default:
                LOG.debug("Ignoring relay message of type '{}'", type);
                return List.of();
        }
    }

    @Override
    public List<ProtocolEvent> decodeBinary(byte[] data) {
        throw new ProtocolDecodeException("Unexpected binary message from relay (" + data.length + " bytes)");
    }
}
