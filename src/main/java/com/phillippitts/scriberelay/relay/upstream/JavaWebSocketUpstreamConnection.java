package com.phillippitts.scriberelay.relay.upstream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.drafts.Draft_6455;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.handshake.ServerHandshake;

import java.net.URI;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;

/**
 * Upstream connection backed by a Java-WebSocket client.
 */
final class JavaWebSocketUpstreamConnection extends WebSocketClient implements UpstreamConnection {

    private static final Logger LOG = LogManager.getLogger(JavaWebSocketUpstreamConnection.class);

    private final UpstreamListener listener;

    JavaWebSocketUpstreamConnection(URI uri, Map<String, String> headers, int connectTimeoutMs,
                                    UpstreamListener listener) {
        super(uri, new Draft_6455(), headers, connectTimeoutMs);
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    @Override
    public void onOpen(ServerHandshake handshake) {
        listener.onOpen();
    }

    @Override
    public void onMessage(String message) {
        listener.onMessage(message);
    }

    @Override
    public void onMessage(ByteBuffer bytes) {
        LOG.debug("Ignoring binary upstream message ({} bytes)", bytes.remaining());
    }

    @Override
    public void onClose(int code, String reason, boolean remote) {
        listener.onClose(code, reason);
    }

    @Override
    public void onError(Exception ex) {
        listener.onError(ex);
    }

    @Override
    public void sendAudio(byte[] pcm) {
        try {
            send(pcm);
        } catch (WebsocketNotConnectedException e) {
            LOG.debug("Dropping audio: upstream not connected");
        }
    }

    @Override
    public void sendControl(String json) {
        try {
            send(json);
        } catch (WebsocketNotConnectedException e) {
            LOG.debug("Dropping control message: upstream not connected");
        }
    }
}
