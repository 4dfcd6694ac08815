package com.phillippitts.scriberelay.client.protocol;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.drafts.Draft_6455;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.handshake.ServerHandshake;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ClientTransport} backed by Java-WebSocket clients.
 */
@Component
public class JavaWebSocketTransport implements ClientTransport {

    private static final Logger LOG = LogManager.getLogger(JavaWebSocketTransport.class);

    private final Duration handshakeTimeout;

    public JavaWebSocketTransport() {
        this(Duration.ofSeconds(10));
    }

    public JavaWebSocketTransport(Duration handshakeTimeout) {
        this.handshakeTimeout = Objects.requireNonNull(handshakeTimeout);
    }

    @Override
    public TransportConnection connect(URI uri, Map<String, String> headers, TransportListener listener) {
        Connection connection = new Connection(uri, headers, (int) handshakeTimeout.toMillis(), listener);
        LOG.debug("Connecting client transport: host={}", uri.getHost());
        connection.connect();
        return connection;
    }

    private static final class Connection extends WebSocketClient implements TransportConnection {

        private final TransportListener listener;

        Connection(URI uri, Map<String, String> headers, int timeoutMs, TransportListener listener) {
            super(uri, new Draft_6455(), headers, timeoutMs);
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
        }

        @Override
        public void onOpen(ServerHandshake handshake) {
            listener.onOpen(this);
        }

        @Override
        public void onMessage(String message) {
            listener.onText(message);
        }

        @Override
        public void onMessage(ByteBuffer bytes) {
            byte[] data = new byte[bytes.remaining()];
            bytes.get(data);
            listener.onBinary(data);
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
        public void sendText(String text) {
            try {
                send(text);
            } catch (WebsocketNotConnectedException e) {
                LOG.debug("Dropping text message: transport not connected");
            }
        }

        @Override
        public void sendBinary(byte[] data) {
            try {
                send(data);
            } catch (WebsocketNotConnectedException e) {
                LOG.debug("Dropping binary message: transport not connected");
            }
        }
    }
}
