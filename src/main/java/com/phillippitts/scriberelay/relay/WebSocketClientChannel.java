package com.phillippitts.scriberelay.relay;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link ClientChannel} over a Spring {@link WebSocketSession}.
 */
final class WebSocketClientChannel implements ClientChannel {

    private static final Logger LOG = LogManager.getLogger(WebSocketClientChannel.class);

    private final WebSocketSession session;

    WebSocketClientChannel(WebSocketSession session) {
        this.session = Objects.requireNonNull(session, "session must not be null");
    }

    @Override
    public void sendText(String text) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new TextMessage(text));
        } catch (IOException | IllegalStateException e) {
            LOG.debug("Send to client failed: {}", e.toString());
        }
    }

    @Override
    public void close(int code, String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            LOG.debug("Closing client socket failed: {}", e.toString());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
