package com.phillippitts.scriberelay.relay;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.nio.ByteBuffer;

/**
 * Bridges Spring WebSocket callbacks on {@code relay.path} to {@link RelaySession}s.
 *
 * <p>Origin filtering happens inside the session so a rejected origin receives close code
 * 4003 rather than a failed handshake.
 */
@Component
public class RelayWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(RelayWebSocketHandler.class);

    static final String SESSION_ATTRIBUTE = "relaySession";
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final RelaySessionFactory factory;

    public RelayWebSocketHandler(RelaySessionFactory factory) {
        this.factory = factory;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession ws) {
        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(ws, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
        RelaySession session = factory.create(new WebSocketClientChannel(safe));
        ws.getAttributes().put(SESSION_ATTRIBUTE, session);
        session.start(ws.getHandshakeHeaders().getOrigin());
    }

    @Override
    protected void handleTextMessage(WebSocketSession ws, TextMessage message) {
        RelaySession session = sessionOf(ws);
        if (session != null) {
            session.onClientText(message.getPayload());
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession ws, BinaryMessage message) {
        RelaySession session = sessionOf(ws);
        if (session != null) {
            ByteBuffer payload = message.getPayload();
            byte[] frame = new byte[payload.remaining()];
            payload.get(frame);
            session.onClientBinary(frame);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession ws, Throwable exception) {
        LOG.debug("Client transport error: {}", exception.getClass().getSimpleName());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession ws, CloseStatus status) {
        RelaySession session = sessionOf(ws);
        if (session != null) {
            session.onClientClosed(status.getCode());
        }
    }

    private static RelaySession sessionOf(WebSocketSession ws) {
        Object session = ws.getAttributes().get(SESSION_ATTRIBUTE);
        return session instanceof RelaySession relaySession ? relaySession : null;
    }
}
