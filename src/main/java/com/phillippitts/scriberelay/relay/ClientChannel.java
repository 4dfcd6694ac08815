package com.phillippitts.scriberelay.relay;

/**
 * Outbound side of a client WebSocket as seen by a relay session.
 * Sends never throw; failures are logged and reported through {@link #isOpen()}.
 */
public interface ClientChannel {

    void sendText(String text);

    void close(int code, String reason);

    boolean isOpen();
}
