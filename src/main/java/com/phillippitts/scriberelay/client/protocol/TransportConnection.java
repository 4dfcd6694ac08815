package com.phillippitts.scriberelay.client.protocol;

/**
 * Outbound half of an open client transport. Sends on a closed connection are dropped.
 */
public interface TransportConnection {

    void sendText(String text);

    void sendBinary(byte[] data);

    void close(int code, String reason);

    boolean isOpen();
}
