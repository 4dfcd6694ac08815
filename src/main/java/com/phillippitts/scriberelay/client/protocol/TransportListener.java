package com.phillippitts.scriberelay.client.protocol;

/**
 * Callbacks of one client transport connection. Invoked on transport threads.
 */
public interface TransportListener {

    void onOpen(TransportConnection connection);

    void onText(String text);

    void onBinary(byte[] data);

    void onClose(int code, String reason);

    void onError(Exception error);
}
