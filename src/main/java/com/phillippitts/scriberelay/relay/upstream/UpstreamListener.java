package com.phillippitts.scriberelay.relay.upstream;

/**
 * Callbacks from an upstream engine socket. Implementations must not block; the relay posts
 * each callback into the owning session's event loop.
 */
public interface UpstreamListener {

    void onOpen();

    void onMessage(String text);

    void onClose(int code, String reason);

    void onError(Exception error);
}
