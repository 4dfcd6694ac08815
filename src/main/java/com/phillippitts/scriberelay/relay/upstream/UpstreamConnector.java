package com.phillippitts.scriberelay.relay.upstream;

/**
 * Opens upstream engine connections. Connecting is asynchronous: the returned connection
 * reports {@link UpstreamListener#onOpen()} or {@link UpstreamListener#onError(Exception)} later.
 */
public interface UpstreamConnector {

    UpstreamConnection connect(UpstreamListener listener);

    /** False when no engine credentials are configured; sessions can still authenticate. */
    boolean isConfigured();
}
