package com.phillippitts.scriberelay.client.protocol;

import java.net.URI;
import java.util.Map;

/**
 * Opens WebSocket-style connections for the dictation client.
 */
@FunctionalInterface
public interface ClientTransport {

    /**
     * Starts connecting without blocking. Outcome is reported through {@code listener}.
     *
     * @return handle that can close the attempt before it opens
     */
    TransportConnection connect(URI uri, Map<String, String> headers, TransportListener listener);
}
