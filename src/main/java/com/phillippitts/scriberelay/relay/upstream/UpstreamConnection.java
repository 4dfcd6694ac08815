package com.phillippitts.scriberelay.relay.upstream;

/** One streaming connection to the recognition engine, owned by a single relay session. */
public interface UpstreamConnection {

    /** Forwards raw PCM bytes unchanged. */
    void sendAudio(byte[] pcm);

    /** Sends a JSON control message such as KeepAlive or CloseStream. */
    void sendControl(String json);

    boolean isOpen();

    void close();
}
