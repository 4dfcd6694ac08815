package com.phillippitts.scriberelay.client.protocol;

import com.phillippitts.scriberelay.domain.AudioFrame;
import com.phillippitts.scriberelay.exception.ProtocolDecodeException;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Wire dialect spoken by the dictation client.
 */
public interface DictationProtocol {

    /** Short name for logs. */
    String name();

    URI endpoint();

    Map<String, String> handshakeHeaders();

    /** Called once the transport is open; may send a handshake message. */
    void onOpen(TransportConnection connection);

    /** True when audio may flow as soon as the transport opens. */
    boolean readyOnOpen();

    void sendAudio(TransportConnection connection, AudioFrame frame);

    /** Asks the server to finish the stream. */
    void sendStop(TransportConnection connection);

    /**
     * @throws ProtocolDecodeException when the message cannot be decoded
     */
    List<ProtocolEvent> decodeText(String text);

    /**
     * @throws ProtocolDecodeException when the frame cannot be decoded
     */
    List<ProtocolEvent> decodeBinary(byte[] data);
}
