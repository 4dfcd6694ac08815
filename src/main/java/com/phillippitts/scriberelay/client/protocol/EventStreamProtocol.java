package com.phillippitts.scriberelay.client.protocol;

import com.phillippitts.scriberelay.codec.EventStreamCodec;
import com.phillippitts.scriberelay.codec.EventStreamMessage;
import com.phillippitts.scriberelay.codec.TranscriptEventParser;
import com.phillippitts.scriberelay.domain.AudioFrame;
import com.phillippitts.scriberelay.domain.TranscriptFragment;
import com.phillippitts.scriberelay.exception.ProtocolDecodeException;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Event-stream dialect: every audio frame is an {@code AudioEvent} message and results arrive
 * as binary {@code TranscriptEvent} messages carrying result ids.
 *
 * <p>The endpoint is a pre-signed URL, so no handshake message is sent and audio flows as
 * soon as the socket opens. An empty {@code AudioEvent} ends the stream.
 */
public final class EventStreamProtocol implements DictationProtocol {

    private static final byte[] END_OF_STREAM = new byte[0];

    private final URI presignedUri;

    public EventStreamProtocol(URI presignedUri) {
        this.presignedUri = Objects.requireNonNull(presignedUri, "presignedUri must not be null");
    }

    @Override
    public String name() {
        return "event-stream";
    }

    @Override
    public URI endpoint() {
        return presignedUri;
    }

    @Override
    public Map<String, String> handshakeHeaders() {
        return Map.of();
    }

    @Override
    public void onOpen(TransportConnection connection) {
        // Credentials travel in the pre-signed URL.
    }

    @Override
    public boolean readyOnOpen() {
        return true;
    }

    @Override
    public void sendAudio(TransportConnection connection, AudioFrame frame) {
        connection.sendBinary(EventStreamCodec.encodeAudioEvent(frame.pcm()));
    }

    @Override
    public void sendStop(TransportConnection connection) {
        connection.sendBinary(EventStreamCodec.encodeAudioEvent(END_OF_STREAM));
    }

    @Override
    public List<ProtocolEvent> decodeText(String text) {
        throw new ProtocolDecodeException("Unexpected text message on event stream");
    }

    @Override
    public List<ProtocolEvent> decodeBinary(byte[] data) {
        EventStreamMessage message = EventStreamCodec.decode(data);
        if (message == null) {
            throw new ProtocolDecodeException("Incomplete event-stream frame (" + data.length + " bytes)");
        }
        if (message.isException()) {
            return List.of(ProtocolEvent.error(TranscriptEventParser.userFacingError(message)));
        }
        List<TranscriptFragment> fragments = TranscriptEventParser.parse(message);
        List<ProtocolEvent> events = new ArrayList<>(fragments.size());
        for (TranscriptFragment f : fragments) {
            events.add(f.partial()
                    ? ProtocolEvent.partial(f.text())
                    : ProtocolEvent.fin(f.text(), blankToNull(f.resultId()), false));
        }
        return events;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
