package com.phillippitts.scriberelay.codec;

import com.phillippitts.scriberelay.exception.ProtocolDecodeException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Binary event-stream framing used by the pre-signed streaming dialect.
 *
 * <pre>
 * [total length u32][headers length u32][prelude CRC32]
 * [headers ...][payload ...][message CRC32]
 * </pre>
 *
 * All integers are big-endian. A header is {@code [name len u8][name][type u8][value len u16][value]};
 * only string headers (type 7) are written or understood.
 *
 * <p>Thread-safe: stateless.
 */
public final class EventStreamCodec {

    static final int PRELUDE_LENGTH = 12;
    static final int MIN_FRAME_LENGTH = 16;
    static final byte STRING_HEADER_TYPE = 7;

    private static final Map<String, String> AUDIO_EVENT_HEADERS = audioEventHeaders();

    private EventStreamCodec() {
    }

    private static Map<String, String> audioEventHeaders() {
        Map<String, String> h = new LinkedHashMap<>();
        h.put(EventStreamMessage.CONTENT_TYPE, "application/octet-stream");
        h.put(EventStreamMessage.EVENT_TYPE, "AudioEvent");
        h.put(EventStreamMessage.MESSAGE_TYPE, "event");
        return h;
    }

    /**
     * Wraps little-endian PCM16 bytes in an {@code AudioEvent} frame. An empty payload signals
     * end of stream to the engine.
     */
    public static byte[] encodeAudioEvent(byte[] pcm16le) {
        return encode(AUDIO_EVENT_HEADERS, pcm16le);
    }

    public static byte[] encode(Map<String, String> headers, byte[] payload) {
        Objects.requireNonNull(headers, "headers must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        byte[] headerBytes = encodeHeaders(headers);
        int total = PRELUDE_LENGTH + headerBytes.length + payload.length + 4;

        ByteBuffer buf = ByteBuffer.allocate(total).order(ByteOrder.BIG_ENDIAN);
        buf.putInt(total);
        buf.putInt(headerBytes.length);
        buf.putInt(Crc32.compute(buf.array(), 0, 8));
        buf.put(headerBytes);
        buf.put(payload);
        buf.putInt(Crc32.compute(buf.array(), 0, total - 4));
        return buf.array();
    }

    private static byte[] encodeHeaders(Map<String, String> headers) {
        int size = 0;
        for (Map.Entry<String, String> e : headers.entrySet()) {
            size += 1 + utf8(e.getKey()).length + 1 + 2 + utf8(e.getValue()).length;
        }
        ByteBuffer buf = ByteBuffer.allocate(size).order(ByteOrder.BIG_ENDIAN);
        for (Map.Entry<String, String> e : headers.entrySet()) {
            byte[] name = utf8(e.getKey());
            byte[] value = utf8(e.getValue());
            if (name.length > 255 || value.length > 0xFFFF) {
                throw new IllegalArgumentException("Header too long: " + e.getKey());
            }
            buf.put((byte) name.length);
            buf.put(name);
            buf.put(STRING_HEADER_TYPE);
            buf.putShort((short) value.length);
            buf.put(value);
        }
        return buf.array();
    }

    /**
     * Decodes one frame without checksum verification.
     *
     * @return the message, or null when {@code data} is shorter than a frame or than its
     *         declared length (the caller should wait for more bytes)
     */
    public static EventStreamMessage decode(byte[] data) {
        return decode(data, false);
    }

    /**
     * Decodes one frame.
     *
     * @param verify check the prelude and message CRCs
     * @return the message, or null for short input
     * @throws ProtocolDecodeException when {@code verify} is set and a checksum does not match
     */
    public static EventStreamMessage decode(byte[] data, boolean verify) {
        if (data == null || data.length < MIN_FRAME_LENGTH) {
            return null;
        }
        ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.BIG_ENDIAN);
        long total = Integer.toUnsignedLong(buf.getInt(0));
        long headersLength = Integer.toUnsignedLong(buf.getInt(4));
        if (total < MIN_FRAME_LENGTH || data.length < total) {
            return null;
        }
        int frameLength = (int) total;
        if (headersLength > frameLength - MIN_FRAME_LENGTH) {
            if (verify) {
                throw new ProtocolDecodeException("Headers length " + headersLength + " exceeds frame");
            }
            return null;
        }
        if (verify) {
            verifyChecksums(data, frameLength);
        }

        int headersEnd = PRELUDE_LENGTH + (int) headersLength;
        Map<String, String> headers = decodeHeaders(data, PRELUDE_LENGTH, headersEnd);
        int payloadLength = frameLength - headersEnd - 4;
        byte[] payload = new byte[payloadLength];
        System.arraycopy(data, headersEnd, payload, 0, payloadLength);
        return new EventStreamMessage(headers, payload);
    }

    private static void verifyChecksums(byte[] data, int frameLength) {
        ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.BIG_ENDIAN);
        int preludeCrc = buf.getInt(8);
        if (Crc32.compute(data, 0, 8) != preludeCrc) {
            throw new ProtocolDecodeException("Prelude checksum mismatch");
        }
        int messageCrc = buf.getInt(frameLength - 4);
        if (Crc32.compute(data, 0, frameLength - 4) != messageCrc) {
            throw new ProtocolDecodeException("Message checksum mismatch");
        }
    }

    private static Map<String, String> decodeHeaders(byte[] data, int start, int end) {
        Map<String, String> headers = new LinkedHashMap<>();
        int pos = start;
        while (pos < end) {
            int nameLength = data[pos] & 0xFF;
            pos++;
            if (pos + nameLength + 1 > end) {
                break;
            }
            String name = new String(data, pos, nameLength, StandardCharsets.UTF_8);
            pos += nameLength;
            byte type = data[pos];
            pos++;
            // Only string values are understood; anything else ends header parsing.
            if (type != STRING_HEADER_TYPE || pos + 2 > end) {
                break;
            }
            int valueLength = ((data[pos] & 0xFF) << 8) | (data[pos + 1] & 0xFF);
            pos += 2;
            if (pos + valueLength > end) {
                break;
            }
            headers.put(name, new String(data, pos, valueLength, StandardCharsets.UTF_8));
            pos += valueLength;
        }
        return headers;
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
