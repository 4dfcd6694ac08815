package com.phillippitts.scriberelay.service.audio;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

import static com.phillippitts.scriberelay.service.audio.AudioFormat.BITS_PER_SAMPLE;
import static com.phillippitts.scriberelay.service.audio.AudioFormat.BLOCK_ALIGN;
import static com.phillippitts.scriberelay.service.audio.AudioFormat.BYTE_RATE;
import static com.phillippitts.scriberelay.service.audio.AudioFormat.CHANNELS;
import static com.phillippitts.scriberelay.service.audio.AudioFormat.WAV_HEADER_SIZE;
import static com.phillippitts.scriberelay.service.audio.AudioFormat.WIRE_SAMPLE_RATE;

/**
 * Wraps wire-format PCM in an in-memory RIFF/WAVE container for chunk uploads.
 */
public final class WavWriter {

    private static final short PCM_FORMAT_TAG = 1;

    private WavWriter() {}

    /**
     * @param pcm PCM16LE mono 16 kHz samples
     * @return a complete WAV file (44-byte header followed by {@code pcm})
     */
    public static byte[] toWav(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        ByteBuffer buf = ByteBuffer.allocate(WAV_HEADER_SIZE + pcm.length).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(ascii("RIFF"));
        buf.putInt(36 + pcm.length);
        buf.put(ascii("WAVE"));

        buf.put(ascii("fmt "));
        buf.putInt(16);
        buf.putShort(PCM_FORMAT_TAG);
        buf.putShort((short) CHANNELS);
        buf.putInt(WIRE_SAMPLE_RATE);
        buf.putInt(BYTE_RATE);
        buf.putShort((short) BLOCK_ALIGN);
        buf.putShort((short) BITS_PER_SAMPLE);

        buf.put(ascii("data"));
        buf.putInt(pcm.length);
        buf.put(pcm);
        return buf.array();
    }

    private static byte[] ascii(String tag) {
        return tag.getBytes(java.nio.charset.StandardCharsets.US_ASCII);
    }
}
