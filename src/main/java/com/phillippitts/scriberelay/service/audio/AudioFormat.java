package com.phillippitts.scriberelay.service.audio;

/**
 * Wire format of every audio frame leaving the capture pipeline:
 * 16 kHz, 16-bit signed PCM, mono, little-endian.
 *
 * <p>The microphone itself is opened at its native rate ({@link #DEFAULT_NATIVE_SAMPLE_RATE}
 * unless configured otherwise) and resampled down to {@link #WIRE_SAMPLE_RATE}.
 */
public final class AudioFormat {

    /** Sample rate expected by every recognition engine, in Hz. */
    public static final int WIRE_SAMPLE_RATE = 16_000;
    public static final int BITS_PER_SAMPLE = 16;
    public static final int CHANNELS = 1;
    public static final boolean SIGNED = true;
    public static final boolean BIG_ENDIAN = false;

    /** Bytes per sample frame. */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS;
    /** Bytes per second on the wire. */
    public static final int BYTE_RATE = WIRE_SAMPLE_RATE * BLOCK_ALIGN;

    /** Typical capture rate of desktop microphones. */
    public static final int DEFAULT_NATIVE_SAMPLE_RATE = 48_000;

    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}

    /** Number of wire bytes covering {@code millis} of audio. */
    public static int bytesForMillis(long millis) {
        return (int) ((millis * BYTE_RATE) / 1000L) & ~1;
    }

    /** Java Sound format for opening a capture line at {@code sampleRate}. */
    public static javax.sound.sampled.AudioFormat captureFormat(int sampleRate) {
        return new javax.sound.sampled.AudioFormat(sampleRate, BITS_PER_SAMPLE, CHANNELS, SIGNED, BIG_ENDIAN);
    }
}
