package com.phillippitts.scriberelay.domain;

import com.phillippitts.scriberelay.exception.InvalidAudioException;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable block of PCM16LE mono 16 kHz audio, flushed from the capture buffer on a timer.
 *
 * <p>The sample array is copied on construction and on access, so a frame handed to a sender
 * can never be mutated by the capture thread.
 */
public final class AudioFrame {

    /** Bytes per second of the wire format (16000 samples x 2 bytes). */
    private static final int BYTE_RATE = 32_000;

    private final byte[] pcm;
    private final Instant capturedAt;

    public AudioFrame(byte[] pcm, Instant capturedAt) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");
        if (pcm.length % 2 != 0) {
            throw new InvalidAudioException(pcm.length, "PCM16 frame must contain whole samples");
        }
        this.pcm = Arrays.copyOf(pcm, pcm.length);
        this.capturedAt = capturedAt;
    }

    public static AudioFrame of(byte[] pcm) {
        return new AudioFrame(pcm, Instant.now());
    }

    /** Returns a copy of the little-endian PCM bytes. */
    public byte[] pcm() {
        return Arrays.copyOf(pcm, pcm.length);
    }

    public Instant capturedAt() {
        return capturedAt;
    }

    public int sizeBytes() {
        return pcm.length;
    }

    public int sampleCount() {
        return pcm.length / 2;
    }

    public long durationMillis() {
        return (pcm.length * 1000L) / BYTE_RATE;
    }

    public boolean isEmpty() {
        return pcm.length == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioFrame other)) {
            return false;
        }
        return Arrays.equals(pcm, other.pcm) && capturedAt.equals(other.capturedAt);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(pcm) + capturedAt.hashCode();
    }

    @Override
    public String toString() {
        return "AudioFrame[" + pcm.length + " bytes @ " + capturedAt + "]";
    }
}
