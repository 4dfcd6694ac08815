package com.phillippitts.scriberelay.exception;

/**
 * Thrown when PCM data does not match the wire format (16 kHz, 16-bit signed, mono,
 * little-endian), for example an odd byte count or an unsupported capture rate.
 */
public class InvalidAudioException extends ScribeRelayException {

    private final int audioSize;
    private final String reason;

    public InvalidAudioException(int audioSize, String reason) {
        super("Invalid audio data (" + audioSize + " bytes): " + reason);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public int getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }
}
