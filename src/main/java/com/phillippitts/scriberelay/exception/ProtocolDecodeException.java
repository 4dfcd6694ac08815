package com.phillippitts.scriberelay.exception;

/**
 * Thrown when an inbound frame cannot be decoded: bad checksum, truncated header or
 * unparseable payload. A single failure discards the frame; repeated failures end the session.
 */
public class ProtocolDecodeException extends ScribeRelayException {

    public ProtocolDecodeException(String message) {
        super(message);
    }

    public ProtocolDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
