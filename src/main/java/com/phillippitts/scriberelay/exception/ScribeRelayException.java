package com.phillippitts.scriberelay.exception;

/**
 * Base exception for all scribe-relay errors.
 * Domain exceptions extend this class so the REST and WebSocket boundaries can map them in one place.
 */
public class ScribeRelayException extends RuntimeException {

    public ScribeRelayException(String message) {
        super(message);
    }

    public ScribeRelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
