package com.phillippitts.scriberelay.exception;

/**
 * Thrown for network failures that are worth retrying (connection reset, 5xx, timeouts).
 */
public class TransientNetworkException extends ScribeRelayException {

    private final String endpoint;

    public TransientNetworkException(String endpoint, String message, Throwable cause) {
        super(message + " (endpoint: " + endpoint + ")", cause);
        this.endpoint = endpoint;
    }

    public TransientNetworkException(String endpoint, String message) {
        this(endpoint, message, null);
    }

    public String getEndpoint() {
        return endpoint;
    }
}
