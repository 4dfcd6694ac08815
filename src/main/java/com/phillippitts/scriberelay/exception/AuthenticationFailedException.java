package com.phillippitts.scriberelay.exception;

/**
 * Thrown when an access token is missing, malformed, expired or fails signature verification.
 * The message is safe to show to the user; the underlying cause never is.
 */
public class AuthenticationFailedException extends ScribeRelayException {

    public AuthenticationFailedException(String message) {
        super(message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
