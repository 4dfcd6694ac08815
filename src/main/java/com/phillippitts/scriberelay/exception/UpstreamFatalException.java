package com.phillippitts.scriberelay.exception;

/**
 * Thrown when the upstream recognition engine rejects or drops a session for good.
 */
public class UpstreamFatalException extends ScribeRelayException {

    private final int closeCode;

    public UpstreamFatalException(String message, int closeCode) {
        super(message + " (close code " + closeCode + ")");
        this.closeCode = closeCode;
    }

    public UpstreamFatalException(String message, Throwable cause) {
        super(message, cause);
        this.closeCode = -1;
    }

    /** WebSocket close code reported by the engine, or -1 when the failure was not a close. */
    public int getCloseCode() {
        return closeCode;
    }
}
