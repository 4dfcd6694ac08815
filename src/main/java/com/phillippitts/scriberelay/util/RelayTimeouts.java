package com.phillippitts.scriberelay.util;

import java.time.Duration;

/**
 * Default deadlines used across the relay, the session client and the capture pipeline.
 *
 * <p>Configuration properties fall back to these values when a key is absent.
 */
public final class RelayTimeouts {

    /** First client message must authenticate within this window. */
    public static final Duration AUTH_TIMEOUT = Duration.ofSeconds(5);

    /** Grace period after CloseStream for the engine to flush its last finals. */
    public static final Duration FLUSH_GRACE = Duration.ofMillis(500);

    /** Interval of KeepAlive control messages sent to the upstream engine. */
    public static final Duration UPSTREAM_KEEP_ALIVE = Duration.ofSeconds(8);

    /** Client deadline for reaching the ready state. */
    public static final Duration CLIENT_CONNECT_TIMEOUT = Duration.ofSeconds(8);

    /** Client wait for the done message after sending stop. */
    public static final Duration CLIENT_STOP_TIMEOUT = Duration.ofSeconds(3);

    /** Join timeout for the capture thread on a normal stop. */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofSeconds(1);

    /** Join timeout for the capture thread during application shutdown. */
    public static final Duration CAPTURE_THREAD_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** How long a new microphone owner waits for the previous owner to release the device. */
    public static final Duration MICROPHONE_RELEASE_TIMEOUT = Duration.ofSeconds(2);

    private RelayTimeouts() {
    }
}
