package com.phillippitts.scriberelay.relay;

/** Application WebSocket close codes sent by the relay. */
public final class CloseCodes {

    public static final int NORMAL = 1000;
    public static final int GOING_AWAY = 1001;
    public static final int AUTH_TIMEOUT = 4001;
    public static final int AUTH_FAILED = 4002;
    public static final int ORIGIN_NOT_ALLOWED = 4003;

    private CloseCodes() {
    }
}
