package com.phillippitts.scriberelay.codec;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A decoded event-stream frame: ordered string headers plus an opaque payload.
 */
public final class EventStreamMessage {

    public static final String CONTENT_TYPE = ":content-type";
    public static final String EVENT_TYPE = ":event-type";
    public static final String MESSAGE_TYPE = ":message-type";
    public static final String EXCEPTION_TYPE = ":exception-type";

    private final Map<String, String> headers;
    private final byte[] payload;

    public EventStreamMessage(Map<String, String> headers, byte[] payload) {
        Objects.requireNonNull(headers, "headers must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.payload = Arrays.copyOf(payload, payload.length);
    }

    public Map<String, String> headers() {
        return headers;
    }

    public byte[] payload() {
        return Arrays.copyOf(payload, payload.length);
    }

    public String header(String name) {
        return headers.get(name);
    }

    public String messageType() {
        return headers.get(MESSAGE_TYPE);
    }

    public String eventType() {
        return headers.get(EVENT_TYPE);
    }

    public String exceptionType() {
        return headers.get(EXCEPTION_TYPE);
    }

    public boolean isException() {
        return "exception".equals(messageType());
    }

    @Override
    public String toString() {
        return "EventStreamMessage[headers=" + headers.keySet() + ", payload=" + payload.length + " bytes]";
    }
}
