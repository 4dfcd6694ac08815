package com.phillippitts.scriberelay.service.engine;

/**
 * Live transcript strategies, in automatic-mode priority order.
 */
public enum LiveEngine {
    RELAY("Relay stream"),
    NATIVE("Native recognition"),
    CHUNK("Chunked backend");

    private final String label;

    LiveEngine(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Tag value for metrics. */
    public String tag() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
