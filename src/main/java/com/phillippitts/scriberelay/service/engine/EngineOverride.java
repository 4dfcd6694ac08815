package com.phillippitts.scriberelay.service.engine;

import java.util.Locale;
import java.util.Optional;

/**
 * Debug override of engine selection ({@code engine.force}).
 */
public enum EngineOverride {
    AUTO,
    RELAY,
    NATIVE,
    CHUNK;

    /** Parses {@code relay|native|chunk|auto}; unknown or blank values read as AUTO. */
    public static EngineOverride parse(String value) {
        if (value == null) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "relay" -> RELAY;
            case "native" -> NATIVE;
            case "chunk" -> CHUNK;
            default -> AUTO;
        };
    }

    Optional<LiveEngine> engine() {
        return switch (this) {
            case AUTO -> Optional.empty();
            case RELAY -> Optional.of(LiveEngine.RELAY);
            case NATIVE -> Optional.of(LiveEngine.NATIVE);
            case CHUNK -> Optional.of(LiveEngine.CHUNK);
        };
    }
}
