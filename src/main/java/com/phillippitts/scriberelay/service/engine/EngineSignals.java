package com.phillippitts.scriberelay.service.engine;

/**
 * Live inputs of engine selection.
 *
 * @param recording        a session is running
 * @param relayConfigured  a relay endpoint is configured
 * @param relayConnecting  the relay stream is connecting
 * @param relayReady       the relay stream reached ready
 * @param relayError       the relay stream failed in this session
 * @param nativeAvailable  on-device recognition is available
 * @param nativeListening  on-device recognition is consuming audio
 */
public record EngineSignals(
        boolean recording,
        boolean relayConfigured,
        boolean relayConnecting,
        boolean relayReady,
        boolean relayError,
        boolean nativeAvailable,
        boolean nativeListening
) {

    /** Not recording; only the static availability is known. */
    public static EngineSignals idle(boolean relayConfigured, boolean nativeAvailable) {
        return new EngineSignals(false, relayConfigured, false, false, false, nativeAvailable, false);
    }

    public EngineSignals withRecording(boolean value) {
        return new EngineSignals(value, relayConfigured, relayConnecting, relayReady, relayError,
                nativeAvailable, nativeListening);
    }

    public EngineSignals withRelayConnecting() {
        return new EngineSignals(recording, relayConfigured, true, false, relayError,
                nativeAvailable, nativeListening);
    }

    public EngineSignals withRelayReady() {
        return new EngineSignals(recording, relayConfigured, false, true, relayError,
                nativeAvailable, nativeListening);
    }

    public EngineSignals withRelayError() {
        return new EngineSignals(recording, relayConfigured, false, false, true,
                nativeAvailable, nativeListening);
    }

    public EngineSignals withNativeListening(boolean value) {
        return new EngineSignals(recording, relayConfigured, relayConnecting, relayReady, relayError,
                nativeAvailable, value);
    }
}
