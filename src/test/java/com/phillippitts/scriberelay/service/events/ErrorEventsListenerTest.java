package com.phillippitts.scriberelay.service.events;

import com.phillippitts.scriberelay.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.scriberelay.service.engine.EngineFallbackEvent;
import com.phillippitts.scriberelay.service.engine.LiveEngine;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    @Test
    void throttlesRepeatLogsPerKey() {
        ErrorEventsListener l = new ErrorEventsListener();

        assertThat(l.shouldLog("capture-MIC_PERMISSION_DENIED")).isTrue();
        assertThat(l.shouldLog("capture-MIC_PERMISSION_DENIED")).isFalse();
        assertThat(l.shouldLog("fallback-relay-native")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ErrorEventsListener l = new ErrorEventsListener();

        assertThatCode(() -> {
            l.onCaptureError(new CaptureErrorEvent("MIC_UNAVAILABLE", "dictation", Instant.now()));
            l.onEngineFallback(new EngineFallbackEvent(LiveEngine.RELAY, LiveEngine.NATIVE,
                    "Relay connection failed", Instant.now()));
            l.onEngineFallback(new EngineFallbackEvent(LiveEngine.RELAY, LiveEngine.NATIVE,
                    "Relay connection failed", Instant.now()));
        }).doesNotThrowAnyException();
    }
}
