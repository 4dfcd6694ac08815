package com.phillippitts.scriberelay.service.audio.capture;

import com.phillippitts.scriberelay.domain.AudioFrame;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * One microphone capture run producing wire-format frames on demand.
 *
 * <p>The capture thread fills an internal buffer; the owner drains it on its own timer.
 */
public interface AudioCapture {

    /**
     * Acquires the microphone and starts capturing.
     *
     * @param onFailure receives a reason code if the device fails; called at most once
     * @throws IllegalStateException if this capture is already running
     */
    void start(Consumer<String> onFailure);

    /** Removes everything captured since the last drain; empty when nothing was captured. */
    Optional<AudioFrame> drain();

    /** Drops buffered audio without returning it. */
    void discard();

    /**
     * Stops capture and releases the microphone before returning. Buffered audio stays
     * available to {@link #drain()}. Idempotent.
     */
    void stop();

    boolean isActive();
}
