package com.phillippitts.scriberelay.service.audio.capture;

import java.time.Instant;

/**
 * Published when the microphone cannot be opened, capture fails mid-session, or the capture
 * buffer starts dropping unsent audio. Carries only a reason code, never audio.
 *
 * @param reason    MIC_UNAVAILABLE, MIC_PERMISSION_DENIED, CAPTURE_ERROR or BUFFER_OVERFLOW
 * @param owner     name of the component that held the microphone
 * @param timestamp when the failure was detected
 */
public record CaptureErrorEvent(String reason, String owner, Instant timestamp) {
}
