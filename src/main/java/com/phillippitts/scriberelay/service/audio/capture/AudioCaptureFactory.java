package com.phillippitts.scriberelay.service.audio.capture;

/** Creates capture runs; each engine or client session asks for its own. */
@FunctionalInterface
public interface AudioCaptureFactory {

    AudioCapture create(String owner);
}
