package com.phillippitts.scriberelay.testutil;

import com.phillippitts.scriberelay.service.audio.capture.AudioCapture;
import com.phillippitts.scriberelay.service.audio.capture.AudioCaptureFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Hands out {@link FakeAudioCapture}s and remembers them.
 */
public final class FakeAudioCaptureFactory implements AudioCaptureFactory {

    private final List<FakeAudioCapture> created = new CopyOnWriteArrayList<>();

    @Override
    public AudioCapture create(String owner) {
        FakeAudioCapture capture = new FakeAudioCapture(owner);
        created.add(capture);
        return capture;
    }

    public List<FakeAudioCapture> created() {
        return created;
    }

    public FakeAudioCapture last() {
        if (created.isEmpty()) {
            throw new IllegalStateException("No capture created yet");
        }
        return created.get(created.size() - 1);
    }
}
