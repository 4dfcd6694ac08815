package com.phillippitts.scriberelay.service.audio.capture;

import com.phillippitts.scriberelay.config.audio.AudioCaptureProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.Objects;

/**
 * Spring entry point for creating Java Sound capture runs that share one {@link MicrophoneManager}.
 */
@Component
public class JavaSoundAudioCaptureFactory implements AudioCaptureFactory {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioCaptureFactory.class);

    private final AudioCaptureProperties props;
    private final MicrophoneManager microphones;
    private final ApplicationEventPublisher publisher;
    private final JavaSoundAudioCapture.DataLineProvider provider;

    @org.springframework.beans.factory.annotation.Autowired
    public JavaSoundAudioCaptureFactory(AudioCaptureProperties props,
                                        MicrophoneManager microphones,
                                        ApplicationEventPublisher publisher) {
        this(props, microphones, publisher, JavaSoundAudioCapture.defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioCaptureFactory(AudioCaptureProperties props,
                                 MicrophoneManager microphones,
                                 ApplicationEventPublisher publisher,
                                 JavaSoundAudioCapture.DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.microphones = Objects.requireNonNull(microphones);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
    }

    @PostConstruct
    void logSystemInfo() {
        LOG.info("Audio capture configured: OS={}, native-rate={}Hz, device='{}', streaming-flush={}ms, "
                        + "chunk-flush={}ms",
                System.getProperty("os.name"), props.getNativeSampleRate(),
                props.getDeviceName() != null ? props.getDeviceName() : "default",
                props.getStreamingFlushMillis(), props.getChunkFlushMillis());
        LOG.info("Echo cancellation, noise suppression and auto gain: unsupported by Java Sound");
    }

    @Override
    public AudioCapture create(String owner) {
        return new JavaSoundAudioCapture(owner, props, microphones, publisher, provider);
    }
}
