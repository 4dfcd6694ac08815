package com.phillippitts.scriberelay.client;

import com.phillippitts.scriberelay.client.protocol.ClientTransport;
import com.phillippitts.scriberelay.client.protocol.DictationProtocol;
import com.phillippitts.scriberelay.client.protocol.EventStreamProtocol;
import com.phillippitts.scriberelay.client.protocol.RelayProtocol;
import com.phillippitts.scriberelay.config.client.ClientProperties;
import com.phillippitts.scriberelay.service.audio.capture.AudioCaptureFactory;
import com.phillippitts.scriberelay.service.audio.capture.FrameTicker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Builds {@link DictationSessionClient}s speaking the configured dialect.
 */
@Component
public class DictationClientFactory {

    private final ClientProperties props;
    private final ClientTransport transport;
    private final AudioCaptureFactory captureFactory;
    private final InputTargetProvider targets;
    private final ScheduledExecutorService timers;
    private final ScheduledExecutorService frameTimers;

    public DictationClientFactory(ClientProperties props,
                                  ClientTransport transport,
                                  AudioCaptureFactory captureFactory,
                                  InputTargetProvider targets,
                                  @Qualifier("clientTimers") ScheduledExecutorService timers,
                                  @Qualifier("frameTimers") ScheduledExecutorService frameTimers) {
        this.props = Objects.requireNonNull(props);
        this.transport = Objects.requireNonNull(transport);
        this.captureFactory = Objects.requireNonNull(captureFactory);
        this.targets = Objects.requireNonNull(targets);
        this.timers = Objects.requireNonNull(timers);
        this.frameTimers = Objects.requireNonNull(frameTimers);
    }

    /** True when the configured dialect has an endpoint to talk to. */
    public boolean isConfigured() {
        return switch (props.getDialect()) {
            case RELAY -> hasText(props.getRelayUrl());
            case EVENT_STREAM -> hasText(props.getEventStreamUrl());
        };
    }

    public DictationSessionClient create(DictationListener listener) {
        return new DictationSessionClient(protocol(), transport, captureFactory, targets, listener, props,
                timers, new FrameTicker(frameTimers), Clock.systemUTC());
    }

    DictationProtocol protocol() {
        return switch (props.getDialect()) {
            case RELAY -> new RelayProtocol(URI.create(props.getRelayUrl()), props::getAccessToken);
            case EVENT_STREAM -> new EventStreamProtocol(URI.create(props.getEventStreamUrl()));
        };
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
