package com.phillippitts.scriberelay.relay.upstream;

import com.phillippitts.scriberelay.config.relay.UpstreamProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * Connects to a Deepgram-compatible listen endpoint with the server-held API key and a fixed
 * linear16 / 16 kHz / mono configuration.
 */
@Component
public class DeepgramUpstreamConnector implements UpstreamConnector {

    private static final Logger LOG = LogManager.getLogger(DeepgramUpstreamConnector.class);

    private final UpstreamProperties props;

    public DeepgramUpstreamConnector(UpstreamProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        if (!props.isConfigured()) {
            LOG.warn("No upstream API key configured (relay.upstream.api-key); sessions will fail after auth");
        }
    }

    @Override
    public boolean isConfigured() {
        return props.isConfigured();
    }

    @Override
    public UpstreamConnection connect(UpstreamListener listener) {
        URI uri = listenUri(props);
        JavaWebSocketUpstreamConnection connection = new JavaWebSocketUpstreamConnection(
                uri,
                Map.of("Authorization", "Token " + (props.getApiKey() == null ? "" : props.getApiKey())),
                (int) props.getConnectTimeout().toMillis(),
                listener);
        LOG.debug("Connecting upstream: host={}, model={}", uri.getHost(), props.getModel());
        connection.connect();
        return connection;
    }

    static URI listenUri(UpstreamProperties props) {
        return UriComponentsBuilder.fromUriString(props.getUrl())
                .queryParam("model", props.getModel())
                .queryParam("language", props.getLanguage())
                .queryParam("encoding", props.getEncoding())
                .queryParam("sample_rate", props.getSampleRate())
                .queryParam("channels", props.getChannels())
                .queryParam("interim_results", props.isInterimResults())
                .queryParam("endpointing", props.getEndpointingMs())
                .queryParam("punctuate", props.isPunctuate())
                .queryParam("smart_format", props.isSmartFormat())
                .build()
                .toUri();
    }
}
