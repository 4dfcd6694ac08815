package com.phillippitts.scriberelay.relay.upstream;

import com.phillippitts.scriberelay.config.relay.UpstreamProperties;
import org.junit.jupiter.api.Test;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeepgramUpstreamConnectorTest {

    @Test
    void listenUriCarriesStreamingParameters() {
        UpstreamProperties props = new UpstreamProperties();
        props.setApiKey("key");

        URI uri = DeepgramUpstreamConnector.listenUri(props);
        Map<String, String> query = UriComponentsBuilder.fromUri(uri).build().getQueryParams().toSingleValueMap();

        assertThat(uri.getScheme()).isEqualTo("wss");
        assertThat(uri.getHost()).isEqualTo("api.deepgram.com");
        assertThat(uri.getPath()).isEqualTo("/v1/listen");
        assertThat(query)
                .containsEntry("model", "nova-2-medical")
                .containsEntry("language", "en-US")
                .containsEntry("encoding", "linear16")
                .containsEntry("sample_rate", "16000")
                .containsEntry("channels", "1")
                .containsEntry("interim_results", "true")
                .containsEntry("endpointing", "300")
                .containsEntry("punctuate", "true")
                .containsEntry("smart_format", "true");
    }

    @Test
    void listenUriReflectsOverrides() {
        UpstreamProperties props = new UpstreamProperties();
        props.setUrl("ws://localhost:9999/listen");
        props.setModel("nova-2");
        props.setEndpointingMs(500);

        URI uri = DeepgramUpstreamConnector.listenUri(props);

        assertThat(uri.getHost()).isEqualTo("localhost");
        assertThat(uri.getPort()).isEqualTo(9999);
        assertThat(uri.getQuery()).contains("model=nova-2&").contains("endpointing=500");
    }

    @Test
    void reportsConfiguredOnlyWithApiKey() {
        UpstreamProperties props = new UpstreamProperties();

        assertThat(new DeepgramUpstreamConnector(props).isConfigured()).isFalse();

        props.setApiKey("key");

        assertThat(new DeepgramUpstreamConnector(props).isConfigured()).isTrue();
    }
}
