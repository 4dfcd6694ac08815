package com.phillippitts.scriberelay.service.engine;

import com.phillippitts.scriberelay.config.engine.EngineProperties;
import com.phillippitts.scriberelay.exception.TransientNetworkException;
import com.phillippitts.scriberelay.exception.UpstreamFatalException;
import com.phillippitts.scriberelay.util.RetryBackoff;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Base64;
import java.util.Objects;

/**
 * Posts base64 WAV chunks as {@code {"audioBase64":..., "mimeType":"audio/wav"}} and reads
 * {@code transcript} from the response. Connection failures and 5xx responses are retried with
 * exponential backoff; 4xx responses and any other client failure are not.
 */
@Component
public class HttpChunkTranscriptionClient implements ChunkTranscriptionClient {

    private static final Logger LOG = LogManager.getLogger(HttpChunkTranscriptionClient.class);

    static final String MIME_TYPE = "audio/wav";

    private final EngineProperties.Chunk props;
    private final RestTemplate rest;
    private final RetryBackoff retry;

    @org.springframework.beans.factory.annotation.Autowired
    public HttpChunkTranscriptionClient(EngineProperties props, RestTemplateBuilder builder) {
        this(props.getChunk(), builder
                .setConnectTimeout(props.getChunk().getRequestTimeout())
                .setReadTimeout(props.getChunk().getRequestTimeout())
                .build(),
                new RetryBackoff(props.getChunk().getMaxAttempts(),
                        props.getChunk().getInitialBackoff(),
                        props.getChunk().getBackoffMultiplier()));
    }

    // Package-private for tests
    HttpChunkTranscriptionClient(EngineProperties.Chunk props, RestTemplate rest, RetryBackoff retry) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.rest = Objects.requireNonNull(rest, "rest must not be null");
        this.retry = Objects.requireNonNull(retry, "retry must not be null");
    }

    @Override
    public boolean isConfigured() {
        return props.isConfigured();
    }

    @Override
    public String transcribe(byte[] wav) {
        Objects.requireNonNull(wav, "wav must not be null");
        if (!isConfigured()) {
            throw new IllegalStateException("Chunk transcription endpoint not configured");
        }
        HttpEntity<String> request = new HttpEntity<>(body(wav), headers());
        return retry.call("chunk transcription", () -> post(request));
    }

    private String post(HttpEntity<String> request) {
        String endpoint = props.getEndpoint();
        try {
            ResponseEntity<String> response = rest.postForEntity(endpoint, request, String.class);
            return parseTranscript(response.getBody());
        } catch (HttpServerErrorException e) {
            throw new TransientNetworkException(endpoint, "HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new TransientNetworkException(endpoint, "Connection failed", e);
        } catch (HttpClientErrorException e) {
            LOG.warn("Chunk transcription rejected: status={}", e.getStatusCode().value());
            throw new UpstreamFatalException("Chunk transcription rejected with HTTP "
                    + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            LOG.warn("Chunk transcription failed: {}", e.getClass().getSimpleName());
            throw new UpstreamFatalException("Chunk transcription failed", e);
        }
    }

    static String body(byte[] wav) {
        return new JSONObject()
                .put("audioBase64", Base64.getEncoder().encodeToString(wav))
                .put("mimeType", MIME_TYPE)
                .toString();
    }

    /** Reads {@code transcript}; a missing field means silence. */
    static String parseTranscript(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return "";
        }
        try {
            JSONObject json = new JSONObject(responseBody);
            if (json.has("ok") && !json.optBoolean("ok")) {
                throw new UpstreamFatalException("Chunk transcription failed: "
                        + json.optString("error", "unknown error"), (Throwable) null);
            }
            return json.optString("transcript", "").trim();
        } catch (JSONException e) {
            throw new UpstreamFatalException("Chunk transcription returned malformed JSON", e);
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String token = props.getBearerToken();
        if (token != null && !token.isBlank()) {
            headers.setBearerAuth(token);
        }
        return headers;
    }
}
