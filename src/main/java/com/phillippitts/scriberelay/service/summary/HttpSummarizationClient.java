package com.phillippitts.scriberelay.service.summary;

import com.phillippitts.scriberelay.config.summary.SummaryProperties;
import com.phillippitts.scriberelay.exception.ScribeRelayException;
import com.phillippitts.scriberelay.exception.TransientNetworkException;
import com.phillippitts.scriberelay.exception.UpstreamFatalException;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Objects;

/**
 * POSTs {@code {transcriptDelta, runningSummary, preferences}} and reads {@code runningSummary}
 * (or {@code summary}) from the response. Not retried: the throttler tries again on the next delta.
 */
@Component
public class HttpSummarizationClient implements SummarizationClient {

    private final SummaryProperties props;
    private final RestTemplate rest;

    @org.springframework.beans.factory.annotation.Autowired
    public HttpSummarizationClient(SummaryProperties props, RestTemplateBuilder builder) {
        this(props, builder
                .setConnectTimeout(props.getRequestTimeout())
                .setReadTimeout(props.getRequestTimeout())
                .build());
    }

    // Package-private for tests
    HttpSummarizationClient(SummaryProperties props, RestTemplate rest) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.rest = Objects.requireNonNull(rest, "rest must not be null");
    }

    @Override
    public boolean isConfigured() {
        return props.isConfigured();
    }

    @Override
    public String summarize(SummaryRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String endpoint = props.getEndpoint();
        if (!isConfigured()) {
            throw new ScribeRelayException("Summarization endpoint not configured");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (props.getBearerToken() != null && !props.getBearerToken().isBlank()) {
            headers.setBearerAuth(props.getBearerToken());
        }
        try {
            String body = rest.postForObject(endpoint,
                    new HttpEntity<>(request.toJson().toString(), headers), String.class);
            return parseSummary(body);
        } catch (HttpStatusCodeException e) {
            throw new UpstreamFatalException("Summarization failed with HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new TransientNetworkException(endpoint, "Summarization unreachable", e);
        }
    }

    static String parseSummary(String body) {
        if (body == null || body.isBlank()) {
            throw new ScribeRelayException("Summarization returned an empty body");
        }
        try {
            JSONObject json = new JSONObject(body);
            String summary = json.optString("runningSummary", json.optString("summary", ""));
            if (summary.isBlank()) {
                throw new ScribeRelayException("Summarization response has no summary");
            }
            return summary.trim();
        } catch (JSONException e) {
            throw new ScribeRelayException("Summarization returned malformed JSON", e);
        }
    }
}
