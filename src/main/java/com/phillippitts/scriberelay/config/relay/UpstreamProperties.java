package com.phillippitts.scriberelay.config.relay;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings for the upstream streaming recognition engine.
 *
 * <p>The API key stays on the server; clients never see it.
 */
@Validated
@ConfigurationProperties(prefix = "relay.upstream")
public class UpstreamProperties {

    @NotBlank
    private String url = "wss://api.deepgram.com/v1/listen";

    private String apiKey;

    @NotBlank
    private String model = "nova-2-medical";

    @NotBlank
    private String language = "en-US";

    @NotBlank
    private String encoding = "linear16";

    @Min(8_000)
    @Max(48_000)
    private int sampleRate = 16_000;

    @Min(1)
    @Max(2)
    private int channels = 1;

    private boolean interimResults = true;

    /** Silence, in milliseconds, after which the engine finalizes an utterance. */
    @Min(10)
    private int endpointingMs = 300;

    private boolean punctuate = true;

    private boolean smartFormat = true;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public String getEncoding() {
        return encoding;
    }

    public void setEncoding(String encoding) {
        this.encoding = encoding;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(int sampleRate) {
        this.sampleRate = sampleRate;
    }

    public int getChannels() {
        return channels;
    }

    public void setChannels(int channels) {
        this.channels = channels;
    }

    public boolean isInterimResults() {
        return interimResults;
    }

    public void setInterimResults(boolean interimResults) {
        this.interimResults = interimResults;
    }

    public int getEndpointingMs() {
        return endpointingMs;
    }

    public void setEndpointingMs(int endpointingMs) {
        this.endpointingMs = endpointingMs;
    }

    public boolean isPunctuate() {
        return punctuate;
    }

    public void setPunctuate(boolean punctuate) {
        this.punctuate = punctuate;
    }

    public boolean isSmartFormat() {
        return smartFormat;
    }

    public void setSmartFormat(boolean smartFormat) {
        this.smartFormat = smartFormat;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }
}
