package com.phillippitts.scriberelay.config.summary;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Running summary throttling and the summarization endpoint.
 *
 * <p>Example application.properties:
 * <pre>
 * summary.endpoint=http://localhost:54321/functions/v1/live-summary
 * summary.min-delta-chars=100
 * summary.debounce=45s
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "summary")
public class SummaryProperties {

    /** Summarization endpoint; blank disables running summaries. */
    private final String endpoint;

    private final String bearerToken;

    /** Free-form note style preferences forwarded with every request. */
    private final String preferences;

    /** Transcript growth, in characters, needed before a summary is scheduled. */
    @Min(1)
    private final int minDeltaChars;

    /** Minimum spacing between summary requests. */
    @NotNull
    private final Duration debounce;

    /** Non-blank characters the delta must still carry when the timer fires. */
    @Min(1)
    private final int minTrimmedDeltaChars;

    @Min(100)
    @Max(20_000)
    private final int maxLength;

    @NotNull
    private final Duration requestTimeout;

    @ConstructorBinding
    public SummaryProperties(String endpoint,
                             String bearerToken,
                             String preferences,
                             @DefaultValue("100") int minDeltaChars,
                             @DefaultValue("45s") Duration debounce,
                             @DefaultValue("50") int minTrimmedDeltaChars,
                             @DefaultValue("1200") int maxLength,
                             @DefaultValue("20s") Duration requestTimeout) {
        this.endpoint = endpoint;
        this.bearerToken = bearerToken;
        this.preferences = preferences;
        this.minDeltaChars = minDeltaChars;
        this.debounce = debounce;
        this.minTrimmedDeltaChars = minTrimmedDeltaChars;
        this.maxLength = maxLength;
        this.requestTimeout = requestTimeout;
    }

    /** Defaults used outside of Spring binding. */
    public static SummaryProperties defaults(String endpoint) {
        return new SummaryProperties(endpoint, null, null, 100, Duration.ofSeconds(45), 50, 1200,
                Duration.ofSeconds(20));
    }

    public boolean isConfigured() {
        return endpoint != null && !endpoint.isBlank();
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getBearerToken() {
        return bearerToken;
    }

    public String getPreferences() {
        return preferences;
    }

    public int getMinDeltaChars() {
        return minDeltaChars;
    }

    public Duration getDebounce() {
        return debounce;
    }

    public int getMinTrimmedDeltaChars() {
        return minTrimmedDeltaChars;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }
}
