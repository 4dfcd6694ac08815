package com.phillippitts.scriberelay.config.client;

import com.phillippitts.scriberelay.util.RelayTimeouts;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.hibernate.validator.constraints.time.DurationMax;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the streaming dictation client.
 *
 * <p>{@code dialect} selects the wire protocol: {@code relay} talks to the relay endpoint with a
 * bearer token, {@code event-stream} talks directly to a pre-signed event-stream URL.
 */
@Validated
@ConfigurationProperties(prefix = "client")
public class ClientProperties {

    public enum Dialect { RELAY, EVENT_STREAM }

    @NotNull
    private final Dialect dialect;

    private final String relayUrl;

    /** Bearer token presented in the relay {@code auth} message. */
    private final String accessToken;

    /** Pre-signed URL of the event-stream endpoint. */
    private final String eventStreamUrl;

    @NotNull
    @DurationMin(seconds = 5)
    @DurationMax(seconds = 8)
    private final Duration connectTimeout;

    @NotNull
    private final Duration stopTimeout;

    @NotNull
    @DurationMin(millis = 20)
    @DurationMax(seconds = 5)
    private final Duration sendInterval;

    /** Characters of committed text kept for overlap detection. */
    @Min(10)
    @Max(1_000)
    private final int tailWindow;

    @ConstructorBinding
    public ClientProperties(@DefaultValue("RELAY") Dialect dialect,
                            @DefaultValue("ws://localhost:8080/dictate") String relayUrl,
                            String accessToken,
                            String eventStreamUrl,
                            @DefaultValue("8s") Duration connectTimeout,
                            @DefaultValue("3s") Duration stopTimeout,
                            @DefaultValue("100ms") Duration sendInterval,
                            @DefaultValue("80") int tailWindow) {
        this.dialect = dialect;
        this.relayUrl = relayUrl;
        this.accessToken = accessToken;
        this.eventStreamUrl = eventStreamUrl;
        this.connectTimeout = connectTimeout;
        this.stopTimeout = stopTimeout;
        this.sendInterval = sendInterval;
        this.tailWindow = tailWindow;
    }

    /** Defaults used outside of Spring binding. */
    public static ClientProperties defaults(String relayUrl) {
        return new ClientProperties(Dialect.RELAY, relayUrl, null, null,
                RelayTimeouts.CLIENT_CONNECT_TIMEOUT, RelayTimeouts.CLIENT_STOP_TIMEOUT,
                Duration.ofMillis(100), 80);
    }

    public Dialect getDialect() { return dialect; }
    public String getRelayUrl() { return relayUrl; }
    public String getAccessToken() { return accessToken; }
    public String getEventStreamUrl() { return eventStreamUrl; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public Duration getStopTimeout() { return stopTimeout; }
    public Duration getSendInterval() { return sendInterval; }
    public int getTailWindow() { return tailWindow; }
}
