package com.phillippitts.scriberelay.config.relay;

import com.phillippitts.scriberelay.util.RelayTimeouts;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Properties of the dictation relay WebSocket endpoint.
 *
 * <p>An empty {@code allowedOrigins} list accepts every origin.
 */
@Validated
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    @NotBlank
    private String path = "/dictate";

    private List<String> allowedOrigins = new ArrayList<>();

    @NotNull
    private Duration authTimeout = RelayTimeouts.AUTH_TIMEOUT;

    @NotNull
    private Duration flushGrace = RelayTimeouts.FLUSH_GRACE;

    @NotNull
    private Duration keepAliveInterval = RelayTimeouts.UPSTREAM_KEEP_ALIVE;

    /** HS256 secret used to verify client access tokens (at least 32 bytes). */
    private String jwtSecret;

    /** Largest binary frame accepted from a client. */
    private int maxBinaryMessageBytes = 1024 * 1024;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins == null ? new ArrayList<>() : allowedOrigins;
    }

    public Duration getAuthTimeout() {
        return authTimeout;
    }

    public void setAuthTimeout(Duration authTimeout) {
        this.authTimeout = authTimeout;
    }

    public Duration getFlushGrace() {
        return flushGrace;
    }

    public void setFlushGrace(Duration flushGrace) {
        this.flushGrace = flushGrace;
    }

    public Duration getKeepAliveInterval() {
        return keepAliveInterval;
    }

    public void setKeepAliveInterval(Duration keepAliveInterval) {
        this.keepAliveInterval = keepAliveInterval;
    }

    public String getJwtSecret() {
        return jwtSecret;
    }

    public void setJwtSecret(String jwtSecret) {
        this.jwtSecret = jwtSecret;
    }

    public int getMaxBinaryMessageBytes() {
        return maxBinaryMessageBytes;
    }

    public void setMaxBinaryMessageBytes(int maxBinaryMessageBytes) {
        this.maxBinaryMessageBytes = maxBinaryMessageBytes;
    }
}
