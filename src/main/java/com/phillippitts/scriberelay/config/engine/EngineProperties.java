package com.phillippitts.scriberelay.config.engine;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Live transcript engine selection and the two non-relay strategies.
 *
 * <p>Example application.properties:
 * <pre>
 * engine.force=auto
 * engine.native.model-path=models/vosk-model-small-en-us-0.15
 * engine.chunk.endpoint=http://localhost:54321/functions/v1/deepgram-transcribe
 * engine.chunk.max-attempts=3
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    /** relay, native, chunk or auto. Anything else reads as auto. */
    private String force = "auto";

    private final Native nativeRecognition = new Native();
    private final Chunk chunk = new Chunk();

    public String getForce() {
        return force;
    }

    public void setForce(String force) {
        this.force = force;
    }

    public Native getNative() {
        return nativeRecognition;
    }

    public Chunk getChunk() {
        return chunk;
    }

    /**
     * On-device recognition with a Vosk model.
     */
    public static class Native {
        private boolean enabled = true;
        private String modelPath = "models/vosk-model-small-en-us-0.15";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getModelPath() {
            return modelPath;
        }

        public void setModelPath(String modelPath) {
            this.modelPath = modelPath;
        }
    }

    /**
     * Periodic WAV chunk upload.
     */
    public static class Chunk {
        private String endpoint;
        private String bearerToken;

        @Min(1)
        @Max(10)
        private int maxAttempts = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(500);

        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;

        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(15);

        public boolean isConfigured() {
            return endpoint != null && !endpoint.isBlank();
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getBearerToken() {
            return bearerToken;
        }

        public void setBearerToken(String bearerToken) {
            this.bearerToken = bearerToken;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }
}
