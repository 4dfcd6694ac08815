package com.phillippitts.scriberelay.util;

import com.phillippitts.scriberelay.exception.TransientNetworkException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Retries a call on {@link TransientNetworkException} with exponential backoff.
 *
 * <p>Any other exception propagates immediately. When all attempts fail, the last
 * {@link TransientNetworkException} is rethrown.
 */
public final class RetryBackoff {

    private static final Logger LOG = LogManager.getLogger(RetryBackoff.class);

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;
    private final Sleeper sleeper;

    /** Pauses the calling thread; replaced in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration d) throws InterruptedException;
    }

    public RetryBackoff(int maxAttempts, Duration initialDelay, double multiplier) {
        this(maxAttempts, initialDelay, multiplier, d -> Thread.sleep(d.toMillis()));
    }

    public RetryBackoff(int maxAttempts, Duration initialDelay, double multiplier, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        this.multiplier = multiplier;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public <T> T call(String operation, Supplier<T> call) {
        Duration delay = initialDelay;
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (TransientNetworkException e) {
                if (attempt >= maxAttempts) {
                    LOG.warn("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                LOG.debug("{} attempt {} failed, retrying in {}ms: {}",
                        operation, attempt, delay.toMillis(), e.getMessage());
                pause(delay, e);
                delay = delayAfter(delay);
            }
        }
    }

    /** Delay following {@code previous}. */
    Duration delayAfter(Duration previous) {
        return Duration.ofMillis(Math.round(previous.toMillis() * multiplier));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private void pause(Duration delay, TransientNetworkException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }
}
