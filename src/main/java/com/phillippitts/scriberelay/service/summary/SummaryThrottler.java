package com.phillippitts.scriberelay.service.summary;

import com.phillippitts.scriberelay.config.summary.SummaryProperties;
import com.phillippitts.scriberelay.service.metrics.RelayMetrics;
import com.phillippitts.scriberelay.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps a running summary of the live transcript while bounding summarization traffic.
 *
 * <p>Rules:
 * <ul>
 *   <li>a call is scheduled only when the transcript grew by at least {@code minDeltaChars}
 *       since the last successful summary and no call is in flight</li>
 *   <li>calls are spaced by {@code debounce}; growth during the wait moves the single pending
 *       timer instead of adding another</li>
 *   <li>at fire time the delta must still hold {@code minTrimmedDeltaChars} non-blank characters</li>
 *   <li>at most one call is in flight; failures are recorded, never thrown</li>
 * </ul>
 *
 * <p>Calls run on the {@code summaryScheduler} pool, never on audio threads.
 */
@Component
public class SummaryThrottler {

    private static final Logger LOG = LogManager.getLogger(SummaryThrottler.class);

    static final String ELLIPSIS = "...";

    private final SummarizationClient client;
    private final SummaryProperties props;
    private final RelayMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final Object lock = new Object();
    private ScheduledFuture<?> pending;
    private String latestTranscript = "";
    private String runningSummary = "";
    private int lastSummaryLength;
    private boolean inFlight;
    private boolean flushRequested;
    private int callCount;
    private Instant lastCallAt;
    private String lastError;
    private long generation;

    @org.springframework.beans.factory.annotation.Autowired
    public SummaryThrottler(SummarizationClient client, SummaryProperties props, RelayMetrics metrics,
                            @Qualifier("summaryScheduler") ScheduledExecutorService scheduler) {
        this(client, props, metrics, scheduler, Clock.systemUTC());
    }

    // Package-private for tests
    SummaryThrottler(SummarizationClient client, SummaryProperties props, RelayMetrics metrics,
                     ScheduledExecutorService scheduler, Clock clock) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Reports the full transcript so far; schedules a summary when enough text accumulated.
     */
    public void onTranscriptDelta(String fullTranscript) {
        if (fullTranscript == null || !client.isConfigured()) {
            return;
        }
        synchronized (lock) {
            latestTranscript = fullTranscript;
            if (inFlight || fullTranscript.length() - lastSummaryLength < props.getMinDeltaChars()) {
                return;
            }
            long delayMillis = delayMillis();
            if (pending != null) {
                pending.cancel(false);
            }
            long gen = generation;
            pending = scheduler.schedule(() -> fire(gen, false), delayMillis, TimeUnit.MILLISECONDS);
            LOG.debug("Summary scheduled in {}ms: transcriptLength={}", delayMillis, fullTranscript.length());
        }
    }

    /**
     * Requests a last summary of {@code finalTranscript} without waiting for the debounce.
     * Returns immediately; when a call is in flight the flush runs after it.
     */
    public void flush(String finalTranscript) {
        if (finalTranscript == null || !client.isConfigured()) {
            return;
        }
        synchronized (lock) {
            latestTranscript = finalTranscript;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
            if (inFlight) {
                flushRequested = true;
                return;
            }
            long gen = generation;
            scheduler.execute(() -> fire(gen, true));
        }
    }

    /** Forgets the session: pending work is cancelled and a call in flight is ignored on return. */
    public void reset() {
        synchronized (lock) {
            generation++;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
            latestTranscript = "";
            runningSummary = "";
            lastSummaryLength = 0;
            flushRequested = false;
            callCount = 0;
            lastCallAt = null;
            lastError = null;
        }
    }

    public String runningSummary() {
        synchronized (lock) {
            return runningSummary;
        }
    }

    public SummaryDiagnostics diagnostics() {
        synchronized (lock) {
            return new SummaryDiagnostics(callCount, lastCallAt, lastError, inFlight, pending != null,
                    lastSummaryLength, runningSummary.length());
        }
    }

    private long delayMillis() {
        if (lastCallAt == null) {
            return 0;
        }
        long sinceLast = Duration.between(lastCallAt, clock.instant()).toMillis();
        return Math.max(0, props.getDebounce().toMillis() - sinceLast);
    }

    // Runs on the scheduler thread.
    void fire(long gen, boolean flushing) {
        String transcript;
        SummaryRequest request;
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            pending = null;
            if (inFlight) {
                return;
            }
            transcript = latestTranscript;
            String delta = transcript.substring(Math.min(lastSummaryLength, transcript.length()));
            int required = flushing ? 1 : props.getMinTrimmedDeltaChars();
            if (delta.strip().length() < required) {
                LOG.debug("Summary skipped: delta too small ({} chars)", delta.strip().length());
                return;
            }
            inFlight = true;
            callCount++;
            lastCallAt = clock.instant();
            request = new SummaryRequest(delta, runningSummary, props.getPreferences());
        }

        long startNanos = System.nanoTime();
        String summary = null;
        String error = null;
        try {
            summary = client.summarize(request);
            metrics.summaryCall("success", System.nanoTime() - startNanos);
        } catch (RuntimeException e) {
            error = e.getClass().getSimpleName() + ": " + LogSanitizer.maskSecrets(e.getMessage());
            metrics.summaryCall("failure", System.nanoTime() - startNanos);
            LOG.warn("Summary call failed: {}", error);
        } finally {
            boolean flushAgain;
            synchronized (lock) {
                inFlight = false;
                if (gen == generation) {
                    if (summary != null) {
                        runningSummary = truncate(summary, props.getMaxLength());
                        lastSummaryLength = transcript.length();
                        lastError = null;
                        LOG.info("Running summary updated: summaryLength={} coveredChars={}",
                                runningSummary.length(), lastSummaryLength);
                    } else {
                        lastError = error;
                    }
                }
                flushAgain = flushRequested && gen == generation;
                flushRequested = false;
            }
            if (flushAgain) {
                scheduler.execute(() -> fire(gen, true));
            }
        }
    }

    static String truncate(String summary, int maxLength) {
        if (summary.length() <= maxLength) {
            return summary;
        }
        return summary.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }
}
