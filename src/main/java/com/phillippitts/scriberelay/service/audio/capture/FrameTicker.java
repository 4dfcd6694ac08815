package com.phillippitts.scriberelay.service.audio.capture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Wall-clock timer that drives frame flushing on the shared {@code frameTimers} scheduler,
 * independent of network and summarization work. Closing a ticker cancels its schedule and
 * leaves the shared scheduler running.
 */
public final class FrameTicker implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(FrameTicker.class);

    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public FrameTicker(ScheduledExecutorService scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    /** Runs {@code tick} every {@code interval}, replacing any previous schedule. */
    public synchronized void start(Duration interval, Runnable tick) {
        Objects.requireNonNull(tick, "tick must not be null");
        stop();
        long millis = interval.toMillis();
        task = scheduler.scheduleAtFixedRate(() -> {
            try {
                tick.run();
            } catch (RuntimeException e) {
                // A failing tick must not cancel the schedule.
                LOG.warn("Frame tick failed: {}", e.toString());
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    @Override
    public void close() {
        stop();
    }
}
