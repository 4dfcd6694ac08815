package com.phillippitts.scriberelay.service.audio.capture;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class FrameTickerTest {

    private final ScheduledExecutorService frameTimers = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        frameTimers.shutdownNow();
    }

    @Test
    void failingTickKeepsTheSchedule() {
        FrameTicker ticker = new FrameTicker(frameTimers);
        AtomicInteger ticks = new AtomicInteger();

        ticker.start(Duration.ofMillis(5), () -> {
            if (ticks.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
        });

        await().atMost(2, SECONDS).until(() -> ticks.get() >= 3);
        ticker.close();
    }

    @Test
    void closingOneTickerLeavesSharedSchedulerRunning() {
        FrameTicker first = new FrameTicker(frameTimers);
        FrameTicker second = new FrameTicker(frameTimers);
        AtomicInteger secondTicks = new AtomicInteger();
        first.start(Duration.ofMillis(5), () -> { });
        second.start(Duration.ofMillis(5), secondTicks::incrementAndGet);

        first.close();

        assertThat(first.isRunning()).isFalse();
        assertThat(frameTimers.isShutdown()).isFalse();
        int seen = secondTicks.get();
        await().atMost(2, SECONDS).until(() -> secondTicks.get() > seen);
        second.close();
    }
}
