package com.phillippitts.scriberelay.config;

import com.phillippitts.scriberelay.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools of the relay.
 *
 * <p>{@code relayExecutor} runs the per-session serial event loops; {@code relayTimers} fires
 * auth deadlines, flush grace and keep-alive ticks, which post back into those loops.
 * {@code clientTimers} fires dictation client connect and stop deadlines.
 * {@code frameTimers} drives audio frame flushing and {@code summaryScheduler} runs summary
 * calls; the two never share a thread, so a slow summary cannot delay audio.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Bounded pool shared by all session event loops.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
     * are full the WebSocket container thread runs the task, which pushes back on that client.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext of the submitting thread.
     */
    @Bean(name = "relayExecutor")
    public ThreadPoolTaskExecutor relayExecutor() {
        ThreadPoolProperties.RelayPoolProperties relayProps = threadPoolProperties.getRelay();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(relayProps.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(relayProps.getCorePoolSize(), relayProps.getMaxPoolSize()));
        executor.setQueueCapacity(relayProps.getQueueCapacity());
        executor.setThreadNamePrefix(relayProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(relayProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    @Bean(name = "relayTimers", destroyMethod = "shutdownNow")
    public ScheduledExecutorService relayTimers() {
        return newScheduler(threadPoolProperties.getTimers());
    }

    @Bean(name = "clientTimers", destroyMethod = "shutdownNow")
    public ScheduledExecutorService clientTimers() {
        return newScheduler(threadPoolProperties.getClientTimers());
    }

    @Bean(name = "frameTimers", destroyMethod = "shutdownNow")
    public ScheduledExecutorService frameTimers() {
        return newScheduler(threadPoolProperties.getFrameTimers());
    }

    @Bean(name = "summaryScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService summaryScheduler() {
        return newScheduler(threadPoolProperties.getSummary());
    }

    static ScheduledExecutorService newScheduler(ThreadPoolProperties.TimerPoolProperties timerProps) {
        AtomicInteger counter = new AtomicInteger();
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(timerProps.getPoolSize(), r -> {
            Thread t = new Thread(r, timerProps.getThreadNamePrefix() + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
