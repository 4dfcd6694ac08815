package com.phillippitts.scriberelay.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Sizing of the shared relay event-loop pool and of the schedulers: relay timers, dictation
 * client timeouts, frame flush ticks and summary calls.
 *
 * <p>Each session runs its handlers serially on the event-loop pool, so the pool bounds
 * concurrency across sessions, not within one.
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private RelayPoolProperties relay = new RelayPoolProperties();
    private TimerPoolProperties timers = new TimerPoolProperties();
    private TimerPoolProperties clientTimers = timerDefaults(1, "client-timer-");
    private TimerPoolProperties frameTimers = timerDefaults(2, "frame-timer-");
    private TimerPoolProperties summary = timerDefaults(1, "summary-scheduler-");

    private static TimerPoolProperties timerDefaults(int poolSize, String threadNamePrefix) {
        TimerPoolProperties p = new TimerPoolProperties();
        p.setPoolSize(poolSize);
        p.setThreadNamePrefix(threadNamePrefix);
        return p;
    }

    public RelayPoolProperties getRelay() {
        return relay;
    }

    public void setRelay(RelayPoolProperties relay) {
        this.relay = relay;
    }

    public TimerPoolProperties getTimers() {
        return timers;
    }

    public void setTimers(TimerPoolProperties timers) {
        this.timers = timers;
    }

    public TimerPoolProperties getClientTimers() {
        return clientTimers;
    }

    public void setClientTimers(TimerPoolProperties clientTimers) {
        this.clientTimers = clientTimers;
    }

    public TimerPoolProperties getFrameTimers() {
        return frameTimers;
    }

    public void setFrameTimers(TimerPoolProperties frameTimers) {
        this.frameTimers = frameTimers;
    }

    public TimerPoolProperties getSummary() {
        return summary;
    }

    public void setSummary(TimerPoolProperties summary) {
        this.summary = summary;
    }

    /**
     * Relay event-loop pool configuration.
     */
    public static class RelayPoolProperties {
        @Min(1)
        private int corePoolSize = 8;
        @Min(1)
        private int maxPoolSize = 32;
        @Min(0)
        private int queueCapacity = 1000;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "relay-loop-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Timer scheduler sizing.
     */
    public static class TimerPoolProperties {
        @Min(1)
        private int poolSize = 2;
        private String threadNamePrefix = "relay-timer-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
