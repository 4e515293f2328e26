package com.phillippitts.speakstream.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>Sizes the shared synthesis executor and the playback executor. Per-session concurrency is
 * capped separately by {@code speech.pipeline.max-concurrent}; these pools only need enough
 * threads for all sessions that are active at once.
 *
 * <p>Both pools default to a queue capacity of 0 (direct hand-off): a submitted job gets a thread
 * at once or is rejected. A queued playback worker or provider call would otherwise wait behind
 * other sessions' long-running jobs. {@code max-pool-size} should cover
 * sessions &times; {@code max-concurrent} for synthesis and the number of channels for playback.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties synthesis = new PoolProperties(4, 64, 0, "synthesis-pool-");
    private PoolProperties playback = new PoolProperties(2, 64, 0, "playback-pool-");

    public PoolProperties getSynthesis() {
        return synthesis;
    }

    public void setSynthesis(PoolProperties synthesis) {
        this.synthesis = synthesis;
    }

    public PoolProperties getPlayback() {
        return playback;
    }

    public void setPlayback(PoolProperties playback) {
        this.playback = playback;
    }

    /**
     * Sizing of one executor.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(2, 4, 10, "pool-");
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

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
}
