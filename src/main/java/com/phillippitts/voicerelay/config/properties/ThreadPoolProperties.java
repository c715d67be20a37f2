package com.phillippitts.voicerelay.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the turn, stream, synthesis and telemetry executors.
 * Defaults are conservative but can be adjusted based on call volume.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties turn = new PoolProperties(8, 32, 100, "turn-pool-");
    /** Stream consumers run beside their turn and must never queue behind it. */
    private PoolProperties stream = new PoolProperties(8, 64, 0, "stream-pool-");
    private PoolProperties synthesis = new PoolProperties(8, 32, 200, "synthesis-pool-");
    private PoolProperties telemetry = new PoolProperties(1, 2, 500, "telemetry-pool-");

    public PoolProperties getTurn() {
        return turn;
    }

    public void setTurn(PoolProperties turn) {
        this.turn = turn;
    }

    public PoolProperties getStream() {
        return stream;
    }

    public void setStream(PoolProperties stream) {
        this.stream = stream;
    }

    public PoolProperties getSynthesis() {
        return synthesis;
    }

    public void setSynthesis(PoolProperties synthesis) {
        this.synthesis = synthesis;
    }

    public PoolProperties getTelemetry() {
        return telemetry;
    }

    public void setTelemetry(PoolProperties telemetry) {
        this.telemetry = telemetry;
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

        public PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
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
