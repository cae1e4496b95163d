package com.phillippitts.huevoice.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The recognition pool runs remote speech calls off the recognizer stage thread so the next
 * utterance can be captured while the previous one is still in flight. The feedback pool plays
 * sounds and speech one at a time.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties recognition = new PoolProperties(2, 4, 10, "recognition-pool-");
    private PoolProperties feedback = new PoolProperties(1, 1, 20, "feedback-");

    public PoolProperties getRecognition() {
        return recognition;
    }

    public void setRecognition(PoolProperties recognition) {
        this.recognition = recognition;
    }

    public PoolProperties getFeedback() {
        return feedback;
    }

    public void setFeedback(PoolProperties feedback) {
        this.feedback = feedback;
    }

    /**
     * Single executor pool configuration.
     */
    public static class PoolProperties {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 10;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "pool-";

        public PoolProperties() {
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
