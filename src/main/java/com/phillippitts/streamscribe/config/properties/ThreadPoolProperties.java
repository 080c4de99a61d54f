package com.phillippitts.streamscribe.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The streaming pool hosts the capture, pump and receiver loops of one run. Each loop
 * occupies a thread for the whole run, so the core size must be at least three.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private StreamPoolProperties stream = new StreamPoolProperties();

    public StreamPoolProperties getStream() {
        return stream;
    }

    public void setStream(StreamPoolProperties stream) {
        this.stream = stream;
    }

    /**
     * Streaming executor pool configuration.
     */
    public static class StreamPoolProperties {
        private int corePoolSize = 3;
        private int maxPoolSize = 4;
        private int queueCapacity = 4;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "stream-pool-";

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
