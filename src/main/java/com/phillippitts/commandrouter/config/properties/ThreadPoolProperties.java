package com.phillippitts.commandrouter.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Three pools keep the kinds of work apart: command lanes (one task per in-flight command),
 * classifier calls to the fallback model, and action executor calls. A slow model backend
 * therefore cannot starve executors, and vice versa.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties command = new PoolProperties(8, 32, 200, "command-pool-");
    private PoolProperties classifier = new PoolProperties(2, 8, 50, "classifier-pool-");
    private PoolProperties action = new PoolProperties(4, 16, 100, "action-pool-");

    public PoolProperties getCommand() {
        return command;
    }

    public void setCommand(PoolProperties command) {
        this.command = command;
    }

    public PoolProperties getClassifier() {
        return classifier;
    }

    public void setClassifier(PoolProperties classifier) {
        this.classifier = classifier;
    }

    public PoolProperties getAction() {
        return action;
    }

    public void setAction(PoolProperties action) {
        this.action = action;
    }

    /**
     * Sizing for one executor pool.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(4, 8, 50, "pool-");
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
