package com.phillippitts.genesis.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>Three executors keep blocking work apart: hardware I/O, dialogue orchestration and
 * calls to the reasoning backend. A small scheduler pool drives the connection heartbeat
 * and daily reminders.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties hardware = new PoolProperties(2, 4, 50, "hardware-pool-");
    private PoolProperties dialogue = new PoolProperties(2, 4, 200, "dialogue-pool-");
    private PoolProperties reasoning = new PoolProperties(2, 4, 20, "reasoning-pool-");
    private SchedulerProperties scheduler = new SchedulerProperties();

    public PoolProperties getHardware() {
        return hardware;
    }

    public void setHardware(PoolProperties hardware) {
        this.hardware = hardware;
    }

    public PoolProperties getDialogue() {
        return dialogue;
    }

    public void setDialogue(PoolProperties dialogue) {
        this.dialogue = dialogue;
    }

    public PoolProperties getReasoning() {
        return reasoning;
    }

    public void setReasoning(PoolProperties reasoning) {
        this.reasoning = reasoning;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Sizing for one {@code ThreadPoolTaskExecutor}.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(2, 4, 50, "pool-");
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

    /**
     * Scheduler pool shared by {@code @Scheduled} methods and daily tasks.
     */
    public static class SchedulerProperties {
        private int poolSize = 2;
        private String threadNamePrefix = "genesis-scheduler-";

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
