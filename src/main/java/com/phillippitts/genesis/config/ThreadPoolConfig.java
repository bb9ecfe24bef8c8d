package com.phillippitts.genesis.config;

import com.phillippitts.genesis.config.logging.MdcTaskDecorator;
import com.phillippitts.genesis.config.properties.ThreadPoolProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the event bridge and dialogue pipeline.
 *
 * <p>Blocking hardware calls, orchestration work and remote model calls each get their own
 * executor so a slow robot or a slow model never starves the others. Every executor copies
 * the Log4j2 ThreadContext from the submitting thread via {@link MdcTaskDecorator}.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for blocking hardware link I/O: handshake, speech, posture changes and close.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Robot I/O blocks for the
     * whole utterance or motion, so it must never run on the submitting dialogue, scheduler or
     * request thread; the connection manager turns a rejection into a failed command future.
     *
     * @return executor for hardware commands
     */
    @Bean(name = "hardwareExecutor")
    public Executor hardwareExecutor() {
        return buildExecutor(threadPoolProperties.getHardware(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Executor for orchestration tasks handed over by the sensor event poller.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. The poller must never run
     * orchestration work on its own thread, so a full queue surfaces as a rejection that the
     * poller logs and counts.
     *
     * @return executor for dialogue turns
     */
    @Bean(name = "dialogueExecutor")
    public Executor dialogueExecutor() {
        return buildExecutor(threadPoolProperties.getDialogue(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Executor for blocking HTTP calls to the reasoning backend. Rejections are mapped to a
     * spoken sentinel by the gateway.
     *
     * @return executor for reasoning calls
     */
    @Bean(name = "reasoningExecutor")
    public Executor reasoningExecutor() {
        return buildExecutor(threadPoolProperties.getReasoning(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Scheduler shared by the connection heartbeat and daily reminder tasks.
     *
     * @return task scheduler
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setTaskDecorator(new MdcTaskDecorator());
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                                        RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }
}
