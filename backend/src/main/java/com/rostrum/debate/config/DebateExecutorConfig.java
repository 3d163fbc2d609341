package com.rostrum.debate.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for debate round loops and for individual text-generation attempts.
 */
@Configuration
public class DebateExecutorConfig {

    /**
     * Runs one background loop per active debate. When the pool and queue are full the caller runs the loop.
     * Shutdown interrupts running loops; an interrupted debate keeps its last snapshot and resumes on recovery.
     */
    @Bean(name = "debateTaskExecutor")
    public ThreadPoolTaskExecutor debateTaskExecutor(RostrumRuntimeProperties rostrumRuntimeProperties) {
        RostrumRuntimeProperties.Executor props = rostrumRuntimeProperties.getExecutor();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        executor.initialize();
        return executor;
    }

    /**
     * Hosts single generation attempts so a timed-out attempt can be interrupted without touching the loop.
     */
    @Bean(name = "textGenerationAttemptExecutor", destroyMethod = "shutdownNow")
    public ExecutorService textGenerationAttemptExecutor() {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "text-generation-attempt-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }
}
