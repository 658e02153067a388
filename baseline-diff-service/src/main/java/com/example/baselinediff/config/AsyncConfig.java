package com.example.baselinediff.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded executors for scan work.
 *
 * Scan jobs and per-project log reads run on separate pools: a scan job blocks
 * while its log reads complete, so sharing one pool could starve the reads.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

    /**
     * Runs whole scan jobs. One at a time is the norm since scans hold the {@code scanTrees} lock.
     */
    @Bean(name = "scanJobExecutor")
    public Executor scanJobExecutor(
            @Value("${baseline.async.job-pool-size:2}") int poolSize,
            @Value("${baseline.async.job-queue-capacity:10}") int queueCapacity) {
        return buildExecutor(poolSize, poolSize, queueCapacity, "scan-job-");
    }

    /**
     * Reads project commit logs in parallel.
     */
    @Bean(name = "scanTaskExecutor")
    public Executor scanTaskExecutor(
            @Value("${baseline.async.core-pool-size:4}") int corePoolSize,
            @Value("${baseline.async.max-pool-size:8}") int maxPoolSize,
            @Value("${baseline.async.queue-capacity:1000}") int queueCapacity,
            @Value("${baseline.async.thread-name-prefix:scan-}") String threadNamePrefix) {
        return buildExecutor(corePoolSize, maxPoolSize, queueCapacity, threadNamePrefix);
    }

    private ThreadPoolTaskExecutor buildExecutor(int corePoolSize, int maxPoolSize, int queueCapacity,
                                                 String threadNamePrefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);

        // Full queue throws RejectedExecutionException; callers count the project as failed
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();

        log.info("Initialized executor prefix='{}' - core={}, max={}, queue={}",
                threadNamePrefix, corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }

    /**
     * Copies the submitting thread's MDC (correlation id) into the worker thread.
     */
    public static class MdcTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();

            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }
}
