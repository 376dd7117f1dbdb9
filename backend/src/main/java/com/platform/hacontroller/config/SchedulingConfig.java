package com.platform.hacontroller.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Threads and time for the controller loops.
 *
 * Probes run on their own bounded pool so a hung probe can be abandoned on timeout.
 * Promotions run on a single thread: at most one is ever in flight.
 */
@Slf4j
@Configuration
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("ha-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("probeExecutor")
    public ExecutorService probeExecutor(HaControllerProperties properties) {
        int poolSize = properties.getProbe().getPoolSize();
        log.info("Probe executor sized at {} threads", poolSize);
        return Executors.newFixedThreadPool(poolSize, namedDaemonThreads("ha-probe-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("promotionExecutor")
    public ExecutorService promotionExecutor() {
        return Executors.newSingleThreadExecutor(namedDaemonThreads("ha-promotion-"));
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
