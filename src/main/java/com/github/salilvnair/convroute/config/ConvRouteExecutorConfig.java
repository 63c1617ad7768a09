package com.github.salilvnair.convroute.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ConvRouteExecutorConfig {

    /**
     * Shared pool that drains every connection's serial queue.
     */
    @Bean(name = "convRouteWorkerExecutor", destroyMethod = "shutdown")
    public ExecutorService convRouteWorkerExecutor(ConvRouteTransportConfig transportConfig) {
        int workers = Math.max(1, transportConfig.getWorkerThreads());
        AtomicInteger sequence = new AtomicInteger();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                workers,
                workers,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                task -> {
                    Thread thread = new Thread(task, "convroute-worker-" + sequence.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                }
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * Named so that scheduled tasks pick it over the scheduler bean the WebSocket
     * configuration contributes.
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("convroute-scheduler-");
        scheduler.setDaemon(true);
        return scheduler;
    }
}
