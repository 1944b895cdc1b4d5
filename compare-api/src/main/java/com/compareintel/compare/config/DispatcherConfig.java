package com.compareintel.compare.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class DispatcherConfig {

    /**
     * Fixed worker pool shared by all comparisons. Its size caps concurrent outbound provider calls; further calls
     * queue until a worker frees up.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler providerCallScheduler(ComparisonProperties properties) {
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(properties.maxConcurrentCalls(), runnable -> {
            Thread thread = new Thread(runnable, "provider-call-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        return Schedulers.fromExecutorService(executor, "provider-call");
    }
}
