package com.lmspush.push;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PushConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy(PushProperties properties) {
        return properties.toRetryPolicy();
    }

    /**
     * Worker pool running one task per push. {@code shutdownNow} on context close
     * interrupts any backoff wait in progress.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pushWorkerPool(PushProperties properties) {
        if (properties.workerThreads() < 1) {
            throw new IllegalArgumentException("lmspush.push.worker-threads must be at least 1");
        }
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.workerThreads(), r -> {
            Thread t = new Thread(r, "push-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
