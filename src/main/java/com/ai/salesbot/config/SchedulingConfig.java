package com.ai.salesbot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Timers for the stuck-call sweep and the health heartbeat, plus the pool that drains
 * subscriber send lanes.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {

    /**
     * Shared by all subscribers. Each subscriber has at most one drain task queued or running,
     * so a stalled socket holds one thread and never the others.
     */
    @Bean(name = "broadcastDispatcher", destroyMethod = "shutdown")
    public ExecutorService broadcastDispatcher(@Value("${salesbot.broadcast.dispatch-threads:4}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "dashboard-broadcast-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
