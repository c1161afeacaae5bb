package com.txwatch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: poll-executor runs confirmation polls dispatched by the tracker tick,
 * health-executor runs health probes so a hung probe never stalls the scheduler.
 */
@Configuration
public class AsyncConfig {

    public static final String POLL_EXECUTOR = "poll-executor";
    public static final String HEALTH_EXECUTOR = "health-executor";

    @Bean(name = POLL_EXECUTOR)
    public Executor pollExecutor(@Value("${txwatch.tracker.poll-workers:8}") int pollWorkers) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(Math.max(1, pollWorkers));
        e.setMaxPoolSize(Math.max(1, pollWorkers));
        e.setThreadNamePrefix("poll-");
        e.initialize();
        return e;
    }

    @Bean(name = HEALTH_EXECUTOR)
    public Executor healthExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(4);
        e.setThreadNamePrefix("health-");
        e.initialize();
        return e;
    }
}
