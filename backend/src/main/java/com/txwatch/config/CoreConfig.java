package com.txwatch.config;

import com.txwatch.common.error.ErrorReporter;
import com.txwatch.common.error.LoggingErrorReporter;
import com.txwatch.common.retry.BackoffRetryExecutor;
import com.txwatch.common.retry.RetryExecutor;
import com.txwatch.health.HealthCheckService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Shared collaborators: wall clock, error reporter, retry executor and the health registry.
 */
@Configuration
public class CoreConfig {

    static final int ERROR_LOG_CAPACITY = 1_000;
    static final Duration ERROR_LOG_RETENTION = Duration.ofDays(7);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LoggingErrorReporter errorReporter(Clock clock) {
        return new LoggingErrorReporter(ERROR_LOG_CAPACITY, ERROR_LOG_RETENTION, clock);
    }

    @Bean
    public RetryExecutor retryExecutor(ErrorReporter errorReporter) {
        return new BackoffRetryExecutor(errorReporter);
    }

    @Bean
    public HealthCheckService healthCheckService(ErrorReporter errorReporter,
                                                 @Qualifier(AsyncConfig.HEALTH_EXECUTOR) Executor healthExecutor,
                                                 Clock clock) {
        return new HealthCheckService(errorReporter, healthExecutor, clock);
    }
}
