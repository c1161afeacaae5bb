package com.txwatch.config;

import com.txwatch.common.error.LoggingErrorReporter;
import com.txwatch.common.retry.RetryExecutor;
import com.txwatch.health.HealthCheckService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        AsyncConfig.class,
        SchedulerConfig.class,
        CoreConfig.class
}, properties = "txwatch.tracker.poll-workers=3")
class ExecutorConfigTest {

    @Autowired
    @Qualifier(AsyncConfig.POLL_EXECUTOR)
    Executor pollExecutor;

    @Autowired
    @Qualifier(AsyncConfig.HEALTH_EXECUTOR)
    Executor healthExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Autowired
    LoggingErrorReporter errorReporter;

    @Autowired
    RetryExecutor retryExecutor;

    @Autowired
    HealthCheckService healthCheckService;

    @Test
    @DisplayName("poll executor is sized from poll-workers")
    void pollExecutorSizedFromProperty() {
        assertThat(pollExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor poll = (ThreadPoolTaskExecutor) pollExecutor;
        assertThat(poll.getCorePoolSize()).isEqualTo(3);
        assertThat(poll.getMaxPoolSize()).isEqualTo(3);
        assertThat(poll.getThreadNamePrefix()).isEqualTo("poll-");
    }

    @Test
    void healthExecutorCreated() {
        assertThat(healthExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        assertThat(((ThreadPoolTaskExecutor) healthExecutor).getMaxPoolSize()).isEqualTo(4);
    }

    @Test
    @DisplayName("scheduler pool is created and configured")
    void schedulerPoolCreated() {
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("scheduler-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(4);
    }

    @Test
    void sharedCollaboratorsWired() {
        assertThat(errorReporter.getTotalErrors()).isZero();
        assertThat(retryExecutor).isNotNull();
        assertThat(healthCheckService.getServiceCount()).isZero();
    }
}
