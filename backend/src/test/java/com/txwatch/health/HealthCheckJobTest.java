package com.txwatch.health;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthCheckJobTest {

    @Mock
    private HealthCheckService healthCheckService;

    @InjectMocks
    private HealthCheckJob job;

    @Test
    void runScheduled_checksAllServices() {
        when(healthCheckService.checkAll()).thenReturn(new SystemHealth(HealthStatus.UNHEALTHY,
                List.of(new HealthCheckResult("rpc", HealthStatus.UNHEALTHY, 5000L, "timeout",
                        Instant.parse("2025-03-01T00:00:00Z"), "https://rpc.test", true)),
                List.of("rpc: timeout"), Instant.parse("2025-03-01T00:00:00Z")));

        job.runScheduled();

        verify(healthCheckService).checkAll();
    }
}
