package com.txwatch.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class HealthCheckJob {

    private final HealthCheckService healthCheckService;

    @Scheduled(
            fixedDelayString = "${txwatch.health.check-interval-ms:30000}",
            initialDelayString = "${txwatch.health.check-interval-ms:30000}")
    public void runScheduled() {
        SystemHealth health = healthCheckService.checkAll();
        if (health.overallStatus() != HealthStatus.HEALTHY) {
            log.warn("System health {}: criticalIssues={}", health.overallStatus(), health.criticalIssues());
        }
    }
}
