package com.txwatch.health;

import java.time.Instant;
import java.util.List;

public record SystemHealth(
        HealthStatus overallStatus,
        List<HealthCheckResult> services,
        List<String> criticalIssues,
        Instant lastUpdated
) {
}
