package com.txwatch.health;

import java.time.Instant;

public record HealthCheckResult(
        String service,
        HealthStatus status,
        long responseTimeMs,
        String error,
        Instant timestamp,
        String url,
        boolean critical
) {
}
