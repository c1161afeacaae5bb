package com.txwatch.api.dto;

import java.time.Instant;

/**
 * GET /api/v1/connection/stats: counters plus the health verdict computed at request time.
 */
public record ConnectionStatusResponse(
        String endpoint,
        String commitment,
        boolean connected,
        boolean healthy,
        Instant lastPingAt,
        double averageResponseTimeMs,
        long totalRequests,
        long failedRequests,
        String lastError,
        int reconnectAttempts
) {
}
