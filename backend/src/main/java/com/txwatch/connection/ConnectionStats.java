package com.txwatch.connection;

import java.time.Instant;

/**
 * Point-in-time copy of the connection counters.
 *
 * @param lastPingAt last successful liveness probe, null before the first one
 */
public record ConnectionStats(
        boolean connected,
        Instant lastPingAt,
        double averageResponseTimeMs,
        long totalRequests,
        long failedRequests,
        String lastError
) {
}
