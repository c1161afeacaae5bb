package com.txwatch.connection;

import java.time.Instant;

/**
 * The single mutable stats instance behind {@link ConnectionManager}. Counters only grow; all access is synchronized
 * because probes, pings and read operations run on different threads.
 */
class ConnectionStatsRecorder {

    private boolean connected;
    private Instant lastPingAt;
    private double averageResponseTimeMs;
    private long totalRequests;
    private long failedRequests;
    private String lastError;

    synchronized void recordSuccess(long responseTimeMs) {
        totalRequests++;
        if (averageResponseTimeMs == 0) {
            averageResponseTimeMs = responseTimeMs;
        } else {
            averageResponseTimeMs = (averageResponseTimeMs + responseTimeMs) / 2;
        }
    }

    synchronized void recordFailure() {
        totalRequests++;
        failedRequests++;
    }

    synchronized void markConnected(Instant pingAt) {
        connected = true;
        lastPingAt = pingAt;
    }

    /**
     * @param error reason to keep as lastError; null keeps the previous one
     */
    synchronized void markDisconnected(String error) {
        connected = false;
        if (error != null) {
            lastError = error;
        }
    }

    synchronized ConnectionStats snapshot() {
        return new ConnectionStats(connected, lastPingAt, averageResponseTimeMs, totalRequests, failedRequests, lastError);
    }
}
