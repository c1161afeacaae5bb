package com.txwatch.connection.config;

import com.txwatch.connection.Commitment;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * RPC endpoint, retry and liveness settings. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "txwatch.connection")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ConnectionProperties {

    /** JSON-RPC HTTP endpoint. Required. */
    @NotBlank
    private String endpoint;

    /** Optional WebSocket endpoint for the stream channel. */
    private String streamEndpoint;

    @NotNull
    private Commitment commitmentLevel = Commitment.CONFIRMED;

    /** Per-call RPC timeout. */
    @Min(1)
    private long timeoutMs = 30_000L;

    /** Total attempts per read operation, including the first call. */
    @Min(1)
    private int retryAttempts = 3;

    /** Base delay for read retries and for reconnect backoff (doubles per attempt). */
    @Min(0)
    private long retryDelayMs = 1_000L;

    /** Upper bound on a single read-retry delay. */
    @Min(0)
    private long maxRetryDelayMs = 8_000L;

    /** Jitter factor 0..1 for read-retry delays (0.2 = ±20%). */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double retryJitterFactor = 0.2;

    @Min(0)
    private int maxReconnectAttempts = 5;

    @Min(1)
    private long pingIntervalMs = 30_000L;

    /** isHealthy() is false when the last successful ping is at least this old. */
    @Min(1)
    private long pingStalenessMs = 60_000L;

    /** isHealthy() requires failedRequests / totalRequests below this value. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double maxFailureRate = 0.10;

    @Min(0)
    private long streamReconnectDelayMs = 5_000L;

    /** Client-side cap on RPC requests per second. */
    @Min(1)
    private int maxRequestsPerSecond = 40;

    public boolean hasStreamEndpoint() {
        return streamEndpoint != null && !streamEndpoint.isBlank();
    }
}
