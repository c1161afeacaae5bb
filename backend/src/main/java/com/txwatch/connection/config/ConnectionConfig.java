package com.txwatch.connection.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.txwatch.common.error.ErrorReporter;
import com.txwatch.common.retry.RetryExecutor;
import com.txwatch.connection.ConnectionManager;
import com.txwatch.connection.RpcConnection;
import com.txwatch.connection.solana.SolanaRpcClient;
import com.txwatch.connection.solana.WebClientSolanaRpcClient;
import com.txwatch.connection.stream.StreamChannel;
import com.txwatch.health.HealthRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the RPC transport, the typed connection and the {@link ConnectionManager}. The manager starts on context
 * refresh and disconnects on shutdown.
 */
@Configuration
@EnableConfigurationProperties(ConnectionProperties.class)
public class ConnectionConfig {

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientSolanaRpcClient(webClientBuilder);
    }

    @Bean(name = "rpcRateLimiter")
    public RateLimiter rpcRateLimiter(ConnectionProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(properties.getTimeoutMs()))
                .build();
        return RateLimiter.of("solana-rpc", config);
    }

    @Bean
    public RpcConnection rpcConnection(SolanaRpcClient solanaRpcClient,
                                       ConnectionProperties properties,
                                       ObjectMapper objectMapper,
                                       RateLimiter rpcRateLimiter) {
        return new RpcConnection(
                solanaRpcClient,
                properties.getEndpoint(),
                properties.getCommitmentLevel(),
                Duration.ofMillis(properties.getTimeoutMs()),
                objectMapper,
                rpcRateLimiter);
    }

    @Bean(initMethod = "initialize", destroyMethod = "disconnect")
    public ConnectionManager connectionManager(ConnectionProperties properties,
                                               RpcConnection rpcConnection,
                                               TaskScheduler taskScheduler,
                                               RetryExecutor retryExecutor,
                                               ErrorReporter errorReporter,
                                               HealthRegistry healthRegistry,
                                               ObjectMapper objectMapper,
                                               Clock clock) {
        StreamChannel streamChannel = null;
        if (properties.hasStreamEndpoint()) {
            streamChannel = new StreamChannel(
                    new ReactorNettyWebSocketClient(),
                    URI.create(properties.getStreamEndpoint()),
                    objectMapper,
                    taskScheduler,
                    clock,
                    Duration.ofMillis(properties.getStreamReconnectDelayMs()));
        }
        return new ConnectionManager(properties, rpcConnection, streamChannel, taskScheduler,
                retryExecutor, errorReporter, healthRegistry, clock);
    }
}
