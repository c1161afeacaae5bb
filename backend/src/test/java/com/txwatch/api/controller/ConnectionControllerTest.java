package com.txwatch.api.controller;

import com.txwatch.connection.Commitment;
import com.txwatch.connection.ConnectionManager;
import com.txwatch.connection.ConnectionStats;
import com.txwatch.connection.RpcCallFailedException;
import com.txwatch.connection.RpcConnection;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.time.Instant;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@WebFluxTest({ConnectionController.class, AccountController.class})
class ConnectionControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    ConnectionManager connectionManager;

    @Test
    void stats_combinesCountersAndHealth() {
        RpcConnection connection = mock(RpcConnection.class);
        when(connection.getEndpoint()).thenReturn("https://rpc.test");
        when(connection.getCommitment()).thenReturn(Commitment.CONFIRMED);
        when(connectionManager.getConnection()).thenReturn(connection);
        when(connectionManager.getStats()).thenReturn(new ConnectionStats(
                true, Instant.parse("2025-03-01T12:00:00Z"), 42.5, 10, 1, "timeout"));
        when(connectionManager.isHealthy()).thenReturn(true);
        when(connectionManager.getReconnectAttempts()).thenReturn(0);

        webTestClient.get()
                .uri("/api/v1/connection/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.endpoint").isEqualTo("https://rpc.test")
                .jsonPath("$.commitment").isEqualTo("confirmed")
                .jsonPath("$.healthy").isEqualTo(true)
                .jsonPath("$.totalRequests").isEqualTo(10)
                .jsonPath("$.failedRequests").isEqualTo(1)
                .jsonPath("$.lastError").isEqualTo("timeout");
    }

    @Test
    void slot_returnsCurrentSlot() {
        when(connectionManager.getSlot()).thenReturn(123_456L);

        webTestClient.get()
                .uri("/api/v1/connection/slot")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.slot").isEqualTo(123_456);
    }

    @Test
    void slot_exhaustedRetries_returns502() {
        when(connectionManager.getSlot())
                .thenThrow(new RpcCallFailedException("getSlot", 4, new IllegalStateException("503")));

        webTestClient.get()
                .uri("/api/v1/connection/slot")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("RPC_ERROR");
    }

    @Test
    void balance_returnsSol() {
        when(connectionManager.getBalance("Alice")).thenReturn(new BigDecimal("1.5"));

        webTestClient.get()
                .uri("/api/v1/accounts/Alice/balance")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.address").isEqualTo("Alice")
                .jsonPath("$.balance").isEqualTo(1.5);
    }
}
