package com.txwatch.api.controller;

import com.txwatch.api.dto.ConnectionStatusResponse;
import com.txwatch.api.dto.SlotResponse;
import com.txwatch.connection.ConnectionManager;
import com.txwatch.connection.ConnectionStats;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/v1/connection")
@RequiredArgsConstructor
public class ConnectionController {

    private final ConnectionManager connectionManager;

    @GetMapping("/stats")
    public ResponseEntity<ConnectionStatusResponse> getStats() {
        ConnectionStats stats = connectionManager.getStats();
        return ResponseEntity.ok(new ConnectionStatusResponse(
                connectionManager.getConnection().getEndpoint(),
                connectionManager.getConnection().getCommitment().rpcValue(),
                stats.connected(),
                connectionManager.isHealthy(),
                stats.lastPingAt(),
                stats.averageResponseTimeMs(),
                stats.totalRequests(),
                stats.failedRequests(),
                stats.lastError(),
                connectionManager.getReconnectAttempts()));
    }

    /** Retried RPC read; blocks, so it runs on the bounded elastic scheduler. */
    @GetMapping("/slot")
    public Mono<SlotResponse> getSlot() {
        return Mono.fromCallable(() -> new SlotResponse(connectionManager.getSlot()))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
