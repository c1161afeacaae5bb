package com.txwatch.api.controller;

import com.txwatch.api.dto.BalanceResponse;
import com.txwatch.connection.ConnectionManager;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final ConnectionManager connectionManager;

    @GetMapping("/{address}/balance")
    public Mono<BalanceResponse> getBalance(@PathVariable String address) {
        String trimmed = address.trim();
        return Mono.fromCallable(() -> new BalanceResponse(trimmed, connectionManager.getBalance(trimmed)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
