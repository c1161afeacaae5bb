package com.txwatch.api.controller;

import com.txwatch.common.error.ErrorReport;
import com.txwatch.common.error.LoggingErrorReporter;
import com.txwatch.health.HealthCheckService;
import com.txwatch.health.SystemHealth;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * GET /health runs every registered probe; GET /errors summarizes reported errors.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MonitoringController {

    private final HealthCheckService healthCheckService;
    private final LoggingErrorReporter errorReporter;

    @GetMapping("/health")
    public Mono<SystemHealth> getHealth() {
        return Mono.fromCallable(healthCheckService::checkAll)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/errors")
    public ResponseEntity<ErrorReport> getErrors() {
        return ResponseEntity.ok(errorReporter.getReport());
    }
}
