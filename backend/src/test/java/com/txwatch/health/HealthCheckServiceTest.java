package com.txwatch.health;

import com.txwatch.common.error.ErrorKind;
import com.txwatch.common.error.ErrorReporter;
import com.txwatch.common.error.ErrorSeverity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class HealthCheckServiceTest {

    @Mock
    private ErrorReporter errorReporter;

    private ExecutorService executor;
    private HealthCheckService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        service = new HealthCheckService(errorReporter, executor,
                Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void checkAll_nothingRegistered_isUnknown() {
        assertThat(service.checkAll().overallStatus()).isEqualTo(HealthStatus.UNKNOWN);
    }

    @Test
    void checkAll_allProbesPass_isHealthy() {
        service.register("Solana RPC", "https://rpc.test", 1_000L, () -> true, true);
        service.register("Solana WebSocket", "wss://rpc.test", 1_000L, () -> true, false);

        SystemHealth health = service.checkAll();

        assertThat(health.overallStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(health.services()).hasSize(2).allMatch(r -> r.status() == HealthStatus.HEALTHY);
        assertThat(health.criticalIssues()).isEmpty();
    }

    @Test
    @DisplayName("a failing non-critical probe degrades the system and is reported MEDIUM")
    void checkAll_nonCriticalFailure_isDegraded() {
        service.register("Solana RPC", "https://rpc.test", 1_000L, () -> true, true);
        service.register("Solana WebSocket", "wss://rpc.test", 1_000L, () -> {
            throw new IllegalStateException("socket closed");
        }, false);

        SystemHealth health = service.checkAll();

        assertThat(health.overallStatus()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(health.services())
                .filteredOn(r -> r.service().equals("Solana WebSocket"))
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.status()).isEqualTo(HealthStatus.UNHEALTHY);
                    assertThat(r.error()).isEqualTo("socket closed");
                });
        verify(errorReporter).report(any(IllegalStateException.class), eq(ErrorKind.SYSTEM),
                eq(ErrorSeverity.MEDIUM), anyMap());
    }

    @Test
    @DisplayName("a critical probe that exceeds its timeout makes the system unhealthy")
    void checkAll_criticalTimeout_isUnhealthy() {
        service.register("Solana RPC", "https://rpc.test", 100L, () -> {
            Thread.sleep(2_000L);
            return true;
        }, true);

        SystemHealth health = service.checkAll();

        assertThat(health.overallStatus()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(health.criticalIssues()).singleElement().asString().contains("Solana RPC").contains("timeout");
        verify(errorReporter).report(any(), eq(ErrorKind.SYSTEM), eq(ErrorSeverity.CRITICAL), anyMap());
    }

    @Test
    void checkAll_probeReturnsFalse_isDegraded() {
        service.register("Solana WebSocket", "wss://rpc.test", 1_000L, () -> false, false);

        SystemHealth health = service.checkAll();

        assertThat(health.overallStatus()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(service.getLastHealth()).isSameAs(health);
    }

    @Test
    void unregister_removesService() {
        service.register("Solana RPC", "https://rpc.test", 1_000L, () -> true, true);

        assertThat(service.unregister("Solana RPC")).isTrue();
        assertThat(service.unregister("Solana RPC")).isFalse();
        assertThat(service.getServiceCount()).isZero();
    }
}
