package com.txwatch.health;

import com.txwatch.common.error.ErrorKind;
import com.txwatch.common.error.ErrorReporter;
import com.txwatch.common.error.ErrorSeverity;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs registered probes concurrently, each bounded by its own timeout, and folds the results into a {@link SystemHealth}.
 * Overall status: UNKNOWN with no services, UNHEALTHY if a critical service is unhealthy, HEALTHY if all are healthy,
 * DEGRADED otherwise.
 */
@Slf4j
public class HealthCheckService implements HealthRegistry {

    private final Map<String, Registration> services = new ConcurrentHashMap<>();
    private final ErrorReporter errorReporter;
    private final Executor executor;
    private final Clock clock;
    private volatile SystemHealth lastHealth;

    public HealthCheckService(ErrorReporter errorReporter, Executor executor, Clock clock) {
        this.errorReporter = errorReporter;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public void register(String name, String url, long timeoutMs, Callable<Boolean> probe, boolean critical) {
        services.put(name, new Registration(name, url, Math.max(1L, timeoutMs), probe, critical));
        log.info("Health check registered for service: {}", name);
    }

    @Override
    public boolean unregister(String name) {
        return services.remove(name) != null;
    }

    public SystemHealth checkAll() {
        List<Registration> registrations = new ArrayList<>(services.values());
        Map<Registration, CompletableFuture<Boolean>> running = new LinkedHashMap<>();
        Map<Registration, Long> startedAt = new LinkedHashMap<>();
        for (Registration r : registrations) {
            startedAt.put(r, System.nanoTime());
            running.put(r, CompletableFuture.supplyAsync(() -> invoke(r.probe()), executor));
        }
        List<HealthCheckResult> results = new ArrayList<>();
        for (Map.Entry<Registration, CompletableFuture<Boolean>> e : running.entrySet()) {
            results.add(await(e.getKey(), e.getValue(), startedAt.get(e.getKey())));
        }
        SystemHealth health = aggregate(results);
        lastHealth = health;
        return health;
    }

    /**
     * Result of the most recent {@link #checkAll()}, or a fresh check when none has run yet.
     */
    public SystemHealth getLastHealth() {
        SystemHealth h = lastHealth;
        return h != null ? h : checkAll();
    }

    public int getServiceCount() {
        return services.size();
    }

    private HealthCheckResult await(Registration r, CompletableFuture<Boolean> future, long startNanos) {
        long remainingMs = r.timeoutMs() - elapsedMs(startNanos);
        try {
            boolean healthy = future.get(Math.max(0L, remainingMs), TimeUnit.MILLISECONDS);
            return result(r, healthy ? HealthStatus.HEALTHY : HealthStatus.DEGRADED, elapsedMs(startNanos), null);
        } catch (TimeoutException e) {
            future.cancel(true);
            return failed(r, new TimeoutException("Health check timeout after " + r.timeoutMs() + "ms"), startNanos);
        } catch (ExecutionException e) {
            return failed(r, e.getCause() != null ? e.getCause() : e, startNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(r, e, startNanos);
        }
    }

    private HealthCheckResult failed(Registration r, Throwable error, long startNanos) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("service", r.name());
        context.put("healthCheck", true);
        errorReporter.report(error, ErrorKind.SYSTEM, r.critical() ? ErrorSeverity.CRITICAL : ErrorSeverity.MEDIUM, context);
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return result(r, HealthStatus.UNHEALTHY, elapsedMs(startNanos), message);
    }

    private HealthCheckResult result(Registration r, HealthStatus status, long responseTimeMs, String error) {
        return new HealthCheckResult(r.name(), status, responseTimeMs, error, clock.instant(), r.url(), r.critical());
    }

    private SystemHealth aggregate(List<HealthCheckResult> results) {
        Instant now = clock.instant();
        if (results.isEmpty()) {
            return new SystemHealth(HealthStatus.UNKNOWN, List.of(), List.of(), now);
        }
        List<String> criticalIssues = new ArrayList<>();
        boolean allHealthy = true;
        for (HealthCheckResult r : results) {
            if (r.status() != HealthStatus.HEALTHY) {
                allHealthy = false;
            }
            if (r.critical() && r.status() == HealthStatus.UNHEALTHY) {
                criticalIssues.add("Critical service " + r.service() + " is unhealthy: "
                        + (r.error() != null ? r.error() : "Unknown error"));
            }
        }
        HealthStatus overall;
        if (!criticalIssues.isEmpty()) {
            overall = HealthStatus.UNHEALTHY;
        } else if (allHealthy) {
            overall = HealthStatus.HEALTHY;
        } else {
            overall = HealthStatus.DEGRADED;
        }
        return new SystemHealth(overall, List.copyOf(results), List.copyOf(criticalIssues), now);
    }

    private static Boolean invoke(Callable<Boolean> probe) {
        try {
            return Boolean.TRUE.equals(probe.call());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private record Registration(String name, String url, long timeoutMs, Callable<Boolean> probe, boolean critical) {
    }
}
