package com.txwatch.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.txwatch.common.RetryPolicy;
import com.txwatch.common.error.ErrorKind;
import com.txwatch.common.error.ErrorReporter;
import com.txwatch.common.error.ErrorSeverity;
import com.txwatch.common.retry.RetryExecutor;
import com.txwatch.common.retry.RetryExhaustedException;
import com.txwatch.connection.config.ConnectionProperties;
import com.txwatch.connection.model.AccountInfo;
import com.txwatch.connection.stream.StreamChannel;
import com.txwatch.health.HealthRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Health-monitored handle on one RPC endpoint plus the optional stream channel.
 * <p>
 * Liveness: {@link #initialize()} probes with getSlot; success starts a fixed-rate ping, failure schedules a reconnect
 * after {@code retryDelayMs * 2^attempt}, up to {@code maxReconnectAttempts}. Probe and ping failures are never thrown.
 * <p>
 * Reads: each read goes through the {@link RetryExecutor}; every attempt is counted in {@link ConnectionStats} and the
 * final failure surfaces as {@link RpcCallFailedException}.
 */
@Slf4j
public class ConnectionManager {

    public static final String RPC_SERVICE_NAME = "Solana RPC";
    public static final String STREAM_SERVICE_NAME = "Solana WebSocket";
    static final long HEALTH_PROBE_TIMEOUT_MS = 10_000L;
    /** Reconnect delay stops doubling after this many attempts. */
    static final int MAX_BACKOFF_SHIFT = 20;
    static final int TOKEN_ACCOUNT_DATA_SIZE = 165;
    static final int TOKEN_ACCOUNT_OWNER_OFFSET = 32;
    private static final int LAMPORTS_DECIMALS = 9;

    private final ConnectionProperties properties;
    private final RpcConnection connection;
    private final StreamChannel streamChannel;
    private final TaskScheduler scheduler;
    private final RetryExecutor retryExecutor;
    private final ErrorReporter errorReporter;
    private final HealthRegistry healthRegistry;
    private final Clock clock;
    private final RetryPolicy readPolicy;

    private final ConnectionStatsRecorder stats = new ConnectionStatsRecorder();
    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    private final AtomicBoolean reconnectScheduled = new AtomicBoolean(false);
    private final AtomicBoolean reconnectExhaustedReported = new AtomicBoolean(false);
    private final AtomicBoolean healthChecksRegistered = new AtomicBoolean(false);

    private volatile ScheduledFuture<?> pingTask;
    private volatile ScheduledFuture<?> reconnectTask;
    private volatile boolean disconnected;

    /**
     * @param streamChannel  null when no stream endpoint is configured
     * @param healthRegistry null to skip health registration
     */
    public ConnectionManager(ConnectionProperties properties,
                             RpcConnection connection,
                             StreamChannel streamChannel,
                             TaskScheduler scheduler,
                             RetryExecutor retryExecutor,
                             ErrorReporter errorReporter,
                             HealthRegistry healthRegistry,
                             Clock clock) {
        this.properties = properties;
        this.connection = connection;
        this.streamChannel = streamChannel;
        this.scheduler = scheduler;
        this.retryExecutor = retryExecutor;
        this.errorReporter = errorReporter;
        this.healthRegistry = healthRegistry;
        this.clock = clock;
        this.readPolicy = new RetryPolicy(
                properties.getRetryDelayMs(),
                properties.getMaxRetryDelayMs(),
                properties.getRetryJitterFactor(),
                Math.max(1, properties.getRetryAttempts()));
    }

    /**
     * Probes the endpoint; on success starts ping monitoring, registers health checks and opens the stream channel,
     * on failure records the error and schedules a reconnect.
     */
    public void initialize() {
        disconnected = false;
        try {
            probe();
            stats.markConnected(clock.instant());
            reconnectAttempts.set(0);
            reconnectExhaustedReported.set(false);
            log.info("Connected to RPC endpoint={} commitment={}", properties.getEndpoint(), connection.getCommitment().rpcValue());
            startPingMonitoring();
            registerHealthChecks();
            if (streamChannel != null) {
                streamChannel.open();
            }
        } catch (RuntimeException e) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("method", "initializeConnection");
            context.put("endpoint", properties.getEndpoint());
            errorReporter.report(e, ErrorKind.RPC, ErrorSeverity.HIGH, context);
            stats.markDisconnected(messageOf(e));
            scheduleReconnect();
        }
    }

    /**
     * One liveness probe; scheduled at a fixed rate while monitoring is active.
     */
    void ping() {
        try {
            probe();
            stats.markConnected(clock.instant());
            reconnectAttempts.set(0);
            reconnectExhaustedReported.set(false);
        } catch (RuntimeException e) {
            log.warn("Ping failed: {}", messageOf(e));
            stats.markDisconnected(messageOf(e));
            scheduleReconnect();
        }
    }

    private void probe() {
        try {
            timed(connection::getSlot);
        } catch (RuntimeException e) {
            throw new ConnectionUnavailableException("Liveness probe failed: " + messageOf(e), e);
        }
    }

    private void startPingMonitoring() {
        cancel(pingTask);
        Duration interval = Duration.ofMillis(properties.getPingIntervalMs());
        pingTask = scheduler.scheduleAtFixedRate(this::ping, clock.instant().plus(interval), interval);
    }

    private void scheduleReconnect() {
        if (disconnected || !reconnectScheduled.compareAndSet(false, true)) {
            return;
        }
        int attempt = reconnectAttempts.get();
        int max = properties.getMaxReconnectAttempts();
        if (attempt >= max) {
            reconnectScheduled.set(false);
            if (reconnectExhaustedReported.compareAndSet(false, true)) {
                log.error("Max reconnection attempts reached ({}); endpoint={} needs manual intervention", max, properties.getEndpoint());
                Map<String, Object> context = new LinkedHashMap<>();
                context.put("endpoint", properties.getEndpoint());
                context.put("reconnectAttempts", attempt);
                errorReporter.report(new ConnectionUnavailableException("Max reconnection attempts reached"),
                        ErrorKind.SYSTEM, ErrorSeverity.CRITICAL, context);
            }
            return;
        }
        long delay = properties.getRetryDelayMs() * (1L << Math.min(attempt, MAX_BACKOFF_SHIFT));
        int current = reconnectAttempts.incrementAndGet();
        log.info("Scheduling reconnect {}/{} in {}ms", current, max, delay);
        reconnectTask = scheduler.schedule(() -> {
            reconnectScheduled.set(false);
            if (disconnected) {
                return;
            }
            log.info("Attempting to reconnect... ({}/{})", current, max);
            initialize();
        }, clock.instant().plusMillis(delay));
    }

    private void registerHealthChecks() {
        if (healthRegistry == null || !healthChecksRegistered.compareAndSet(false, true)) {
            return;
        }
        healthRegistry.register(RPC_SERVICE_NAME, properties.getEndpoint(), HEALTH_PROBE_TIMEOUT_MS,
                () -> connection.getSlot() >= 0, true);
        if (streamChannel != null) {
            healthRegistry.register(STREAM_SERVICE_NAME, properties.getStreamEndpoint(), HEALTH_PROBE_TIMEOUT_MS,
                    streamChannel::isOpen, false);
        }
    }

    public RpcConnection getConnection() {
        return connection;
    }

    public ConnectionStats getStats() {
        return stats.snapshot();
    }

    public int getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    /** Native balance in SOL. */
    public BigDecimal getBalance(String address) {
        long lamports = execute("getBalance", Map.of("address", address), () -> connection.getBalance(address));
        return BigDecimal.valueOf(lamports).movePointLeft(LAMPORTS_DECIMALS);
    }

    public Optional<AccountInfo> getAccountInfo(String address) {
        return execute("getAccountInfo", Map.of("address", address), () -> connection.getAccountInfo(address));
    }

    /**
     * SPL token accounts owned by {@code owner} under the given token program.
     */
    public List<AccountInfo> getTokenAccounts(String owner, String programId) {
        List<Map<String, Object>> filters = List.of(
                Map.of("dataSize", TOKEN_ACCOUNT_DATA_SIZE),
                Map.of("memcmp", Map.of("offset", TOKEN_ACCOUNT_OWNER_OFFSET, "bytes", owner)));
        return execute("getTokenAccounts", Map.of("owner", owner, "programId", programId),
                () -> connection.getProgramAccounts(programId, filters));
    }

    public long getSlot() {
        return execute("getSlot", Map.of(), connection::getSlot);
    }

    public long getBlockHeight() {
        return execute("getBlockHeight", Map.of(), connection::getBlockHeight);
    }

    /**
     * Connected, pinged within the staleness window, and failure rate under the threshold. Recomputed on every call.
     */
    public boolean isHealthy() {
        ConnectionStats s = stats.snapshot();
        if (!s.connected() || s.lastPingAt() == null) {
            return false;
        }
        Instant now = clock.instant();
        if (Duration.between(s.lastPingAt(), now).toMillis() >= properties.getPingStalenessMs()) {
            return false;
        }
        double failureRate = (double) s.failedRequests() / Math.max(s.totalRequests(), 1L);
        return failureRate < properties.getMaxFailureRate();
    }

    /**
     * Stops ping monitoring and pending reconnects and closes the stream channel. {@link #initialize()} starts over.
     */
    public void disconnect() {
        disconnected = true;
        cancel(pingTask);
        pingTask = null;
        cancel(reconnectTask);
        reconnectTask = null;
        reconnectScheduled.set(false);
        if (streamChannel != null) {
            streamChannel.close();
        }
        stats.markDisconnected(null);
        log.info("Disconnected from RPC endpoint={}", properties.getEndpoint());
    }

    public boolean sendStreamMessage(Object message) {
        if (streamChannel == null) {
            log.warn("Stream endpoint is not configured; dropping message");
            return false;
        }
        return streamChannel.send(message);
    }

    public void onStreamMessage(Consumer<JsonNode> callback) {
        if (streamChannel == null) {
            log.warn("Stream endpoint is not configured; listener ignored");
            return;
        }
        streamChannel.addListener(callback);
    }

    private <T> T execute(String method, Map<String, Object> context, Supplier<T> call) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("method", method);
        ctx.putAll(context);
        try {
            return retryExecutor.run(() -> timed(call), readPolicy, ErrorKind.RPC, ctx);
        } catch (RetryExhaustedException e) {
            throw new RpcCallFailedException(method, e.getAttempts(), e.getCause());
        }
    }

    private <T> T timed(Supplier<T> call) {
        long start = System.nanoTime();
        try {
            T result = call.get();
            stats.recordSuccess(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            return result;
        } catch (RuntimeException e) {
            stats.recordFailure();
            throw e;
        }
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
