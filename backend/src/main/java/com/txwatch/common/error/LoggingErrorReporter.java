package com.txwatch.common.error;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Logs each reported error at a level matching its severity and keeps a bounded, time-limited
 * log of recent errors (Caffeine) plus lifetime counters for {@link ErrorReport}. Retention is
 * measured on the injected clock. The most common messages are counted over the retained log only.
 */
@Slf4j
public class LoggingErrorReporter implements ErrorReporter {

    private static final int MOST_COMMON_LIMIT = 10;
    private static final int RECENT_LIMIT = 50;

    private final Cache<String, RecordedError> recent;
    private final Clock clock;
    private final AtomicLong total = new AtomicLong();
    private final Map<ErrorKind, AtomicLong> byKind = new EnumMap<>(ErrorKind.class);
    private final Map<ErrorSeverity, AtomicLong> bySeverity = new EnumMap<>(ErrorSeverity.class);

    public LoggingErrorReporter(int capacity, Duration retention, Clock clock) {
        this.recent = Caffeine.newBuilder()
                .maximumSize(Math.max(1, capacity))
                .expireAfterWrite(retention)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
        this.clock = clock;
        for (ErrorKind k : ErrorKind.values()) {
            byKind.put(k, new AtomicLong());
        }
        for (ErrorSeverity s : ErrorSeverity.values()) {
            bySeverity.put(s, new AtomicLong());
        }
    }

    @Override
    public void report(Throwable error, ErrorKind kind, ErrorSeverity severity, Map<String, Object> context) {
        ErrorKind k = kind != null ? kind : ErrorKind.SYSTEM;
        ErrorSeverity s = severity != null ? severity : ErrorSeverity.MEDIUM;
        String message = messageOf(error);
        Map<String, Object> ctx = context == null || context.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        RecordedError recorded = new RecordedError(
                UUID.randomUUID().toString(),
                k,
                s,
                message,
                error != null ? error.getClass().getName() : null,
                ctx,
                clock.instant());
        recent.put(recorded.id(), recorded);
        total.incrementAndGet();
        byKind.get(k).incrementAndGet();
        bySeverity.get(s).incrementAndGet();

        switch (s) {
            case CRITICAL -> log.error("[{}/{}] {} context={}", k, s, message, ctx, error);
            case HIGH -> log.error("[{}/{}] {} context={}", k, s, message, ctx);
            case MEDIUM -> log.warn("[{}/{}] {} context={}", k, s, message, ctx);
            default -> log.info("[{}/{}] {} context={}", k, s, message, ctx);
        }
    }

    public ErrorReport getReport() {
        List<RecordedError> ordered = recent.asMap().values().stream()
                .sorted(Comparator.comparing(RecordedError::timestamp).reversed())
                .toList();
        List<RecordedError> critical = ordered.stream()
                .filter(e -> e.severity() == ErrorSeverity.CRITICAL)
                .toList();
        List<ErrorReport.MessageCount> common = ordered.stream()
                .collect(Collectors.groupingBy(RecordedError::message, Collectors.counting()))
                .entrySet().stream()
                .map(e -> new ErrorReport.MessageCount(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(ErrorReport.MessageCount::count).reversed())
                .limit(MOST_COMMON_LIMIT)
                .toList();
        return new ErrorReport(
                total.get(),
                snapshot(byKind),
                snapshot(bySeverity),
                ordered.stream().limit(RECENT_LIMIT).toList(),
                critical,
                common);
    }

    public long getTotalErrors() {
        return total.get();
    }

    /** Runs pending evictions now. */
    void cleanUp() {
        recent.cleanUp();
    }

    private static <E extends Enum<E>> Map<E, Long> snapshot(Map<E, AtomicLong> counters) {
        return counters.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().get(),
                        (a, b) -> a, LinkedHashMap::new));
    }

    private static String messageOf(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String m = error.getMessage();
        return m != null && !m.isBlank() ? m : error.getClass().getSimpleName();
    }
}
