package com.txwatch.tracking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.txwatch.common.error.ErrorKind;
import com.txwatch.common.error.ErrorReporter;
import com.txwatch.common.error.ErrorSeverity;
import com.txwatch.connection.ConnectionManager;
import com.txwatch.connection.model.SignatureStatus;
import com.txwatch.connection.model.TransactionDetail;
import com.txwatch.domain.TransactionEntry;
import com.txwatch.domain.TransactionType;
import com.txwatch.domain.metadata.SwapMetadata;
import com.txwatch.domain.metadata.TransactionMetadata;
import com.txwatch.domain.metadata.TransferMetadata;
import com.txwatch.tracking.config.TrackerProperties;
import com.txwatch.tracking.store.SnapshotStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ledger of submitted signatures. Each entry starts PENDING and is polled on the confirmation tick
 * ({@link #pollPending()}) until the node reports success (CONFIRMED), an error (FAILED), or the attempt budget
 * runs out (EXPIRED). Entries leave PENDING exactly once.
 * <p>
 * An entry is "armed" while its id is in the poll set. Each tick dispatches one poll per armed entry to the poll
 * executor; an entry whose previous poll has not returned is skipped for that tick, so polls of one entry never
 * overlap.
 */
@Slf4j
public class TransactionTracker {

    private static final int LAMPORTS_DECIMALS = 9;
    private static final String ID_PREFIX = "tx_";
    private static final TypeReference<List<TransactionEntry>> SNAPSHOT_TYPE = new TypeReference<>() {
    };

    private final Map<String, TransactionEntry> transactions = new ConcurrentHashMap<>();
    private final Map<String, PollState> armed = new ConcurrentHashMap<>();
    private final Set<TransactionListener> listeners = new CopyOnWriteArraySet<>();
    private final AtomicBoolean disposed = new AtomicBoolean();

    private final ConnectionManager connectionManager;
    private final SnapshotStore snapshotStore;
    private final ErrorReporter errorReporter;
    private final ObjectMapper objectMapper;
    private final Executor pollExecutor;
    private final Clock clock;
    private final TrackerProperties properties;

    public TransactionTracker(ConnectionManager connectionManager,
                              SnapshotStore snapshotStore,
                              ErrorReporter errorReporter,
                              ObjectMapper objectMapper,
                              Executor pollExecutor,
                              Clock clock,
                              TrackerProperties properties) {
        this.connectionManager = connectionManager;
        this.snapshotStore = snapshotStore;
        this.errorReporter = errorReporter;
        this.objectMapper = objectMapper;
        this.pollExecutor = pollExecutor;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Loads the persisted snapshot, if any. A missing or unreadable snapshot leaves the ledger empty.
     * Loaded PENDING entries are not armed; call {@link #retryPendingTransactions()} for that.
     */
    public void init() {
        Optional<byte[]> stored;
        try {
            stored = snapshotStore.get(properties.getStorageKey());
        } catch (RuntimeException e) {
            log.error("Failed to read transaction snapshot: {}", e.getMessage());
            errorReporter.report(e, ErrorKind.SYSTEM, ErrorSeverity.MEDIUM, Map.of("operation", "loadSnapshot"));
            return;
        }
        if (stored.isEmpty()) {
            log.info("No transaction snapshot found, starting empty");
            return;
        }
        List<TransactionEntry> entries;
        try {
            entries = objectMapper.readValue(stored.get(), SNAPSHOT_TYPE);
        } catch (IOException e) {
            log.error("Transaction snapshot is unreadable, starting empty: {}", e.getMessage());
            errorReporter.report(e, ErrorKind.SYSTEM, ErrorSeverity.MEDIUM, Map.of("operation", "loadSnapshot"));
            return;
        }
        int loaded = 0;
        int skipped = 0;
        for (TransactionEntry entry : entries) {
            if (isComplete(entry)) {
                transactions.put(entry.getId(), entry);
                loaded++;
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} incomplete snapshot entries (missing id, type, status or createdAt)", skipped);
        }
        log.info("Loaded {} transactions from snapshot ({} pending)", loaded, pendingCount());
    }

    private static boolean isComplete(TransactionEntry entry) {
        return entry != null && entry.getId() != null && entry.getType() != null
                && entry.getStatus() != null && entry.getCreatedAt() != null;
    }

    /**
     * Starts tracking a submitted signature. The returned entry is PENDING; its first poll runs on the next tick.
     *
     * @throws IllegalArgumentException when signature or from is blank, or the metadata does not fit the type
     * @throws TrackerDisposedException after {@link #dispose()}
     */
    public TransactionEntry addTransaction(String signature, TransactionType type, String from,
                                           TransactionMetadata metadata) {
        if (signature == null || signature.isBlank()) {
            throw new IllegalArgumentException("signature must not be blank");
        }
        if (from == null || from.isBlank()) {
            throw new IllegalArgumentException("from must not be blank");
        }
        TransactionType resolved = type != null ? type : TransactionType.UNKNOWN;
        if (metadata != null && !metadata.supports(resolved)) {
            throw new IllegalArgumentException(
                    metadata.getClass().getSimpleName() + " does not apply to " + resolved + " transactions");
        }
        if (disposed.get()) {
            throw new TrackerDisposedException();
        }
        TransactionEntry entry = TransactionEntry.pending(nextId(), signature, resolved, from, metadata, clock.instant());
        seed(entry, metadata);
        transactions.put(entry.getId(), entry);
        log.info("Tracking transaction: id={} signature={} type={}", entry.getId(), signature, resolved);
        notifyListeners(entry);
        armed.putIfAbsent(entry.getId(), new PollState());
        return entry.copy();
    }

    /**
     * One confirmation tick: dispatches a poll for every armed entry that has no poll in flight.
     *
     * @return number of polls dispatched
     */
    public int pollPending() {
        if (disposed.get()) {
            return 0;
        }
        int dispatched = 0;
        for (Map.Entry<String, PollState> e : armed.entrySet()) {
            String id = e.getKey();
            PollState state = e.getValue();
            if (!state.inFlight.compareAndSet(false, true)) {
                continue;
            }
            try {
                pollExecutor.execute(() -> {
                    try {
                        pollOnce(id, state);
                    } finally {
                        state.inFlight.set(false);
                    }
                });
                dispatched++;
            } catch (RejectedExecutionException ex) {
                state.inFlight.set(false);
                log.warn("Poll rejected by executor, retrying next tick: id={}", id);
            }
        }
        return dispatched;
    }

    void pollOnce(String id, PollState state) {
        TransactionEntry entry = transactions.get(id);
        if (entry == null || !entry.isPending()) {
            armed.remove(id, state);
            return;
        }
        int attempt = state.attempts.incrementAndGet();
        Optional<SignatureStatus> status;
        try {
            status = connectionManager.getConnection().getSignatureStatus(entry.getSignature());
        } catch (RuntimeException e) {
            if (!stillTracked(id, entry)) {
                return;
            }
            reportPollingError(entry, attempt, e);
            if (attempt >= properties.getMaxAttempts()) {
                expire(entry, state, attempt, e.getMessage());
            }
            return;
        }
        if (!stillTracked(id, entry)) {
            armed.remove(id, state);
            return;
        }
        if (status.isEmpty()) {
            if (attempt >= properties.getMaxAttempts()) {
                expire(entry, state, attempt, null);
            }
            return;
        }
        SignatureStatus s = status.get();
        int confirmations = s.confirmations() != null ? s.confirmations() : 0;
        if (s.failed()) {
            if (entry.fail(s.err(), confirmations)) {
                armed.remove(id, state);
                log.info("Transaction failed: id={} signature={} err={}", id, entry.getSignature(), s.err());
                notifyIfTracked(id, entry);
            }
            return;
        }
        long elapsedMs = Math.max(0L, Duration.between(entry.getCreatedAt(), clock.instant()).toMillis());
        if (entry.confirm(s.slot(), confirmations, elapsedMs)) {
            armed.remove(id, state);
            log.info("Transaction confirmed: id={} signature={} slot={} attempts={}",
                    id, entry.getSignature(), s.slot(), attempt);
            notifyIfTracked(id, entry);
            enrich(entry);
        }
    }

    private void expire(TransactionEntry entry, PollState state, int attempts, String lastError) {
        String message = "Transaction not confirmed after " + attempts + " attempts";
        if (lastError != null) {
            message += " (last error: " + lastError + ")";
        }
        if (!stillTracked(entry.getId(), entry)) {
            armed.remove(entry.getId(), state);
            return;
        }
        if (entry.expire(message)) {
            armed.remove(entry.getId(), state);
            log.warn("Transaction expired: id={} signature={} attempts={}", entry.getId(), entry.getSignature(), attempts);
            notifyIfTracked(entry.getId(), entry);
        }
    }

    /**
     * False once the entry was cleared from the ledger or the tracker was disposed while a poll was in flight.
     * Such a poll must not transition the entry or notify anyone.
     */
    private boolean stillTracked(String id, TransactionEntry entry) {
        return !disposed.get() && transactions.get(id) == entry;
    }

    private void notifyIfTracked(String id, TransactionEntry entry) {
        if (stillTracked(id, entry)) {
            notifyListeners(entry);
        }
    }

    /**
     * Fee, logs and, when the caller gave none, an amount estimated from the first account's balance change.
     * Failures only log; the entry stays CONFIRMED.
     */
    private void enrich(TransactionEntry entry) {
        try {
            Optional<TransactionDetail> detail = connectionManager.getConnection().getTransaction(entry.getSignature());
            if (detail.isEmpty()) {
                log.warn("Transaction detail not available yet: signature={}", entry.getSignature());
                return;
            }
            TransactionDetail d = detail.get();
            BigDecimal fee = d.fee() != null ? lamportsToSol(d.fee()) : null;
            BigDecimal amount = entry.getAmount() == null ? firstAccountDelta(d) : null;
            entry.enrich(fee, d.logMessages(), amount);
        } catch (RuntimeException e) {
            log.warn("Failed to fetch transaction details: signature={} err={}", entry.getSignature(), e.getMessage());
        }
    }

    private static BigDecimal firstAccountDelta(TransactionDetail d) {
        if (d.preBalances() == null || d.postBalances() == null
                || d.preBalances().isEmpty() || d.postBalances().isEmpty()) {
            return null;
        }
        Long pre = d.preBalances().get(0);
        Long post = d.postBalances().get(0);
        if (pre == null || post == null) {
            return null;
        }
        long delta = Math.abs(post - pre);
        return delta > 0 ? lamportsToSol(delta) : null;
    }

    private static BigDecimal lamportsToSol(long lamports) {
        return BigDecimal.valueOf(lamports).movePointLeft(LAMPORTS_DECIMALS);
    }

    private void reportPollingError(TransactionEntry entry, int attempt, RuntimeException e) {
        ErrorSeverity severity = entry.getType().isCritical() ? ErrorSeverity.HIGH : ErrorSeverity.MEDIUM;
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("transactionId", entry.getId());
        context.put("signature", entry.getSignature());
        context.put("attempts", attempt);
        errorReporter.report(e, ErrorKind.RPC, severity, context);
    }

    private static void seed(TransactionEntry entry, TransactionMetadata metadata) {
        if (metadata instanceof TransferMetadata t) {
            entry.describe(t.recipient(), t.token(), t.amount());
        } else if (metadata instanceof SwapMetadata s) {
            entry.describe(null, s.inputToken(), s.inputAmount());
        }
    }

    private String nextId() {
        String id;
        do {
            id = ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
        } while (transactions.containsKey(id));
        return id;
    }

    private void notifyListeners(TransactionEntry entry) {
        for (TransactionListener listener : listeners) {
            try {
                listener.onTransactionUpdate(entry.copy());
            } catch (RuntimeException e) {
                log.error("Transaction listener failed: id={} err={}", entry.getId(), e.getMessage(), e);
            }
        }
    }

    /**
     * @return handle that removes the listener; calling it twice is harmless
     */
    public Runnable addListener(TransactionListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public List<TransactionEntry> getHistory(TransactionFilter filter, SortOptions sort, Integer limit, Integer offset) {
        TransactionFilter f = filter != null ? filter : TransactionFilter.NONE;
        Comparator<TransactionEntry> order = (sort != null ? sort : SortOptions.DEFAULT).comparator();
        List<TransactionEntry> matching = transactions.values().stream()
                .map(TransactionEntry::copy)
                .filter(f::matches)
                .sorted(order)
                .toList();
        int from = offset != null ? Math.max(0, offset) : 0;
        if (from >= matching.size()) {
            return List.of();
        }
        int to = limit != null ? (int) Math.min(matching.size(), (long) from + Math.max(0, limit)) : matching.size();
        return new ArrayList<>(matching.subList(from, to));
    }

    public List<TransactionEntry> getHistory(TransactionFilter filter) {
        return getHistory(filter, null, null, null);
    }

    public Optional<TransactionEntry> getTransaction(String id) {
        return Optional.ofNullable(transactions.get(id)).map(TransactionEntry::copy);
    }

    public TransactionStats getStatistics(TransactionFilter filter) {
        long successful = 0;
        long failed = 0;
        long pending = 0;
        BigDecimal volume = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        long confirmationTotal = 0;
        long timedConfirmations = 0;
        Map<TransactionType, Long> byType = new EnumMap<>(TransactionType.class);
        for (TransactionType t : TransactionType.values()) {
            byType.put(t, 0L);
        }
        List<TransactionEntry> entries = getHistory(filter);
        for (TransactionEntry e : entries) {
            switch (e.getStatus()) {
                case CONFIRMED -> {
                    successful++;
                    if (e.getConfirmationTimeMs() != null) {
                        confirmationTotal += e.getConfirmationTimeMs();
                        timedConfirmations++;
                    }
                }
                case FAILED, EXPIRED -> failed++;
                case PENDING -> pending++;
            }
            byType.merge(e.getType(), 1L, Long::sum);
            if (e.getAmount() != null) {
                volume = volume.add(e.getAmount());
            }
            if (e.getFee() != null) {
                fees = fees.add(e.getFee());
            }
        }
        double average = timedConfirmations > 0 ? (double) confirmationTotal / timedConfirmations : 0d;
        return new TransactionStats(entries.size(), successful, failed, pending, volume, fees, average, byType);
    }

    public String exportToCSV(TransactionFilter filter) {
        return TransactionCsvWriter.write(getHistory(filter));
    }

    /**
     * Removes entries created before {@code olderThan}, or every entry when it is null, then persists.
     *
     * @return number of entries removed
     */
    public int clearHistory(Instant olderThan) {
        int removed = 0;
        for (TransactionEntry entry : transactions.values()) {
            if (olderThan == null || entry.getCreatedAt() == null || entry.getCreatedAt().isBefore(olderThan)) {
                if (transactions.remove(entry.getId(), entry)) {
                    armed.remove(entry.getId());
                    removed++;
                }
            }
        }
        log.info("Cleared {} transactions (olderThan={})", removed, olderThan);
        persist();
        return removed;
    }

    /**
     * Arms polling for every PENDING entry that is not armed yet. Entries already armed keep their attempt count.
     *
     * @return number of entries newly armed
     */
    public int retryPendingTransactions() {
        if (disposed.get()) {
            return 0;
        }
        int rearmed = 0;
        for (TransactionEntry entry : transactions.values()) {
            if (entry.isPending() && armed.putIfAbsent(entry.getId(), new PollState()) == null) {
                rearmed++;
            }
        }
        if (rearmed > 0) {
            log.info("Re-armed polling for {} pending transactions", rearmed);
        }
        return rearmed;
    }

    /**
     * Writes the newest {@code maxHistorySize} entries as one JSON array, replacing the previous snapshot.
     * A failed write is reported and retried on the next cycle.
     *
     * @return whether the snapshot was written
     */
    public synchronized boolean persist() {
        List<TransactionEntry> snapshot = transactions.values().stream()
                .map(TransactionEntry::copy)
                .sorted(SortOptions.DEFAULT.comparator())
                .limit(properties.getMaxHistorySize())
                .toList();
        try {
            snapshotStore.set(properties.getStorageKey(), objectMapper.writeValueAsBytes(snapshot));
            log.debug("Transaction snapshot saved: entries={}", snapshot.size());
            return true;
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to save transaction snapshot: {}", e.getMessage());
            errorReporter.report(e, ErrorKind.SYSTEM, ErrorSeverity.MEDIUM,
                    Map.of("operation", "saveSnapshot", "entries", snapshot.size()));
            return false;
        }
    }

    /**
     * Disarms every entry and writes a final snapshot. Later calls do nothing.
     */
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        int active = armed.size();
        armed.clear();
        persist();
        log.info("Transaction tracker disposed: disarmed={} total={}", active, transactions.size());
    }

    public long pendingCount() {
        return transactions.values().stream().filter(TransactionEntry::isPending).count();
    }

    public int activePollCount() {
        return armed.size();
    }

    public int size() {
        return transactions.size();
    }

    static final class PollState {
        final AtomicInteger attempts = new AtomicInteger();
        final AtomicBoolean inFlight = new AtomicBoolean();
    }
}
