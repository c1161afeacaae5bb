package com.txwatch.api.controller;

import com.txwatch.api.dto.AddTransactionRequest;
import com.txwatch.api.dto.ClearHistoryResponse;
import com.txwatch.api.dto.ErrorBody;
import com.txwatch.api.dto.RetryPendingResponse;
import com.txwatch.domain.TransactionEntry;
import com.txwatch.domain.TransactionStatus;
import com.txwatch.domain.TransactionType;
import com.txwatch.tracking.SortBy;
import com.txwatch.tracking.SortOptions;
import com.txwatch.tracking.TransactionFilter;
import com.txwatch.tracking.TransactionStats;
import com.txwatch.tracking.TransactionTracker;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Transaction tracking API. Reads are served from the in-memory ledger; clearing writes a snapshot and runs off
 * the event loop.
 */
@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
public class TransactionController {

    static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final TransactionTracker transactionTracker;

    @PostMapping
    public ResponseEntity<TransactionEntry> addTransaction(@RequestBody @Valid AddTransactionRequest request) {
        TransactionEntry entry = transactionTracker.addTransaction(
                request.signature().trim(), request.type(), request.from().trim(), request.metadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @GetMapping
    public ResponseEntity<List<TransactionEntry>> getHistory(
            @RequestParam(required = false) List<TransactionType> type,
            @RequestParam(required = false) List<TransactionStatus> status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(required = false) String address,
            @RequestParam(required = false) BigDecimal minAmount,
            @RequestParam(required = false) BigDecimal maxAmount,
            @RequestParam(required = false, defaultValue = "TIMESTAMP") SortBy sortBy,
            @RequestParam(required = false, defaultValue = "false") boolean ascending,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset
    ) {
        TransactionFilter filter = filter(type, status, startDate, endDate, address, minAmount, maxAmount);
        return ResponseEntity.ok(transactionTracker.getHistory(filter, new SortOptions(sortBy, ascending), limit, offset));
    }

    @GetMapping("/stats")
    public ResponseEntity<TransactionStats> getStatistics(
            @RequestParam(required = false) List<TransactionType> type,
            @RequestParam(required = false) List<TransactionStatus> status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(required = false) String address,
            @RequestParam(required = false) BigDecimal minAmount,
            @RequestParam(required = false) BigDecimal maxAmount
    ) {
        TransactionFilter filter = filter(type, status, startDate, endDate, address, minAmount, maxAmount);
        return ResponseEntity.ok(transactionTracker.getStatistics(filter));
    }

    @GetMapping("/export")
    public ResponseEntity<String> exportToCsv(
            @RequestParam(required = false) List<TransactionType> type,
            @RequestParam(required = false) List<TransactionStatus> status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(required = false) String address,
            @RequestParam(required = false) BigDecimal minAmount,
            @RequestParam(required = false) BigDecimal maxAmount
    ) {
        TransactionFilter filter = filter(type, status, startDate, endDate, address, minAmount, maxAmount);
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header("Content-Disposition", "attachment; filename=\"transactions.csv\"")
                .body(transactionTracker.exportToCSV(filter));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getTransaction(@PathVariable String id) {
        return transactionTracker.getTransaction(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of("NOT_FOUND", "Transaction not found: " + id)));
    }

    @DeleteMapping
    public Mono<ClearHistoryResponse> clearHistory(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant olderThan) {
        return Mono.fromCallable(() -> new ClearHistoryResponse(transactionTracker.clearHistory(olderThan)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/retry-pending")
    public ResponseEntity<RetryPendingResponse> retryPending() {
        int rearmed = transactionTracker.retryPendingTransactions();
        return ResponseEntity.ok(new RetryPendingResponse(rearmed, transactionTracker.pendingCount()));
    }

    private static TransactionFilter filter(List<TransactionType> types, List<TransactionStatus> statuses,
                                            Instant startDate, Instant endDate, String address,
                                            BigDecimal minAmount, BigDecimal maxAmount) {
        return new TransactionFilter(
                types != null ? Set.copyOf(types) : null,
                statuses != null ? Set.copyOf(statuses) : null,
                startDate,
                endDate,
                address != null && !address.isBlank() ? address.trim() : null,
                minAmount,
                maxAmount);
    }
}
