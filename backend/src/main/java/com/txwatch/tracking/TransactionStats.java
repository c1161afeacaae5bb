package com.txwatch.tracking;

import com.txwatch.domain.TransactionType;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Aggregates over a filtered history. {@code failedTransactions} counts FAILED and EXPIRED entries;
 * {@code transactionsByType} lists every type, zero-filled.
 */
public record TransactionStats(
        long totalTransactions,
        long successfulTransactions,
        long failedTransactions,
        long pendingTransactions,
        BigDecimal totalVolume,
        BigDecimal totalFees,
        double averageConfirmationTimeMs,
        Map<TransactionType, Long> transactionsByType
) {
}
