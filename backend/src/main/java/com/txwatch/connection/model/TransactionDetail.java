package com.txwatch.connection.model;

import java.util.List;

/**
 * Subset of getTransaction used to enrich confirmed entries. Balances are lamports per account index.
 */
public record TransactionDetail(
        long slot,
        Long blockTime,
        Long fee,
        List<Long> preBalances,
        List<Long> postBalances,
        List<String> logMessages
) {
}
