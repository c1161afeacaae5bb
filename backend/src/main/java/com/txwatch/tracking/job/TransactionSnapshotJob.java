package com.txwatch.tracking.job;

import com.txwatch.tracking.TransactionTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic full snapshot of the transaction ledger.
 */
@Component
@RequiredArgsConstructor
public class TransactionSnapshotJob {

    private final TransactionTracker transactionTracker;

    @Scheduled(
            fixedDelayString = "${txwatch.tracker.persist-interval-ms:30000}",
            initialDelayString = "${txwatch.tracker.persist-interval-ms:30000}")
    public void runScheduled() {
        transactionTracker.persist();
    }
}
