package com.txwatch.tracking.job;

import com.txwatch.tracking.TransactionTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Re-arms polling for entries restored from the snapshot still PENDING.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PendingTransactionRecoveryJob {

    private final TransactionTracker transactionTracker;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int rearmed = transactionTracker.retryPendingTransactions();
        log.info("Pending transaction recovery: rearmed={}", rearmed);
    }
}
