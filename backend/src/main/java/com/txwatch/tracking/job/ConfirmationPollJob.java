package com.txwatch.tracking.job;

import com.txwatch.tracking.TransactionTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Confirmation tick. Every armed transaction gets at most one poll per tick.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfirmationPollJob {

    private final TransactionTracker transactionTracker;

    @Scheduled(
            fixedRateString = "${txwatch.tracker.poll-interval-ms:2000}",
            initialDelayString = "${txwatch.tracker.poll-interval-ms:2000}")
    public void runScheduled() {
        int dispatched = transactionTracker.pollPending();
        if (dispatched > 0) {
            log.debug("Confirmation tick dispatched {} polls", dispatched);
        }
    }
}
