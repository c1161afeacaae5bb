package com.txwatch.tracking.job;

import com.txwatch.tracking.TransactionTracker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConfirmationPollJobTest {

    @Mock
    private TransactionTracker transactionTracker;

    @InjectMocks
    private ConfirmationPollJob job;

    @Test
    void runScheduled_runsOneTrackerTick() {
        when(transactionTracker.pollPending()).thenReturn(2);

        job.runScheduled();

        verify(transactionTracker).pollPending();
    }
}
