package com.txwatch.tracking.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.txwatch.common.error.ErrorReporter;
import com.txwatch.config.AsyncConfig;
import com.txwatch.connection.ConnectionManager;
import com.txwatch.tracking.TransactionTracker;
import com.txwatch.tracking.store.SnapshotStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * The tracker loads its snapshot before any caller can reach it and writes a final one on shutdown.
 */
@Configuration
@EnableConfigurationProperties(TrackerProperties.class)
public class TrackerConfig {

    @Bean(initMethod = "init", destroyMethod = "dispose")
    public TransactionTracker transactionTracker(ConnectionManager connectionManager,
                                                 SnapshotStore snapshotStore,
                                                 ErrorReporter errorReporter,
                                                 ObjectMapper objectMapper,
                                                 @Qualifier(AsyncConfig.POLL_EXECUTOR) Executor pollExecutor,
                                                 Clock clock,
                                                 TrackerProperties properties) {
        return new TransactionTracker(connectionManager, snapshotStore, errorReporter, objectMapper,
                pollExecutor, clock, properties);
    }
}
