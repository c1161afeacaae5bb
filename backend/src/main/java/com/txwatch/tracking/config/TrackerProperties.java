package com.txwatch.tracking.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Confirmation polling and snapshot settings.
 */
@ConfigurationProperties(prefix = "txwatch.tracker")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class TrackerProperties {

    /** Interval of the single confirmation tick. */
    @Min(1)
    private long pollIntervalMs = 2_000L;

    /** Polls per entry before it is marked EXPIRED. */
    @Min(1)
    private int maxAttempts = 30;

    @Min(1)
    private long persistIntervalMs = 30_000L;

    /** Newest entries kept in the persisted snapshot. */
    @Min(1)
    private int maxHistorySize = 10_000;

    @NotBlank
    private String storageKey = "transactionHistory";

    @Min(1)
    private int pollWorkers = 8;
}
