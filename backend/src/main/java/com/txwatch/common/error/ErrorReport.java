package com.txwatch.common.error;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view over reported errors since startup; recent lists are bounded by the log capacity.
 */
public record ErrorReport(
        long totalErrors,
        Map<ErrorKind, Long> errorsByKind,
        Map<ErrorSeverity, Long> errorsBySeverity,
        List<RecordedError> recentErrors,
        List<RecordedError> criticalErrors,
        List<MessageCount> mostCommonErrors
) {

    public record MessageCount(String message, long count) {
    }
}
