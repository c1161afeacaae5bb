package com.txwatch.common.error;

import java.time.Instant;
import java.util.Map;

/**
 * One reported error as kept in the recent-error log.
 */
public record RecordedError(
        String id,
        ErrorKind kind,
        ErrorSeverity severity,
        String message,
        String exceptionType,
        Map<String, Object> context,
        Instant timestamp
) {
}
