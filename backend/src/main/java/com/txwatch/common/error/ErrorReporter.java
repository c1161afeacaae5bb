package com.txwatch.common.error;

import java.util.Map;

/**
 * Sink for failures that must stay observable without being thrown to a caller.
 */
public interface ErrorReporter {

    /**
     * Records the error. Implementations never throw.
     *
     * @param context free-form diagnostic values (operation, ids, attempt counts); may be empty
     */
    void report(Throwable error, ErrorKind kind, ErrorSeverity severity, Map<String, Object> context);
}
