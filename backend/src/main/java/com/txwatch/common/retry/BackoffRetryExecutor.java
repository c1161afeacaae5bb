package com.txwatch.common.retry;

import com.txwatch.common.RetryPolicy;
import com.txwatch.common.error.ErrorKind;
import com.txwatch.common.error.ErrorReporter;
import com.txwatch.common.error.ErrorSeverity;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Blocking retry loop: sleeps {@link RetryPolicy#delayMs(int)} between attempts, reports the final
 * failure with severity HIGH and throws {@link RetryExhaustedException}.
 */
@Slf4j
public class BackoffRetryExecutor implements RetryExecutor {

    private final ErrorReporter errorReporter;
    private final Predicate<Throwable> retryable;

    public BackoffRetryExecutor(ErrorReporter errorReporter) {
        this(errorReporter, e -> true);
    }

    public BackoffRetryExecutor(ErrorReporter errorReporter, Predicate<Throwable> retryable) {
        this.errorReporter = errorReporter;
        this.retryable = retryable;
    }

    @Override
    public <T> T run(Callable<T> call, RetryPolicy policy, ErrorKind kind, Map<String, Object> context) {
        Exception lastException = null;
        int attempts = 0;
        for (int attempt = 0; attempt < policy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                long delay = policy.delayMs(attempt - 1);
                log.debug("Retrying call (attempt {}/{}) after {}ms context={}",
                        attempt + 1, policy.getMaxAttempts(), delay, context);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException("Interrupted during retry", attempts, e);
                }
            }
            attempts++;
            try {
                return call.call();
            } catch (Exception e) {
                lastException = e;
                if (!retryable.test(e)) {
                    break;
                }
            }
        }
        Map<String, Object> ctx = new LinkedHashMap<>();
        if (context != null) {
            ctx.putAll(context);
        }
        ctx.put("totalAttempts", attempts);
        errorReporter.report(lastException, kind, ErrorSeverity.HIGH, ctx);
        String reason = lastException != null ? lastException.getMessage() : "unknown";
        throw new RetryExhaustedException("Call failed after " + attempts + " attempts: " + reason, attempts, lastException);
    }
}
