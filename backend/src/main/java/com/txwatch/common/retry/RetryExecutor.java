package com.txwatch.common.retry;

import com.txwatch.common.RetryPolicy;
import com.txwatch.common.error.ErrorKind;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Runs a call with bounded retries.
 */
public interface RetryExecutor {

    /**
     * Invokes {@code call} until it succeeds or {@code policy.getMaxAttempts()} attempts have failed.
     *
     * @throws RetryExhaustedException when every attempt failed; the cause is the last failure
     */
    <T> T run(Callable<T> call, RetryPolicy policy, ErrorKind kind, Map<String, Object> context);
}
