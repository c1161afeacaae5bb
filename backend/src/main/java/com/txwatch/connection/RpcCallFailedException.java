package com.txwatch.connection;

/**
 * A read operation failed on every attempt of its retry budget.
 */
public class RpcCallFailedException extends RpcException {

    private final String method;
    private final int attempts;

    public RpcCallFailedException(String method, int attempts, Throwable cause) {
        super("Failed to " + method + " after " + attempts + " attempts: "
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.method = method;
        this.attempts = attempts;
    }

    public String getMethod() {
        return method;
    }

    public int getAttempts() {
        return attempts;
    }
}
