package com.txwatch.connection;

/**
 * The liveness probe against the RPC endpoint failed. Handled inside {@link ConnectionManager}; never thrown to callers.
 */
public class ConnectionUnavailableException extends RpcException {

    public ConnectionUnavailableException(String message) {
        super(message);
    }

    public ConnectionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
