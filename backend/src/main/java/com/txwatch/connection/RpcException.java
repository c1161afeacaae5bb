package com.txwatch.connection;

/**
 * Thrown when an RPC call fails (HTTP, timeout or JSON-RPC error).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
