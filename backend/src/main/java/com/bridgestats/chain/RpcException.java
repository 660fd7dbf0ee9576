package com.bridgestats.chain;

/**
 * Thrown when a chain query fails (HTTP, JSON-RPC error, or no endpoint configured).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
