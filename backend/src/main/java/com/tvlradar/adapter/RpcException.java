package com.tvlradar.adapter;

/**
 * Thrown when a remote call fails: HTTP error, JSON-RPC envelope error, unparseable or incomplete response,
 * or a local rate-limit timeout.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
