package com.minibrowser.proxy.core.exceptions;

/**
 * Thrown when the outbound request to the origin fails at the network level
 * (connection refused, DNS failure, timeout, broken body stream).
 * <p>
 * A non-2xx status from the origin is not a failure and never produces this
 * exception.
 */
public class UpstreamFetchException extends ProxyException {
    /**
     * Constructs a new UpstreamFetchException.
     * 
     * @param message the detail message.
     * @param cause   the underlying I/O failure.
     */
    public UpstreamFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
