package com.minibrowser.proxy.core.exceptions;

/**
 * Thrown when the target guard refuses to fetch a target that resolves to a
 * loopback, private, link-local or metadata address.
 */
public class TargetNotAllowedException extends ProxyException {
    public TargetNotAllowedException(String message) {
        super(message);
    }
}
