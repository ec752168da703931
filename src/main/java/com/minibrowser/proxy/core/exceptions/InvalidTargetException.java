package com.minibrowser.proxy.core.exceptions;

/**
 * Thrown when the target carried in the proxy path is empty or is not an
 * absolute {@code http}/{@code https} URL. Mapped to {@code 400 Bad Request}.
 * <p>
 * The message is the client-facing error string ({@code "Missing URL"} or
 * {@code "Invalid URL"}).
 */
public class InvalidTargetException extends ProxyException {

    public static final String MISSING_URL = "Missing URL";
    public static final String INVALID_URL = "Invalid URL";

    public InvalidTargetException(String message) {
        super(message);
    }

    public InvalidTargetException(String message, Throwable cause) {
        super(message, cause);
    }
}
