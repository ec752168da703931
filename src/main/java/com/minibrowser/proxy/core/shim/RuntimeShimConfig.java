package com.minibrowser.proxy.core.shim;

import java.util.Objects;

/**
 * Values baked into the injected runtime for one page.
 *
 * @param proxyPrefix   The proxy mount prefix, ending with {@code /}.
 * @param originalUrl   The absolute URL of the page being served.
 * @param messagePrefix Prefix of every message type posted to the parent.
 */
public record RuntimeShimConfig(String proxyPrefix, String originalUrl, String messagePrefix) {

    /** Message type prefix understood by the host application. */
    public static final String DEFAULT_MESSAGE_PREFIX = "ENHANCED_BROWSER_";

    public RuntimeShimConfig {
        Objects.requireNonNull(proxyPrefix, "proxyPrefix");
        Objects.requireNonNull(originalUrl, "originalUrl");
        if (messagePrefix == null) {
            messagePrefix = DEFAULT_MESSAGE_PREFIX;
        }
    }

    public RuntimeShimConfig(String proxyPrefix, String originalUrl) {
        this(proxyPrefix, originalUrl, DEFAULT_MESSAGE_PREFIX);
    }
}
