package com.minibrowser.proxy.core.proxy.impl.embed.filters;

import java.io.IOException;
import java.io.OutputStream;

import com.minibrowser.proxy.core.exceptions.ProxyException;

/**
 * Filter for intercepting inbound requests before they are proxied and for
 * observing the outcome afterwards.
 */
public interface HttpFilter {
    /**
     * Called before the target is decoded and fetched.
     *
     * @return true to continue to next filter, false when the filter answered
     *         the request itself (it must then set the context status).
     */
    boolean preHandle(RequestContext context, OutputStream clientOut) throws IOException, ProxyException;

    /**
     * Called once the response has been written to the client.
     */
    default void postHandle(RequestContext context, int statusCode) {
    }
}
