package com.minibrowser.proxy.core.proxy.impl.embed.filters;

import java.io.IOException;
import java.io.OutputStream;

import com.minibrowser.proxy.core.constants.HeaderConstants;
import com.minibrowser.proxy.core.proxy.impl.embed.CorsPolicy;
import com.minibrowser.proxy.core.proxy.impl.embed.ProxyResponse;

/**
 * Answers CORS preflight requests directly with {@code 204 No Content}.
 * The target is never contacted.
 */
public class CorsPreflightFilter implements HttpFilter {

    @Override
    public boolean preHandle(RequestContext context, OutputStream clientOut) throws IOException {
        if (!"OPTIONS".equalsIgnoreCase(context.getMethod())) {
            return true;
        }
        String origin = context.getHeader(HeaderConstants.ORIGIN.getValue());
        ProxyResponse response = ProxyResponse.empty(204, CorsPolicy.preflightHeaders(origin));
        response.writeTo(clientOut, context.isKeepAlive(), null);
        context.setStatus(204);
        return false;
    }
}
