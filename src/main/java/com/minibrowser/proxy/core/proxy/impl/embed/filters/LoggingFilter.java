package com.minibrowser.proxy.core.proxy.impl.embed.filters;

import java.io.OutputStream;

import com.minibrowser.proxy.core.services.LoggingService;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Filter that writes one access log line per request.
 */
public class LoggingFilter implements HttpFilter {
    private final LoggingService loggingService;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public LoggingFilter(LoggingService loggingService) {
        this.loggingService = loggingService;
    }

    @Override
    public boolean preHandle(RequestContext context, OutputStream clientOut) {
        return true;
    }

    @Override
    public void postHandle(RequestContext context, int statusCode) {
        loggingService.logRequest(
                context.getRemoteAddr(),
                context.getMethod(),
                context.getRequestTarget(),
                statusCode,
                context.getBytes(),
                context.getRewrite());
    }
}
