package com.minibrowser.proxy.core.proxy.impl.embed.filters;

import java.util.Collections;
import java.util.Map;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Context for a single inbound request passing through the filter chain.
 */
public class RequestContext {
    private final String method;
    private final String requestTarget;
    private final Map<String, String> headers;
    private final String remoteAddr;
    private final boolean keepAlive;
    private int status;
    private long bytes;
    private String rewrite;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public RequestContext(String method, String requestTarget, Map<String, String> headers, String remoteAddr,
            boolean keepAlive) {
        this.method = method;
        this.requestTarget = requestTarget;
        this.headers = headers;
        this.remoteAddr = remoteAddr;
        this.keepAlive = keepAlive;
    }

    public String getMethod() {
        return method;
    }

    /**
     * @return The request target exactly as it appeared in the request line.
     */
    public String getRequestTarget() {
        return requestTarget;
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    public String getRemoteAddr() {
        return remoteAddr;
    }

    /**
     * @return Whether the connection stays open after this exchange.
     */
    public boolean isKeepAlive() {
        return keepAlive;
    }

    public int getStatus() {
        return status;
    }

    public void setStatus(int status) {
        this.status = status;
    }

    public long getBytes() {
        return bytes;
    }

    public void setBytes(long bytes) {
        this.bytes = bytes;
    }

    /**
     * @return The rewrite path taken for the response, or null.
     */
    public String getRewrite() {
        return rewrite;
    }

    public void setRewrite(String rewrite) {
        this.rewrite = rewrite;
    }
}
