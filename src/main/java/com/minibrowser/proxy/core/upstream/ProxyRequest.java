package com.minibrowser.proxy.core.upstream;

import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A decoded inbound request: what the caller asked for and where it goes.
 */
public class ProxyRequest {
    private final String method;
    private final URI target;
    private final Map<String, String> headers;
    private final byte[] body;

    /**
     * Creates a request.
     *
     * @param method  The HTTP method.
     * @param target  The absolute http(s) target URL.
     * @param headers Inbound headers; copied into a case-insensitive map.
     * @param body    The inbound body, or null.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ProxyRequest(String method, URI target, Map<String, String> headers, byte[] body) {
        this.method = method;
        this.target = target;
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body == null ? new byte[0] : body;
    }

    public String getMethod() {
        return method;
    }

    public URI getTarget() {
        return target;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public byte[] getBody() {
        return body;
    }

    public boolean isHead() {
        return "HEAD".equalsIgnoreCase(method);
    }

    /**
     * @return true for methods whose body is forwarded.
     */
    public boolean hasBodySemantics() {
        return !"GET".equalsIgnoreCase(method) && !isHead();
    }
}
