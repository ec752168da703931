package com.minibrowser.proxy.core.proxy.impl.embed;

import java.util.ArrayList;
import java.util.List;

/**
 * CORS headers attached to every proxied response. The caller's origin is
 * reflected so that credentialed requests from the host page are accepted.
 */
public final class CorsPolicy {

    static final String ALLOW_METHODS = "GET,POST,PUT,PATCH,DELETE,OPTIONS,HEAD";
    static final String ALLOW_HEADERS = "Authorization,Content-Type,Accept,Origin,Referer,User-Agent,"
            + "X-Requested-With,Cache-Control,Pragma,Accept-Encoding,Accept-Language";
    static final String EXPOSE_HEADERS = "Content-Length,Content-Type,Date,Server,X-Powered-By";
    static final String VARY = "Origin,Accept-Encoding";
    static final String PREFLIGHT_MAX_AGE = "86400";

    private CorsPolicy() {
        // Utility class
    }

    /**
     * @param origin The inbound {@code Origin} header, or null.
     * @return The CORS headers for a regular response.
     */
    public static List<ProxyResponse.Header> headers(String origin) {
        List<ProxyResponse.Header> headers = new ArrayList<>(6);
        headers.add(new ProxyResponse.Header("Access-Control-Allow-Origin",
                origin != null && !origin.isBlank() ? origin : "*"));
        headers.add(new ProxyResponse.Header("Access-Control-Allow-Credentials", "true"));
        headers.add(new ProxyResponse.Header("Access-Control-Allow-Methods", ALLOW_METHODS));
        headers.add(new ProxyResponse.Header("Access-Control-Allow-Headers", ALLOW_HEADERS));
        headers.add(new ProxyResponse.Header("Access-Control-Expose-Headers", EXPOSE_HEADERS));
        headers.add(new ProxyResponse.Header("Vary", VARY));
        return headers;
    }

    /**
     * @param origin The inbound {@code Origin} header, or null.
     * @return The headers of a preflight answer.
     */
    public static List<ProxyResponse.Header> preflightHeaders(String origin) {
        List<ProxyResponse.Header> headers = headers(origin);
        headers.add(new ProxyResponse.Header("Access-Control-Max-Age", PREFLIGHT_MAX_AGE));
        return headers;
    }
}
