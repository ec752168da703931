package com.minibrowser.proxy.core.constants;

/**
 * Common HTTP header names used by the proxy.
 */
public enum HeaderConstants {
    /** The Standard HTTP Host header. */
    HOST("Host"),
    /** Header used for credentials from client to proxy. */
    PROXY_AUTHORIZATION("Proxy-Authorization"),
    /** Hop-by-hop Connection header. */
    CONNECTION("Connection"),
    /** Length of the entity body in bytes. */
    CONTENT_LENGTH("Content-Length"),
    /** Media type of the entity body. */
    CONTENT_TYPE("Content-Type"),
    /** Compression applied to the entity body. */
    CONTENT_ENCODING("Content-Encoding"),
    /** Type of encoding used to transfer the entity. */
    TRANSFER_ENCODING("Transfer-Encoding"),
    /** Used by the client to request a protocol change. */
    UPGRADE("Upgrade"),
    /** Redirect target. */
    LOCATION("Location"),
    /** Origin of a cross-origin request. */
    ORIGIN("Origin"),
    /** Address of the referring page. */
    REFERER("Referer"),
    /** Client software identification. */
    USER_AGENT("User-Agent"),
    /** Media types acceptable for the response. */
    ACCEPT("Accept"),
    /** Natural languages acceptable for the response. */
    ACCEPT_LANGUAGE("Accept-Language"),
    /** Content codings acceptable for the response. */
    ACCEPT_ENCODING("Accept-Encoding"),
    /** Cookies sent by the client. */
    COOKIE("Cookie"),
    /** MIME sniffing control, always set to {@code nosniff}. */
    X_CONTENT_TYPE_OPTIONS("X-Content-Type-Options"),
    /** Caching directives. */
    CACHE_CONTROL("Cache-Control"),
    /** Legacy caching directive. */
    PRAGMA("Pragma");

    private final String value;

    HeaderConstants(String value) {
        this.value = value;
    }

    /**
     * Retrieves the standard string value of the header.
     *
     * @return The standard string value of the header.
     */
    public String getValue() {
        return value;
    }
}
