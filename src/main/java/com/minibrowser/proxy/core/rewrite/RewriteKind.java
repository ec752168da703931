package com.minibrowser.proxy.core.rewrite;

import java.util.Locale;

/**
 * The three ways a response body can be handled.
 */
public enum RewriteKind {
    /** HTML rewrite plus shim injection. */
    HTML,
    /** CSS {@code url()} and {@code @import} rewrite. */
    CSS,
    /** Bytes are forwarded unchanged. */
    PASSTHROUGH;

    /**
     * Picks the path for a (corrected) content type.
     *
     * @param contentType The content type, possibly null.
     * @return {@link #HTML} for {@code text/html}, {@link #CSS} for
     *         {@code text/css}, otherwise {@link #PASSTHROUGH}.
     */
    public static RewriteKind forContentType(String contentType) {
        if (contentType == null) {
            return PASSTHROUGH;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        if (lower.contains("text/html")) {
            return HTML;
        }
        if (lower.contains("text/css")) {
            return CSS;
        }
        return PASSTHROUGH;
    }

    /**
     * @return Lower-case name used in logs and metric tags.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
