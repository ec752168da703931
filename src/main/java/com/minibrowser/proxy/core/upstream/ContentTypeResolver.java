package com.minibrowser.proxy.core.upstream;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Corrects missing or generic content types reported by origins that serve
 * stylesheets and scripts from dynamic endpoints.
 */
public final class ContentTypeResolver {

    public static final String HTML = "text/html; charset=utf-8";
    public static final String CSS = "text/css; charset=utf-8";
    public static final String JAVASCRIPT = "application/javascript; charset=utf-8";
    public static final String OCTET_STREAM = "application/octet-stream";

    /** Query parameter some origins use to request styles-only or scripts-only bundles. */
    static final String ONLY_PARAM = "only";

    private ContentTypeResolver() {
        // Utility class
    }

    /**
     * Applies the correction rules in order:
     * <ol>
     * <li>{@code only=styles} selects CSS unless the type already is CSS;</li>
     * <li>{@code only=scripts} selects JavaScript unless the type already is
     * JavaScript;</li>
     * <li>a still empty or {@code application/octet-stream} type is decided by a
     * {@code .css} or {@code .js} path extension.</li>
     * </ol>
     *
     * @param contentType The upstream content type, possibly null.
     * @param target      The requested URL.
     * @return The corrected content type; empty when unknown.
     */
    public static String correct(String contentType, URI target) {
        String result = contentType == null ? "" : contentType.trim();
        String lower = result.toLowerCase(Locale.ROOT);

        String only = firstQueryValue(target.getRawQuery(), ONLY_PARAM);
        if ("styles".equals(only) && !lower.contains("text/css")) {
            result = CSS;
        } else if ("scripts".equals(only) && !lower.contains("application/javascript")
                && !lower.contains("text/javascript")) {
            result = JAVASCRIPT;
        }

        if (result.isEmpty() || OCTET_STREAM.equalsIgnoreCase(result)) {
            String path = target.getPath() == null ? "" : target.getPath().toLowerCase(Locale.ROOT);
            if (path.endsWith(".css")) {
                result = CSS;
            } else if (path.endsWith(".js")) {
                result = JAVASCRIPT;
            }
        }
        return result;
    }

    /**
     * Returns the first value of a query parameter, decoded with form rules.
     *
     * @param rawQuery The raw query string, possibly null.
     * @param name     The parameter name.
     * @return The value, or null if absent or undecodable.
     */
    static String firstQueryValue(String rawQuery, String name) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return null;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            try {
                if (name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
                    return URLDecoder.decode(value, StandardCharsets.UTF_8);
                }
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
        return null;
    }
}
