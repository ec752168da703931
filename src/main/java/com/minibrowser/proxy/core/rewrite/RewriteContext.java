package com.minibrowser.proxy.core.rewrite;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.minibrowser.proxy.core.codec.UrlCodec;

/**
 * Per-request rewrite state: the base URL references resolve against (the
 * target's URL, never the proxy's own) and the codec that mounts them under
 * the proxy prefix.
 * <p>
 * Instances are immutable and may be shared by the HTML, CSS and srcset
 * rewriters of the same response.
 */
public final class RewriteContext {

    /** Values with these prefixes are never rewritten. */
    private static final List<String> EXCLUDED_PREFIXES = List.of("#", "mailto:", "tel:", "javascript:", "data:");

    private final URI baseUri;
    private final UrlCodec codec;

    /**
     * Creates a context.
     *
     * @param baseUri Absolute http(s) URL of the document being rewritten.
     * @param codec   Codec for the proxy prefix.
     */
    public RewriteContext(URI baseUri, UrlCodec codec) {
        this.baseUri = withRootPath(Objects.requireNonNull(baseUri, "baseUri"));
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Returns a context that resolves against another base, as set by a
     * document's {@code <base href>}.
     *
     * @param newBase Absolute http(s) URL.
     * @return The new context.
     */
    public RewriteContext withBaseUri(URI newBase) {
        return new RewriteContext(newBase, codec);
    }

    public URI getBaseUri() {
        return baseUri;
    }

    public String getPrefix() {
        return codec.getPrefix();
    }

    public UrlCodec getCodec() {
        return codec;
    }

    /**
     * Rewrites a single reference.
     * <p>
     * The value is left untouched when it is empty, a fragment, a
     * {@code mailto:}, {@code tel:}, {@code javascript:} or {@code data:} URI,
     * already mounted under the proxy prefix, malformed, or does not resolve
     * to an absolute http(s) URL.
     *
     * @param raw The raw attribute or CSS value, possibly entity-escaped.
     * @return The rewrite outcome.
     */
    public ProxiedReference rewrite(String raw) {
        if (raw == null) {
            return ProxiedReference.untouched(null);
        }
        String value = UrlCodec.decodeHtmlEntities(raw.strip());
        if (value.isEmpty() || isExcluded(value) || value.startsWith(codec.getPrefix())) {
            return ProxiedReference.untouched(raw);
        }
        URI absolute = resolve(value);
        if (absolute == null || !UrlCodec.isHttpUrl(absolute.toString())) {
            return ProxiedReference.untouched(raw);
        }
        String abs = absolute.toString();
        return new ProxiedReference(raw, abs, codec.encode(abs));
    }

    /**
     * Convenience for {@link #rewrite(String)} returning only the emitted value.
     *
     * @param raw The raw value.
     * @return The proxied URL or the input unchanged.
     */
    public String proxify(String raw) {
        return rewrite(raw).proxied();
    }

    /**
     * Checks the exclusion set (fragment, mailto, tel, javascript, data).
     *
     * @param value The decoded value.
     * @return True if the value must never be rewritten.
     */
    public static boolean isExcluded(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        for (String p : EXCLUDED_PREFIXES) {
            if (lower.startsWith(p)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resolves a reference against the base URL the way a browser's
     * {@code new URL(ref, base)} would.
     *
     * @param ref The decoded reference.
     * @return The absolute URI, or null if the reference is malformed.
     */
    URI resolve(String ref) {
        String value = ref;
        if (value.startsWith("//")) {
            value = baseUri.getScheme() + ":" + value;
        }
        URI parsed = UrlCodec.parseLenient(value);
        if (parsed == null) {
            return null;
        }
        try {
            if (parsed.isAbsolute()) {
                return parsed.isOpaque() ? parsed : withRootPath(parsed);
            }
            if (value.startsWith("?")) {
                // URI.resolve drops the last path segment for query-only references
                String fragment = parsed.getRawFragment() != null ? "#" + parsed.getRawFragment() : "";
                return new URI(baseUri.getScheme() + "://" + baseUri.getRawAuthority() + baseUri.getRawPath()
                        + "?" + parsed.getRawQuery() + fragment);
            }
            return withRootPath(stripLeadingDotSegments(baseUri.resolve(parsed)));
        } catch (IllegalArgumentException | URISyntaxException e) {
            return null;
        }
    }

    private static URI withRootPath(URI uri) {
        if (uri.isOpaque() || uri.getRawAuthority() == null) {
            return uri;
        }
        String path = uri.getRawPath();
        if (path != null && !path.isEmpty()) {
            return uri;
        }
        StringBuilder sb = new StringBuilder(uri.getScheme()).append("://").append(uri.getRawAuthority()).append('/');
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        if (uri.getRawFragment() != null) {
            sb.append('#').append(uri.getRawFragment());
        }
        return URI.create(sb.toString());
    }

    /**
     * Drops {@code /..} segments that climb above the root, which
     * {@link URI#resolve(URI)} keeps but browsers discard.
     */
    private static URI stripLeadingDotSegments(URI uri) {
        String path = uri.getRawPath();
        if (path == null || !path.startsWith("/..")) {
            return uri;
        }
        String cleaned = path;
        while (cleaned.startsWith("/../") || cleaned.equals("/..")) {
            cleaned = cleaned.length() > 3 ? cleaned.substring(3) : "/";
        }
        String s = uri.toString();
        int idx = s.indexOf(path, uri.getScheme().length() + 3);
        return URI.create(s.substring(0, idx) + cleaned + s.substring(idx + path.length()));
    }
}
