package com.minibrowser.proxy.core.codec;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import com.minibrowser.proxy.core.exceptions.InvalidTargetException;

/**
 * Encodes absolute target URLs into proxy paths and decodes them back.
 * <p>
 * Encoding follows JavaScript's {@code encodeURIComponent} byte for byte so
 * that URLs produced on the server and by the injected shim are identical.
 * For every absolute {@code http(s)} URL {@code u},
 * {@code decodePath(encode(u))} yields {@code u}.
 */
public class UrlCodec {

    /** Default mount point of the proxy. */
    public static final String DEFAULT_PREFIX = "/proxy/";

    private static final Pattern HTTP_URL = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENTITY_AMP = Pattern.compile("&amp;", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENTITY_LT = Pattern.compile("&lt;", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENTITY_GT = Pattern.compile("&gt;", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENTITY_QUOT = Pattern.compile("&quot;", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENTITY_APOS = Pattern.compile("&#39;");

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    /** Characters {@code encodeURIComponent} leaves alone besides ASCII letters and digits. */
    private static final String COMPONENT_SAFE = "-_.!~*'()";

    /** Characters allowed verbatim when repairing a URL that {@link URI} rejects. */
    private static final String URI_SAFE = COMPONENT_SAFE + ";/?:@&=+$,#[]%";

    private final String prefix;

    /**
     * Creates a codec for the given mount point.
     *
     * @param prefix Path prefix such as {@code /proxy/}. A leading and trailing
     *               slash are added when missing.
     */
    public UrlCodec(String prefix) {
        this.prefix = normalizePrefix(prefix);
    }

    public UrlCodec() {
        this(DEFAULT_PREFIX);
    }

    /**
     * Normalizes a configured prefix so it starts and ends with {@code /}.
     *
     * @param prefix The raw prefix.
     * @return The normalized prefix.
     */
    public static String normalizePrefix(String prefix) {
        String p = prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix.trim();
        if (!p.startsWith("/")) {
            p = "/" + p;
        }
        if (!p.endsWith("/")) {
            p = p + "/";
        }
        return p;
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Checks whether a request path is mounted under this codec's prefix.
     *
     * @param path The raw request path (no query).
     * @return True if the path belongs to the proxy.
     */
    public boolean isProxyPath(String path) {
        return path != null && (path.startsWith(prefix) || path.equals(prefix.substring(0, prefix.length() - 1)));
    }

    /**
     * Produces the proxy-relative path for an absolute URL.
     *
     * @param absoluteUrl The absolute target URL.
     * @return {@code <prefix><encodeURIComponent(absoluteUrl)>}.
     */
    public String encode(String absoluteUrl) {
        return prefix + encodeUriComponent(absoluteUrl);
    }

    /**
     * Decodes the part of a raw request path that follows the prefix.
     *
     * @param rawPath The raw (still percent-encoded) request path, prefix
     *                included.
     * @return The validated absolute target.
     * @throws InvalidTargetException if the path carries no target or the target
     *                                is not an absolute http(s) URL.
     */
    public URI decodePath(String rawPath) {
        String rest = rawPath.length() > prefix.length() ? rawPath.substring(prefix.length()) : "";
        if (rest.isEmpty()) {
            throw new InvalidTargetException(InvalidTargetException.MISSING_URL);
        }
        return decode(Arrays.asList(rest.split("/", -1)));
    }

    /**
     * Joins path segments with {@code /}, percent-decodes the result, decodes
     * HTML entities and validates that the target is an absolute http(s) URL.
     *
     * @param pathSegments Raw path segments following the prefix.
     * @return The validated absolute target.
     * @throws InvalidTargetException if the target is missing or invalid.
     */
    public URI decode(List<String> pathSegments) {
        String joined = pathSegments == null ? "" : String.join("/", pathSegments);
        if (joined.isEmpty()) {
            throw new InvalidTargetException(InvalidTargetException.MISSING_URL);
        }
        String target;
        try {
            target = decodeHtmlEntities(decodeUriComponent(joined));
        } catch (IllegalArgumentException e) {
            throw new InvalidTargetException(InvalidTargetException.INVALID_URL, e);
        }
        if (!isHttpUrl(target)) {
            throw new InvalidTargetException(InvalidTargetException.INVALID_URL);
        }
        // registry-based authorities (e.g. underscores in the host) are accepted
        URI uri = parseLenient(target);
        if (uri == null) {
            throw new InvalidTargetException(InvalidTargetException.INVALID_URL);
        }
        return uri;
    }

    /**
     * Extracts the host of a URL, including hosts {@link URI} only accepts as a
     * registry-based authority.
     *
     * @param uri The URL.
     * @return The host without user info or port, or null if the URL has no
     *         authority.
     */
    public static String hostOf(URI uri) {
        if (uri.getHost() != null) {
            return uri.getHost();
        }
        String authority = uri.getAuthority();
        if (authority == null || authority.isEmpty()) {
            return null;
        }
        String host = authority.substring(authority.lastIndexOf('@') + 1);
        if (host.startsWith("[")) {
            int end = host.indexOf(']');
            return end > 0 ? host.substring(0, end + 1) : host;
        }
        int colon = host.lastIndexOf(':');
        if (colon >= 0) {
            host = host.substring(0, colon);
        }
        return host.isEmpty() ? null : host;
    }

    /**
     * Extracts the port of a URL, including registry-based authorities.
     *
     * @param uri The URL.
     * @return The explicit port, or -1 when none is given.
     */
    public static int portOf(URI uri) {
        if (uri.getHost() != null || uri.getAuthority() == null) {
            return uri.getPort();
        }
        String authority = uri.getAuthority();
        int colon = authority.lastIndexOf(':');
        if (colon < 0 || colon < authority.lastIndexOf(']')) {
            return -1;
        }
        try {
            return Integer.parseInt(authority.substring(colon + 1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * Checks whether a value starts with {@code http://} or {@code https://}
     * (case-insensitive).
     *
     * @param value The value to test.
     * @return True for absolute http(s) URLs.
     */
    public static boolean isHttpUrl(String value) {
        return value != null && HTTP_URL.matcher(value).find();
    }

    /**
     * Replaces the five HTML entities that commonly appear in attribute values
     * ({@code &amp; &lt; &gt; &quot; &#39;}).
     *
     * @param value The possibly escaped value.
     * @return The unescaped value, or the input when it is null.
     */
    public static String decodeHtmlEntities(String value) {
        if (value == null || value.indexOf('&') < 0) {
            return value;
        }
        String s = ENTITY_AMP.matcher(value).replaceAll("&");
        s = ENTITY_LT.matcher(s).replaceAll("<");
        s = ENTITY_GT.matcher(s).replaceAll(">");
        s = ENTITY_QUOT.matcher(s).replaceAll("\"");
        return ENTITY_APOS.matcher(s).replaceAll("'");
    }

    /**
     * Equivalent of JavaScript's {@code encodeURIComponent}.
     *
     * @param value The value to encode.
     * @return The percent-encoded value.
     */
    public static String encodeUriComponent(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (isAlphaNumeric(c) || COMPONENT_SAFE.indexOf(c) >= 0) {
                sb.append((char) c);
            } else {
                appendEscaped(sb, c);
            }
        }
        return sb.toString();
    }

    /**
     * Equivalent of JavaScript's {@code decodeURIComponent}: {@code +} is kept
     * literally and malformed escapes or invalid UTF-8 are rejected.
     *
     * @param value The percent-encoded value.
     * @return The decoded value.
     * @throws IllegalArgumentException on a malformed escape sequence.
     */
    public static String decodeUriComponent(String value) {
        if (value.indexOf('%') < 0) {
            return value;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '%') {
                if (i + 2 >= value.length()) {
                    throw new IllegalArgumentException("Truncated escape sequence at index " + i);
                }
                int hi = Character.digit(value.charAt(i + 1), 16);
                int lo = Character.digit(value.charAt(i + 2), 16);
                if (hi < 0 || lo < 0) {
                    throw new IllegalArgumentException("Malformed escape sequence at index " + i);
                }
                out.write((hi << 4) | lo);
                i += 3;
            } else {
                byte[] chunk = String.valueOf(c).getBytes(StandardCharsets.UTF_8);
                if (Character.isHighSurrogate(c) && i + 1 < value.length()) {
                    chunk = value.substring(i, i + 2).getBytes(StandardCharsets.UTF_8);
                    i++;
                }
                out.write(chunk, 0, chunk.length);
                i++;
            }
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(out.toByteArray()))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Escape sequence is not valid UTF-8", e);
        }
    }

    /**
     * Parses a URL the way a browser would accept it: characters that
     * {@link URI} rejects (spaces, non-ASCII, braces, stray {@code %}) are
     * percent-encoded first.
     *
     * @param value The URL text.
     * @return The parsed URI, or null if it still cannot be parsed.
     */
    public static URI parseLenient(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        try {
            return new URI(trimmed);
        } catch (URISyntaxException e) {
            try {
                return new URI(escapeIllegal(trimmed));
            } catch (URISyntaxException again) {
                return null;
            }
        }
    }

    private static String escapeIllegal(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length + 16);
        for (int i = 0; i < bytes.length; i++) {
            int c = bytes[i] & 0xFF;
            if (c == '%' && !isEscapeAt(bytes, i)) {
                appendEscaped(sb, c);
            } else if (isAlphaNumeric(c) || URI_SAFE.indexOf(c) >= 0) {
                sb.append((char) c);
            } else {
                appendEscaped(sb, c);
            }
        }
        return sb.toString();
    }

    private static boolean isEscapeAt(byte[] bytes, int i) {
        return i + 2 < bytes.length
                && Character.digit(bytes[i + 1], 16) >= 0
                && Character.digit(bytes[i + 2], 16) >= 0;
    }

    private static boolean isAlphaNumeric(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }

    private static void appendEscaped(StringBuilder sb, int c) {
        sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
    }
}
