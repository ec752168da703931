package com.minibrowser.proxy.core.proxy.impl.embed;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.minibrowser.proxy.config.ProxyServerConfig;
import com.minibrowser.proxy.core.codec.UrlCodec;
import com.minibrowser.proxy.core.constants.HeaderConstants;
import com.minibrowser.proxy.core.rewrite.CssRewriter;
import com.minibrowser.proxy.core.rewrite.HtmlRewriter;
import com.minibrowser.proxy.core.rewrite.RewriteContext;
import com.minibrowser.proxy.core.rewrite.RewriteKind;
import com.minibrowser.proxy.core.shim.RuntimeShimBuilder;
import com.minibrowser.proxy.core.upstream.ContentTypeResolver;
import com.minibrowser.proxy.core.upstream.UpstreamFetcher;
import com.minibrowser.proxy.core.upstream.UpstreamResponse;
import com.minibrowser.proxy.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an {@link UpstreamResponse} into the response sent to the embedding
 * page.
 * <p>
 * HTML and CSS bodies are decoded, rewritten and re-encoded as UTF-8; every
 * other body is streamed through unchanged. Headers that would stop the page
 * from being framed, or that would set cookies on the proxy's origin, are
 * never forwarded.
 */
public class ResponseAssembler {

    private static final Logger log = LoggerFactory.getLogger(ResponseAssembler.class);

    private static final Pattern CHARSET = Pattern.compile("charset\\s*=\\s*[\"']?([^;\"'\\s]+)",
            Pattern.CASE_INSENSITIVE);

    static final String NOSNIFF = "nosniff";

    /** Upstream headers copied onto passthrough responses. */
    private static final Set<String> PASSTHROUGH_HEADERS;

    static {
        Set<String> passthrough = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        passthrough.addAll(List.of(
                HeaderConstants.CACHE_CONTROL.getValue(),
                "ETag",
                "Last-Modified",
                "Expires",
                "Content-Disposition",
                "Content-Language",
                "Accept-Ranges",
                "Content-Range",
                HeaderConstants.CONTENT_ENCODING.getValue()));
        PASSTHROUGH_HEADERS = Collections.unmodifiableSet(passthrough);
    }

    private final ProxyServerConfig config;
    private final UrlCodec codec;
    private final RuntimeShimBuilder shimBuilder;

    /**
     * @param config      The listener configuration.
     * @param codec       The codec for the listener's prefix.
     * @param shimBuilder Builder for the script injected into HTML.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ResponseAssembler(ProxyServerConfig config, UrlCodec codec, RuntimeShimBuilder shimBuilder) {
        this.config = config;
        this.codec = codec;
        this.shimBuilder = shimBuilder;
    }

    /**
     * Builds the outgoing response. A streaming response keeps reading from
     * the upstream body, so the upstream must stay open until it is written.
     *
     * @param upstream The upstream response.
     * @param origin   The inbound {@code Origin} header, or null.
     * @param head     Whether the inbound request was a HEAD request.
     * @return The response, tagged with the rewrite path taken.
     * @throws IOException If the upstream body cannot be read.
     */
    public ProxyResponse assemble(UpstreamResponse upstream, String origin, boolean head) throws IOException {
        RewriteKind kind = RewriteKind.forContentType(upstream.getContentType());
        if (kind == RewriteKind.PASSTHROUGH) {
            return passthrough(upstream, origin, head);
        }

        List<ProxyResponse.Header> headers = baseHeaders(kind == RewriteKind.HTML
                ? ContentTypeResolver.HTML
                : ContentTypeResolver.CSS, upstream, origin);
        if (head) {
            return ProxyResponse.empty(upstream.getStatusCode(), headers).withRewriteKind(kind);
        }

        InputStream decoded = IoUtils.decodeContent(upstream.getBody(), upstream.getContentEncoding());
        if (decoded == null) {
            log.debug("Cannot decode content coding {} of {}, passing through", upstream.getContentEncoding(),
                    upstream.getFinalUri());
            return passthrough(upstream, origin, false);
        }

        long limit = config.getMaxRewriteBodySize();
        byte[] bytes = IoUtils.readAtMost(decoded, limit);
        if (bytes.length > limit) {
            log.debug("Body of {} exceeds {} bytes, passing through unmodified", upstream.getFinalUri(), limit);
            List<ProxyResponse.Header> oversized = baseHeaders(upstream.getContentType(), upstream, origin);
            InputStream rest = new SequenceInputStream(new ByteArrayInputStream(bytes), decoded);
            return ProxyResponse.streaming(upstream.getStatusCode(), oversized, rest, -1)
                    .withRewriteKind(RewriteKind.PASSTHROUGH);
        }

        String text = new String(bytes, charsetOf(upstream.getContentType()));
        RewriteContext context = new RewriteContext(upstream.getFinalUri(), codec);
        String rewritten = kind == RewriteKind.HTML
                ? HtmlRewriter.rewrite(text, context, shimBuilder.build(codec.getPrefix(),
                        upstream.getFinalUri().toString()))
                : CssRewriter.rewrite(text, context);
        return ProxyResponse.buffered(upstream.getStatusCode(), headers,
                rewritten.getBytes(StandardCharsets.UTF_8)).withRewriteKind(kind);
    }

    private ProxyResponse passthrough(UpstreamResponse upstream, String origin, boolean head) {
        String contentType = upstream.getContentType().isEmpty()
                ? ContentTypeResolver.OCTET_STREAM
                : upstream.getContentType();
        List<ProxyResponse.Header> headers = baseHeaders(contentType, upstream, origin);
        upstream.getHeaders().map().forEach((name, values) -> {
            if (PASSTHROUGH_HEADERS.contains(name)) {
                values.forEach(v -> headers.add(new ProxyResponse.Header(name, v)));
            }
        });
        if (head) {
            return ProxyResponse.empty(upstream.getStatusCode(), headers).withRewriteKind(RewriteKind.PASSTHROUGH);
        }
        OptionalLong length = upstream.getContentLength();
        return ProxyResponse.streaming(upstream.getStatusCode(), headers, upstream.getBody(),
                length.isPresent() ? length.getAsLong() : -1).withRewriteKind(RewriteKind.PASSTHROUGH);
    }

    private List<ProxyResponse.Header> baseHeaders(String contentType, UpstreamResponse upstream, String origin) {
        List<ProxyResponse.Header> headers = new ArrayList<>();
        headers.add(new ProxyResponse.Header(HeaderConstants.CONTENT_TYPE.getValue(), contentType));
        headers.add(new ProxyResponse.Header(HeaderConstants.X_CONTENT_TYPE_OPTIONS.getValue(), NOSNIFF));
        String location = rewriteLocation(upstream);
        if (location != null) {
            headers.add(new ProxyResponse.Header(HeaderConstants.LOCATION.getValue(), location));
        }
        headers.addAll(CorsPolicy.headers(origin));
        return headers;
    }

    /**
     * Routes the {@code Location} of a redirect that was not followed back
     * through the proxy.
     *
     * @return The proxied location, the original value when it cannot be
     *         resolved to http(s), or null when there is none.
     */
    String rewriteLocation(UpstreamResponse upstream) {
        int status = upstream.getStatusCode();
        String location = upstream.firstHeader(HeaderConstants.LOCATION.getValue());
        if (location == null || location.isBlank() || status < 300 || status >= 400) {
            return null;
        }
        URI resolved = UpstreamFetcher.resolveLocation(upstream.getFinalUri(), location);
        if (resolved == null || !UrlCodec.isHttpUrl(resolved.toString())) {
            return location;
        }
        return codec.encode(resolved.toString());
    }

    static Charset charsetOf(String contentType) {
        if (contentType != null) {
            Matcher m = CHARSET.matcher(contentType);
            if (m.find()) {
                try {
                    return Charset.forName(m.group(1).toLowerCase(Locale.ROOT));
                } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                    log.debug("Unknown charset {}, using UTF-8", m.group(1));
                }
            }
        }
        return StandardCharsets.UTF_8;
    }
}
