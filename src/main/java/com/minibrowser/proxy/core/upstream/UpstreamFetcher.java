package com.minibrowser.proxy.core.upstream;

import java.io.IOException;
import java.io.InputStream;
import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executor;

import com.minibrowser.proxy.config.ProxyServerConfig;
import com.minibrowser.proxy.config.UpstreamProxyConfig;
import com.minibrowser.proxy.core.codec.UrlCodec;
import com.minibrowser.proxy.core.constants.HeaderConstants;
import com.minibrowser.proxy.core.exceptions.UpstreamFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues the outbound request to the real origin.
 * <p>
 * Redirects are followed manually up to {@code maxRedirects} so that the final
 * URL is known and becomes the base for rewriting. Only a curated set of
 * inbound headers is forwarded; {@code Origin} and {@code Referer} always name
 * the target itself, never the host application.
 */
public class UpstreamFetcher {

    private static final Logger log = LoggerFactory.getLogger(UpstreamFetcher.class);

    static final String DEFAULT_ACCEPT =
            "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,image/apng,*/*;q=0.8";
    static final String DEFAULT_ACCEPT_LANGUAGE = "en-US,en;q=0.9";
    static final String ACCEPT_ENCODING = "gzip, deflate";
    private static final String NO_CACHE = "no-cache";

    /** Inbound headers copied to the upstream request when present. */
    private static final Set<String> FORWARDED_HEADERS;

    static {
        Set<String> forwarded = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        forwarded.addAll(List.of(
                HeaderConstants.COOKIE.getValue(),
                "Authorization",
                "X-Requested-With",
                "Range",
                "If-Range",
                "If-None-Match",
                "If-Modified-Since"));
        FORWARDED_HEADERS = Collections.unmodifiableSet(forwarded);
    }

    private final ProxyServerConfig config;
    private final HttpClient httpClient;

    /**
     * Creates a fetcher with its own {@link HttpClient}.
     *
     * @param config   The listener configuration (timeout, redirects, user agent,
     *                 upstream proxy).
     * @param executor Executor for the client's asynchronous work.
     */
    public UpstreamFetcher(ProxyServerConfig config, Executor executor) {
        this.config = config;

        HttpClient.Builder builder = HttpClient.newBuilder()
                .executor(executor)
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1);

        if (config.getTimeout() > 0) {
            builder.connectTimeout(Duration.ofMillis(config.getTimeout()));
        }

        UpstreamProxyConfig upstream = config.getUpstreamProxy();
        if (upstream != null) {
            builder.proxy(ProxySelector.of(new InetSocketAddress(upstream.getHost(), upstream.getPort())));
            if (upstream.hasCredentials()) {
                builder.authenticator(new Authenticator() {
                    @Override
                    protected PasswordAuthentication getPasswordAuthentication() {
                        return new PasswordAuthentication(upstream.getUsername(), upstream.getPassword().toCharArray());
                    }
                });
            }
        }
        this.httpClient = builder.build();
    }

    /**
     * Fetches the target of a request.
     *
     * @param request The decoded inbound request.
     * @return The upstream response; its body must be closed by the caller.
     * @throws UpstreamFetchException on network failure, timeout or interruption.
     */
    public UpstreamResponse fetch(ProxyRequest request) {
        String method = request.getMethod().toUpperCase(Locale.ROOT);
        byte[] body = request.hasBodySemantics() ? request.getBody() : null;
        URI current = withoutFragment(request.getTarget());
        int redirects = 0;

        try {
            while (true) {
                HttpRequest upstreamRequest = buildRequest(method, current, body, request);
                HttpResponse<InputStream> response = httpClient.send(upstreamRequest,
                        HttpResponse.BodyHandlers.ofInputStream());

                URI next = redirects < config.getMaxRedirects() ? redirectTarget(response, current) : null;
                if (next == null) {
                    return toUpstreamResponse(response, current, request.isHead());
                }
                response.body().close();
                log.debug("Following {} redirect {} -> {}", response.statusCode(), current, next);
                int status = response.statusCode();
                if ((status == 303 && !"HEAD".equals(method))
                        || ((status == 301 || status == 302) && !"GET".equals(method) && !"HEAD".equals(method))) {
                    method = "GET";
                    body = null;
                }
                current = next;
                redirects++;
            }
        } catch (HttpTimeoutException e) {
            throw new UpstreamFetchException("Upstream request timed out: " + current, e);
        } catch (IOException e) {
            throw new UpstreamFetchException(describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamFetchException("Upstream request interrupted", e);
        } catch (IllegalArgumentException e) {
            throw new UpstreamFetchException("Cannot request " + current + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds one upstream request.
     *
     * @param method  The method for this hop.
     * @param uri     The URL for this hop.
     * @param body    The body to send, or null.
     * @param inbound The inbound request, for forwarded headers.
     * @return The request.
     */
    HttpRequest buildRequest(String method, URI uri, byte[] body, ProxyRequest inbound) {
        HttpRequest.BodyPublisher publisher = body != null && body.length > 0
                ? HttpRequest.BodyPublishers.ofByteArray(body)
                : HttpRequest.BodyPublishers.noBody();
        HttpRequest.Builder rb = HttpRequest.newBuilder()
                .uri(uri)
                .version(HttpClient.Version.HTTP_1_1)
                .method(method, publisher);

        if (config.getTimeout() > 0) {
            rb.timeout(Duration.ofMillis(config.getTimeout()));
        }

        boolean get = "GET".equals(method);
        boolean head = "HEAD".equals(method);

        rb.header(HeaderConstants.USER_AGENT.getValue(),
                valueOr(inbound.getHeader(HeaderConstants.USER_AGENT.getValue()), config.getUserAgent()));
        rb.header(HeaderConstants.ACCEPT.getValue(),
                valueOr(inbound.getHeader(HeaderConstants.ACCEPT.getValue()), get ? DEFAULT_ACCEPT : "*/*"));
        rb.header(HeaderConstants.ACCEPT_LANGUAGE.getValue(),
                valueOr(inbound.getHeader(HeaderConstants.ACCEPT_LANGUAGE.getValue()), DEFAULT_ACCEPT_LANGUAGE));
        rb.header(HeaderConstants.ACCEPT_ENCODING.getValue(), ACCEPT_ENCODING);
        rb.header(HeaderConstants.REFERER.getValue(), uri.toString());
        if (get || head) {
            rb.header(HeaderConstants.ORIGIN.getValue(), origin(uri));
        }
        if (get) {
            rb.header(HeaderConstants.CACHE_CONTROL.getValue(), NO_CACHE);
            rb.header(HeaderConstants.PRAGMA.getValue(), NO_CACHE);
        }
        if (body != null) {
            String contentType = inbound.getHeader(HeaderConstants.CONTENT_TYPE.getValue());
            if (contentType != null) {
                rb.header(HeaderConstants.CONTENT_TYPE.getValue(), contentType);
            }
        }

        inbound.getHeaders().forEach((k, v) -> {
            if (FORWARDED_HEADERS.contains(k) && v != null && !v.isEmpty()) {
                rb.header(k, v);
            }
        });
        return rb.build();
    }

    private UpstreamResponse toUpstreamResponse(HttpResponse<InputStream> response, URI finalUri, boolean head)
            throws IOException {
        String rawType = response.headers().firstValue(HeaderConstants.CONTENT_TYPE.getValue()).orElse("");
        String contentType = ContentTypeResolver.correct(rawType, finalUri);
        InputStream body = response.body();
        if (head) {
            body.close();
            body = InputStream.nullInputStream();
        }
        log.debug("Upstream {} answered {} ({})", finalUri, response.statusCode(), contentType);
        return new UpstreamResponse(response.statusCode(), contentType, response.headers(), finalUri, body);
    }

    /**
     * @return The resolved redirect target, or null if the response is not a
     *         followable redirect.
     */
    private static URI redirectTarget(HttpResponse<?> response, URI current) {
        int status = response.statusCode();
        if (status != 301 && status != 302 && status != 303 && status != 307 && status != 308) {
            return null;
        }
        String location = response.headers().firstValue(HeaderConstants.LOCATION.getValue()).orElse(null);
        if (location == null || location.isBlank()) {
            return null;
        }
        URI resolved = resolveLocation(current, location);
        if (resolved == null || !UrlCodec.isHttpUrl(resolved.toString())) {
            return null;
        }
        return withoutFragment(resolved);
    }

    static URI withoutFragment(URI uri) {
        if (uri.getRawFragment() == null) {
            return uri;
        }
        String s = uri.toString();
        return URI.create(s.substring(0, s.indexOf('#')));
    }

    static String origin(URI uri) {
        StringBuilder sb = new StringBuilder(uri.getScheme()).append("://").append(UrlCodec.hostOf(uri));
        if (UrlCodec.portOf(uri) != -1) {
            sb.append(':').append(UrlCodec.portOf(uri));
        }
        return sb.toString();
    }

    private static String valueOr(String value, String fallback) {
        return value != null && !value.isEmpty() ? value : fallback;
    }

    private static String describe(IOException e) {
        String message = e.getMessage();
        if (message == null || message.isEmpty()) {
            message = e.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Parses a Location value against a base, for callers rewriting un-followed
     * redirects.
     *
     * @param base     The URL that produced the redirect.
     * @param location The Location header value.
     * @return The absolute URL, or null if it cannot be resolved.
     */
    public static URI resolveLocation(URI base, String location) {
        URI parsed = UrlCodec.parseLenient(location.trim());
        if (parsed == null) {
            return null;
        }
        try {
            URI resolved = base.resolve(parsed);
            return resolved.isAbsolute() ? resolved : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
