package com.minibrowser.proxy.core.proxy.impl.embed;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minibrowser.proxy.config.ProxyServerConfig;
import com.minibrowser.proxy.core.codec.UrlCodec;
import com.minibrowser.proxy.core.constants.HeaderConstants;
import com.minibrowser.proxy.core.exceptions.InvalidTargetException;
import com.minibrowser.proxy.core.exceptions.ProtocolException;
import com.minibrowser.proxy.core.exceptions.ProxyException;
import com.minibrowser.proxy.core.exceptions.TargetNotAllowedException;
import com.minibrowser.proxy.core.exceptions.UpstreamFetchException;
import com.minibrowser.proxy.core.proxy.AbstractProxyServer;
import com.minibrowser.proxy.core.proxy.impl.embed.filters.CorsPreflightFilter;
import com.minibrowser.proxy.core.proxy.impl.embed.filters.HttpFilter;
import com.minibrowser.proxy.core.proxy.impl.embed.filters.LoggingFilter;
import com.minibrowser.proxy.core.proxy.impl.embed.filters.RequestContext;
import com.minibrowser.proxy.core.rewrite.RewriteKind;
import com.minibrowser.proxy.core.services.LoggingService;
import com.minibrowser.proxy.core.shim.RuntimeShimBuilder;
import com.minibrowser.proxy.core.upstream.ProxyRequest;
import com.minibrowser.proxy.core.upstream.TargetGuard;
import com.minibrowser.proxy.core.upstream.UpstreamFetcher;
import com.minibrowser.proxy.core.upstream.UpstreamResponse;
import com.minibrowser.proxy.core.utils.IoUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * The embedding reverse proxy.
 * <p>
 * Serves {@code <prefix><encodeURIComponent(absoluteUrl)>}: the target is
 * decoded from the path, fetched, rewritten so every reference it contains
 * points back here, and returned with frame-friendly headers. HTTP/1.1
 * keep-alive is supported, and WebSocket upgrades under the prefix are
 * tunnelled to the decoded target.
 */
public class EmbedProxyServer extends AbstractProxyServer {

    private static final int HTTP_BAD_REQUEST = 400;
    private static final int HTTP_FORBIDDEN = 403;
    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_METHOD_NOT_ALLOWED = 405;
    private static final int HTTP_PAYLOAD_TOO_LARGE = 413;
    private static final int HTTP_BAD_GATEWAY = 502;

    private static final String PROXY_ERROR = "Proxy error";
    private static final int MAX_HTTP_HEADERS = 100;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Methods served under the prefix. */
    static final Set<String> ALLOWED_METHODS = Set.of("GET", "HEAD", "POST", "PUT", "PATCH", "DELETE", "OPTIONS");

    /** Inbound headers never copied onto a tunnelled WebSocket handshake. */
    private static final Set<String> WEBSOCKET_EXCLUDED_HEADERS;

    static {
        Set<String> excluded = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        excluded.addAll(List.of(
                HeaderConstants.HOST.getValue(),
                HeaderConstants.ORIGIN.getValue(),
                HeaderConstants.PROXY_AUTHORIZATION.getValue(),
                HeaderConstants.CONTENT_LENGTH.getValue(),
                HeaderConstants.TRANSFER_ENCODING.getValue()));
        WEBSOCKET_EXCLUDED_HEADERS = Collections.unmodifiableSet(excluded);
    }

    private final UrlCodec codec;
    private final TargetGuard targetGuard;
    private final UpstreamFetcher fetcher;
    private final ResponseAssembler assembler;
    private final List<HttpFilter> filters;
    private final Counter requestsTotal;
    private final Counter bytesSent;
    private final Counter bytesReceived;
    private final Counter upstreamErrors;
    private final Map<RewriteKind, Counter> rewriteCounters = new EnumMap<>(RewriteKind.class);

    /**
     * Initializes the listener with configuration and shared services.
     *
     * @param config         The listener configuration.
     * @param loggingService The access log.
     * @param registry       The Micrometer meter registry.
     * @param shimBuilder    Builder for the script injected into HTML pages.
     */
    public EmbedProxyServer(ProxyServerConfig config, LoggingService loggingService, MeterRegistry registry,
            RuntimeShimBuilder shimBuilder) {
        this(config, loggingService, registry, shimBuilder, new TargetGuard(config.isBlockPrivateAddresses()));
    }

    /**
     * Initializes the listener with an explicit target guard.
     *
     * @param config         The listener configuration.
     * @param loggingService The access log.
     * @param registry       The Micrometer meter registry.
     * @param shimBuilder    Builder for the script injected into HTML pages.
     * @param targetGuard    Check applied to every decoded target.
     */
    public EmbedProxyServer(ProxyServerConfig config, LoggingService loggingService, MeterRegistry registry,
            RuntimeShimBuilder shimBuilder, TargetGuard targetGuard) {
        super(config, loggingService, registry);
        this.codec = new UrlCodec(config.getPrefix());
        this.targetGuard = targetGuard;
        this.fetcher = new UpstreamFetcher(config, executor);
        this.assembler = new ResponseAssembler(config, codec, shimBuilder);
        this.filters = List.of(new CorsPreflightFilter(), new LoggingFilter(loggingService));

        this.requestsTotal = Counter.builder("proxy.http.requests.total")
                .tag("name", metricName)
                .description("Total number of HTTP requests")
                .register(registry);
        this.bytesSent = Counter.builder("proxy.traffic.bytes.sent")
                .tag("name", metricName)
                .description("Total bytes sent to target over tunnels")
                .register(registry);
        this.bytesReceived = Counter.builder("proxy.traffic.bytes.received")
                .tag("name", metricName)
                .description("Total body bytes delivered to clients")
                .register(registry);
        this.upstreamErrors = Counter.builder("proxy.upstream.errors")
                .tag("name", metricName)
                .description("Total number of failed upstream fetches")
                .register(registry);
        for (RewriteKind kind : RewriteKind.values()) {
            rewriteCounters.put(kind, Counter.builder("proxy.rewrite.total")
                    .tag("name", metricName)
                    .tag("kind", kind.tag())
                    .description("Responses by rewrite path")
                    .register(registry));
        }
    }

    @Override
    public void stop() {
        super.stop();
        if (registry != null) {
            registry.remove(requestsTotal);
            registry.remove(bytesSent);
            registry.remove(bytesReceived);
            registry.remove(upstreamErrors);
            rewriteCounters.values().forEach(registry::remove);
        }
    }

    @Override
    protected String getProxyName() {
        return "Embed";
    }

    /**
     * @return The codec for this listener's prefix.
     */
    public UrlCodec getCodec() {
        return codec;
    }

    /**
     * Main handler for client connections.
     * Manages the request/response loop and supports keep-alive.
     */
    @Override
    protected void handleClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();
        try (client) {
            InputStream in = new BufferedInputStream(client.getInputStream());
            OutputStream out = client.getOutputStream();

            while (!client.isClosed() && processNextRequest(in, out, remoteAddr)) {
                // Loop continues as long as client is connected and request is processed
            }
        } catch (ProtocolException e) {
            log.warn("HTTP protocol error from {}: {}", remoteAddr, e.getMessage());
        } catch (ProxyException e) {
            log.error("Proxy error for {}: {}", remoteAddr, e.getMessage());
        } catch (Exception e) {
            log.debug("Unexpected client error from {}: {}", remoteAddr, e.getMessage());
        }
    }

    /**
     * Reads and answers one request.
     *
     * @return true to keep reading requests from this connection.
     */
    private boolean processNextRequest(InputStream in, OutputStream out, String remoteAddr) throws IOException {
        String firstLine = readRequestLine(in, remoteAddr);
        if (firstLine == null) {
            return false;
        }

        requestsTotal.increment();

        String[] parts = firstLine.split(" ");
        if (parts.length < 2) {
            writeJsonError(out, HTTP_BAD_REQUEST, "Bad Request", null, null, false);
            return false;
        }
        String method = parts[0].toUpperCase(Locale.ROOT);
        String requestTarget = parts[1];
        String version = parts.length > 2 ? parts[2] : "HTTP/1.0";

        Map<String, String> headers;
        byte[] body;
        try {
            headers = readHeaders(in);
            body = readBody(in, headers);
        } catch (ProtocolException e) {
            log.warn("Rejecting request from {}: {}", remoteAddr, e.getMessage());
            int status = e.getMessage() != null && e.getMessage().contains("body exceeds")
                    ? HTTP_PAYLOAD_TOO_LARGE
                    : HTTP_BAD_REQUEST;
            writeJsonError(out, status, status == HTTP_PAYLOAD_TOO_LARGE ? "Payload Too Large" : "Bad Request",
                    null, null, false);
            return false;
        }

        RequestContext context = new RequestContext(method, requestTarget, headers, remoteAddr,
                isKeepAlive(version, headers));
        boolean reusable = handle(context, body, in, out);

        for (HttpFilter filter : filters) {
            filter.postHandle(context, context.getStatus());
        }
        return reusable && context.isKeepAlive();
    }

    /**
     * Routes and answers one parsed request.
     *
     * @return false when the connection cannot carry another request.
     */
    private boolean handle(RequestContext context, byte[] body, InputStream in, OutputStream out) throws IOException {
        String origin = context.getHeader(HeaderConstants.ORIGIN.getValue());
        String rawPath = pathOf(context.getRequestTarget());
        String rawQuery = queryOf(context.getRequestTarget());

        if (!codec.isProxyPath(rawPath)) {
            context.setStatus(writeJsonError(out, HTTP_NOT_FOUND, "Not Found", null, origin,
                    context.isKeepAlive()));
            return true;
        }
        if (!ALLOWED_METHODS.contains(context.getMethod())) {
            context.setStatus(writeJsonError(out, HTTP_METHOD_NOT_ALLOWED, "Method Not Allowed", null, origin,
                    context.isKeepAlive()));
            return true;
        }
        if (!executeFilters(context, out)) {
            return true;
        }

        URI target;
        try {
            target = withQuery(codec.decodePath(rawPath), rawQuery);
            targetGuard.check(target);
        } catch (InvalidTargetException e) {
            context.setStatus(writeJsonError(out, HTTP_BAD_REQUEST, e.getMessage(), null, origin,
                    context.isKeepAlive()));
            return true;
        } catch (TargetNotAllowedException e) {
            log.warn("Blocked target for {}: {}", context.getRemoteAddr(), e.getMessage());
            context.setStatus(writeJsonError(out, HTTP_FORBIDDEN, "Forbidden target", e.getMessage(), origin,
                    context.isKeepAlive()));
            return true;
        }

        if (isUpgrade(context.getHeaders(), context.getMethod())) {
            context.setStatus(handleWebSocket(context, target, in, out));
            return false;
        }

        ProxyRequest request = new ProxyRequest(context.getMethod(), target, context.getHeaders(), body);
        UpstreamResponse upstream;
        try {
            upstream = fetcher.fetch(request);
        } catch (UpstreamFetchException e) {
            upstreamErrors.increment();
            log.warn("Upstream fetch failed for {}: {}", target, e.getMessage());
            context.setStatus(writeJsonError(out, HTTP_BAD_GATEWAY, PROXY_ERROR, e.getMessage(), origin,
                    context.isKeepAlive()));
            return true;
        }

        try (upstream) {
            ProxyResponse response;
            try {
                response = assembler.assemble(upstream, origin, request.isHead());
            } catch (IOException | RuntimeException e) {
                upstreamErrors.increment();
                log.warn("Failed to process upstream response from {}: {}", upstream.getFinalUri(), e.getMessage());
                context.setStatus(writeJsonError(out, HTTP_BAD_GATEWAY, PROXY_ERROR, describe(e), origin,
                        context.isKeepAlive()));
                return true;
            }

            RewriteKind kind = response.getRewriteKind();
            context.setRewrite(kind.tag());
            context.setStatus(response.getStatus());
            rewriteCounters.get(kind).increment();
            loggingService.logResponse(context.getMethod(), upstream.getFinalUri().toString(),
                    upstream.getStatusCode(), kind.tag());

            try {
                context.setBytes(response.writeTo(out, context.isKeepAlive(), bytesReceived));
            } catch (IOException e) {
                // Closing the upstream body on the way out cancels the exchange.
                log.debug("Streaming {} to {} aborted: {}", upstream.getFinalUri(), context.getRemoteAddr(),
                        e.getMessage());
                return false;
            }
        }
        return true;
    }

    private boolean executeFilters(RequestContext context, OutputStream out) throws IOException {
        for (HttpFilter filter : filters) {
            try {
                if (!filter.preHandle(context, out)) {
                    return false;
                }
            } catch (ProxyException e) {
                log.warn("Filter error: {}", e.getMessage());
                context.setStatus(writeJsonError(out, HTTP_BAD_GATEWAY, PROXY_ERROR, e.getMessage(), null,
                        context.isKeepAlive()));
                return false;
            }
        }
        return true;
    }

    /**
     * Tunnels a WebSocket upgrade to the decoded target.
     *
     * @return The status to log: 101 on success, 502 when the target is
     *         unreachable.
     */
    private int handleWebSocket(RequestContext context, URI target, InputStream clientIn, OutputStream clientOut)
            throws IOException {
        boolean secure = "https".equalsIgnoreCase(target.getScheme());
        String host = UrlCodec.hostOf(target);
        int explicitPort = UrlCodec.portOf(target);
        int port = explicitPort != -1 ? explicitPort : (secure ? 443 : 80);

        Socket socket = null;
        try {
            socket = connectToTarget(host, port);
            if (secure) {
                SSLSocket ssl = (SSLSocket) ((SSLSocketFactory) SSLSocketFactory.getDefault())
                        .createSocket(socket, host, port, true);
                ssl.startHandshake();
                socket = ssl;
            }
            socket.setTcpNoDelay(true);
        } catch (IOException e) {
            IoUtils.closeQuietly(socket, "websocket target");
            log.warn("WebSocket tunnel to {} failed: {}", target, e.getMessage());
            return writeJsonError(clientOut, HTTP_BAD_GATEWAY, PROXY_ERROR, e.getMessage(),
                    context.getHeader(HeaderConstants.ORIGIN.getValue()), false);
        }

        try (Socket targetSocket = socket) {
            OutputStream targetOut = targetSocket.getOutputStream();
            InputStream targetIn = new BufferedInputStream(targetSocket.getInputStream());
            targetOut.write(buildUpgradeRequest(context, target).getBytes(StandardCharsets.ISO_8859_1));
            targetOut.flush();

            log.info("WebSocket Tunnel: {} -> {}", context.getRemoteAddr(), target);
            IoUtils.relay(clientIn, clientOut, targetIn, targetOut, executor, bytesSent, bytesReceived);
        }
        return 101;
    }

    static String buildUpgradeRequest(RequestContext context, URI target) {
        String path = target.getRawPath() == null || target.getRawPath().isEmpty() ? "/" : target.getRawPath();
        if (target.getRawQuery() != null) {
            path += "?" + target.getRawQuery();
        }
        StringBuilder sb = new StringBuilder(256);
        sb.append("GET ").append(path).append(" HTTP/1.1\r\n");
        sb.append(HeaderConstants.HOST.getValue()).append(": ").append(target.getRawAuthority()).append("\r\n");
        sb.append(HeaderConstants.ORIGIN.getValue()).append(": ")
                .append(target.getScheme().toLowerCase(Locale.ROOT)).append("://")
                .append(target.getRawAuthority()).append("\r\n");
        context.getHeaders().forEach((k, v) -> {
            if (!WEBSOCKET_EXCLUDED_HEADERS.contains(k)) {
                sb.append(k).append(": ").append(v).append("\r\n");
            }
        });
        sb.append("\r\n");
        return sb.toString();
    }

    /**
     * Writes a JSON error body such as {@code {"error":"Invalid URL"}}.
     *
     * @return The status written.
     */
    private int writeJsonError(OutputStream out, int status, String error, String message, String origin,
            boolean keepAlive) throws IOException {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("error", error);
        if (message != null) {
            fields.put("message", message);
        }
        byte[] json;
        try {
            json = MAPPER.writeValueAsBytes(fields);
        } catch (JsonProcessingException e) {
            json = ("{\"error\":\"" + PROXY_ERROR + "\"}").getBytes(StandardCharsets.UTF_8);
        }
        List<ProxyResponse.Header> headers = new ArrayList<>();
        headers.add(new ProxyResponse.Header(HeaderConstants.CONTENT_TYPE.getValue(),
                "application/json; charset=utf-8"));
        headers.addAll(CorsPolicy.headers(origin));
        if (status == HTTP_METHOD_NOT_ALLOWED) {
            headers.add(new ProxyResponse.Header("Allow", String.join(", ", new TreeSet<>(ALLOWED_METHODS))));
        }
        ProxyResponse.buffered(status, headers, json).writeTo(out, keepAlive, null);
        return status;
    }

    private Map<String, String> readHeaders(InputStream in) throws IOException {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        String line;
        int headerCount = 0;
        while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
            if (++headerCount > MAX_HTTP_HEADERS) {
                throw new ProtocolException("Too many HTTP headers (exceeds limit of " + MAX_HTTP_HEADERS + ")");
            }
            int idx = line.indexOf(':');
            if (idx != -1) {
                String name = line.substring(0, idx).trim();
                String value = line.substring(idx + 1).trim();
                headers.merge(name, value, (a, b) -> HeaderConstants.COOKIE.getValue().equalsIgnoreCase(name)
                        ? a + "; " + b
                        : a + ", " + b);
            }
        }
        return headers;
    }

    /**
     * Reads the request body announced by {@code Content-Length} or
     * {@code Transfer-Encoding: chunked}.
     */
    private byte[] readBody(InputStream in, Map<String, String> headers) throws IOException {
        long max = config.getMaxRewriteBodySize();
        String transferEncoding = headers.get(HeaderConstants.TRANSFER_ENCODING.getValue());
        if (transferEncoding != null && transferEncoding.toLowerCase(Locale.ROOT).contains("chunked")) {
            return IoUtils.readChunkedBody(in, max);
        }
        String clStr = headers.get(HeaderConstants.CONTENT_LENGTH.getValue());
        if (clStr == null) {
            return new byte[0];
        }
        long length;
        try {
            length = Long.parseLong(clStr.trim());
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid Content-Length: " + clStr, e);
        }
        if (length < 0) {
            throw new ProtocolException("Invalid Content-Length: " + clStr);
        }
        if (length > max) {
            throw new ProtocolException("Request body exceeds " + max + " bytes");
        }
        byte[] body = in.readNBytes((int) length);
        if (body.length < length) {
            throw new ProtocolException("Request body ended after " + body.length + " of " + length + " bytes");
        }
        return body;
    }

    private String readRequestLine(InputStream in, String remoteAddr) {
        try {
            String line = IoUtils.readLine(in);
            if (line == null || line.isEmpty()) {
                return null;
            }
            return line;
        } catch (IOException e) {
            log.debug("Error reading request line from {}: {}", remoteAddr, e.getMessage());
            return null;
        }
    }

    private boolean isKeepAlive(String version, Map<String, String> headers) {
        String connection = headers.get(HeaderConstants.CONNECTION.getValue());
        if (!config.isKeepAlive() || "close".equalsIgnoreCase(connection)) {
            return false;
        }
        return !"HTTP/1.0".equalsIgnoreCase(version) || "keep-alive".equalsIgnoreCase(connection);
    }

    private static boolean isUpgrade(Map<String, String> headers, String method) {
        return "GET".equals(method) && "websocket".equalsIgnoreCase(headers.get(HeaderConstants.UPGRADE.getValue()));
    }

    /**
     * @return The raw path of an origin-form or absolute-form request target.
     */
    static String pathOf(String requestTarget) {
        String t = requestTarget;
        if (!t.startsWith("/")) {
            int scheme = t.indexOf("://");
            if (scheme > 0) {
                int slash = t.indexOf('/', scheme + 3);
                t = slash >= 0 ? t.substring(slash) : "/";
            }
        }
        int q = t.indexOf('?');
        return q >= 0 ? t.substring(0, q) : t;
    }

    static String queryOf(String requestTarget) {
        int q = requestTarget.indexOf('?');
        return q >= 0 && q < requestTarget.length() - 1 ? requestTarget.substring(q + 1) : null;
    }

    /**
     * Appends a query sent next to the encoded target (a GET form submitted
     * through the proxy) to the target's own query.
     */
    static URI withQuery(URI target, String rawQuery) {
        if (rawQuery == null) {
            return target;
        }
        String s = target.toString();
        int hash = s.indexOf('#');
        String fragment = hash >= 0 ? s.substring(hash) : "";
        String base = hash >= 0 ? s.substring(0, hash) : s;
        URI combined = UrlCodec.parseLenient(base + (target.getRawQuery() != null ? "&" : "?") + rawQuery
                + fragment);
        if (combined == null) {
            throw new InvalidTargetException(InvalidTargetException.INVALID_URL);
        }
        return combined;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isEmpty() ? e.getClass().getSimpleName() : message;
    }
}
