package com.minibrowser.proxy.core.proxy.impl.embed;

import java.io.ByteArrayOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.minibrowser.proxy.core.constants.HeaderConstants;
import com.minibrowser.proxy.core.rewrite.RewriteKind;
import com.minibrowser.proxy.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;

/**
 * An outgoing HTTP/1.1 response: status, ordered headers and either a
 * buffered body or a streaming one. Framing headers ({@code Content-Length}
 * or {@code Transfer-Encoding: chunked}, and {@code Connection}) are added
 * when the response is written.
 */
public final class ProxyResponse {

    /**
     * A single response header.
     */
    public record Header(String name, String value) {
    }

    /** Standard HTTP reason phrases. */
    private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(
            Map.entry(200, "OK"), Map.entry(201, "Created"), Map.entry(202, "Accepted"),
            Map.entry(204, "No Content"), Map.entry(206, "Partial Content"),
            Map.entry(301, "Moved Permanently"), Map.entry(302, "Found"), Map.entry(303, "See Other"),
            Map.entry(304, "Not Modified"), Map.entry(307, "Temporary Redirect"),
            Map.entry(308, "Permanent Redirect"),
            Map.entry(400, "Bad Request"), Map.entry(401, "Unauthorized"),
            Map.entry(403, "Forbidden"), Map.entry(404, "Not Found"),
            Map.entry(405, "Method Not Allowed"), Map.entry(408, "Request Timeout"),
            Map.entry(410, "Gone"), Map.entry(413, "Payload Too Large"),
            Map.entry(416, "Range Not Satisfiable"), Map.entry(429, "Too Many Requests"),
            Map.entry(500, "Internal Server Error"), Map.entry(502, "Bad Gateway"),
            Map.entry(503, "Service Unavailable"), Map.entry(504, "Gateway Timeout"));

    private final int status;
    private final List<Header> headers;
    private final byte[] body;
    private final InputStream stream;
    private final long streamLength;
    private RewriteKind rewriteKind;

    private ProxyResponse(int status, List<Header> headers, byte[] body, InputStream stream, long streamLength) {
        this.status = status;
        this.headers = new ArrayList<>(headers);
        this.body = body;
        this.stream = stream;
        this.streamLength = streamLength;
    }

    /**
     * @param status  Status code.
     * @param headers Headers, in output order.
     * @param body    The complete body.
     * @return A response with a {@code Content-Length}.
     */
    public static ProxyResponse buffered(int status, List<Header> headers, byte[] body) {
        return new ProxyResponse(status, headers, body == null ? new byte[0] : body, null, -1);
    }

    /**
     * @param status  Status code.
     * @param headers Headers, in output order.
     * @param stream  The body source, closed after writing.
     * @param length  The exact body length, or -1 to use chunked framing.
     * @return A streaming response.
     */
    public static ProxyResponse streaming(int status, List<Header> headers, InputStream stream, long length) {
        return new ProxyResponse(status, headers, null, stream, length);
    }

    /**
     * @param status  Status code.
     * @param headers Headers, in output order.
     * @return A response without a body.
     */
    public static ProxyResponse empty(int status, List<Header> headers) {
        return buffered(status, headers, null);
    }

    public int getStatus() {
        return status;
    }

    public List<Header> getHeaders() {
        return Collections.unmodifiableList(headers);
    }

    /**
     * @param name Header name, case-insensitive.
     * @return The first value, or null.
     */
    public String getHeader(String name) {
        for (Header h : headers) {
            if (h.name().equalsIgnoreCase(name)) {
                return h.value();
            }
        }
        return null;
    }

    /**
     * @return The buffered body, or null for a streaming response.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP")
    public byte[] getBody() {
        return body;
    }

    public boolean isStreaming() {
        return stream != null;
    }

    /**
     * @return The rewrite path that produced this response, or null.
     */
    public RewriteKind getRewriteKind() {
        return rewriteKind;
    }

    ProxyResponse withRewriteKind(RewriteKind kind) {
        this.rewriteKind = kind;
        return this;
    }

    /**
     * Writes status line, headers and body.
     *
     * @param out       The client stream.
     * @param keepAlive Whether the connection stays open afterwards.
     * @param counter   Optional counter for body bytes.
     * @return Number of body bytes written.
     * @throws IOException If the client connection or the body source fails.
     */
    public long writeTo(OutputStream out, boolean keepAlive, Counter counter) throws IOException {
        boolean bodyAllowed = status >= 200 && status != 204 && status != 304;
        boolean chunked = bodyAllowed && stream != null && streamLength < 0;

        ByteArrayOutputStream head = new ByteArrayOutputStream(512);
        appendLine(head, "HTTP/1.1 " + status + " " + REASON_PHRASES.getOrDefault(status, "Unknown"));
        for (Header h : headers) {
            appendLine(head, h.name() + ": " + sanitize(h.value()));
        }
        if (chunked) {
            appendLine(head, HeaderConstants.TRANSFER_ENCODING.getValue() + ": chunked");
        } else if (bodyAllowed) {
            long length = stream != null ? streamLength : body.length;
            appendLine(head, HeaderConstants.CONTENT_LENGTH.getValue() + ": " + length);
        }
        appendLine(head, HeaderConstants.CONNECTION.getValue() + ": " + (keepAlive ? "keep-alive" : "close"));
        appendLine(head, "");
        out.write(head.toByteArray());

        ChunkedOutputStream chunkedOut = chunked ? new ChunkedOutputStream(out) : null;
        CountingOutputStream counting = new CountingOutputStream(chunked ? chunkedOut : out);
        if (stream != null) {
            try (InputStream in = stream) {
                if (bodyAllowed) {
                    IoUtils.transferWithCounting(in, counting, counter);
                }
            }
        } else if (bodyAllowed && body.length > 0) {
            counting.write(body);
            if (counter != null) {
                counter.increment(body.length);
            }
        }
        if (chunkedOut != null) {
            chunkedOut.finish();
        }
        out.flush();
        return counting.getCount();
    }

    private static void appendLine(ByteArrayOutputStream buf, String line) {
        buf.writeBytes(line.getBytes(StandardCharsets.ISO_8859_1));
        buf.writeBytes(new byte[] {'\r', '\n'});
    }

    private static String sanitize(String value) {
        return value == null ? "" : value.replace('\r', ' ').replace('\n', ' ');
    }

    /**
     * OutputStream that counts the number of bytes written.
     */
    private static class CountingOutputStream extends FilterOutputStream {
        private long count = 0;

        CountingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(int b) throws IOException {
            out.write(b);
            count++;
        }

        @Override
        public void write(byte[] b) throws IOException {
            out.write(b);
            count += b.length;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
            count += len;
        }

        long getCount() {
            return count;
        }
    }
}
