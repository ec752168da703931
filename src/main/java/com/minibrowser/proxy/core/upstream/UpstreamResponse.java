package com.minibrowser.proxy.core.upstream;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;

import com.minibrowser.proxy.core.constants.HeaderConstants;
import com.minibrowser.proxy.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * The origin's answer to a {@link ProxyRequest}, after redirects and
 * content-type correction. The body stream is consumed once and must be
 * closed.
 */
public class UpstreamResponse implements Closeable {
    private final int statusCode;
    private final String contentType;
    private final HttpHeaders headers;
    private final URI finalUri;
    private final InputStream body;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public UpstreamResponse(int statusCode, String contentType, HttpHeaders headers, URI finalUri,
            InputStream body) {
        this.statusCode = statusCode;
        this.contentType = contentType == null ? "" : contentType;
        this.headers = headers;
        this.finalUri = finalUri;
        this.body = body == null ? InputStream.nullInputStream() : body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return The corrected content type, empty when unknown.
     */
    public String getContentType() {
        return contentType;
    }

    public HttpHeaders getHeaders() {
        return headers;
    }

    /**
     * @return The URL the body was finally served from; the base for rewriting.
     */
    public URI getFinalUri() {
        return finalUri;
    }

    /**
     * @return The body exactly as received, still content-encoded.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP")
    public InputStream getBody() {
        return body;
    }

    public String firstHeader(String name) {
        return headers.firstValue(name).orElse(null);
    }

    public List<String> allHeaders(String name) {
        return headers.allValues(name);
    }

    /**
     * @return The declared body length, if any.
     */
    public OptionalLong getContentLength() {
        return headers.firstValueAsLong(HeaderConstants.CONTENT_LENGTH.getValue());
    }

    /**
     * @return The lower-cased content coding, or null for identity.
     */
    public String getContentEncoding() {
        String encoding = firstHeader(HeaderConstants.CONTENT_ENCODING.getValue());
        if (encoding == null || encoding.isBlank() || "identity".equalsIgnoreCase(encoding.trim())) {
            return null;
        }
        return encoding.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public void close() throws IOException {
        body.close();
    }

    /**
     * Closes the body, logging instead of throwing.
     */
    public void closeQuietly() {
        IoUtils.closeQuietly(body, "upstream body");
    }
}
