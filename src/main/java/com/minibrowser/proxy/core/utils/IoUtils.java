package com.minibrowser.proxy.core.utils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PushbackInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

import com.minibrowser.proxy.core.exceptions.ProtocolException;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common I/O utility methods for data relay and stream handling.
 */
public class IoUtils {

    private IoUtils() {
        // Utility class
    }

    private static final Logger log = LoggerFactory.getLogger(IoUtils.class);

    /** Buffer size used for relay and streaming transfers. */
    public static final int DEFAULT_BUFFER_SIZE = 8192;

    /**
     * Relays data between two streams bidirectionally.
     * Uses the calling thread for the backward direction.
     *
     * @param in1           Input from side 1 (client).
     * @param out1          Output to side 1.
     * @param in2           Input from side 2 (target).
     * @param out2          Output to side 2.
     * @param executor      Executor running the forward direction.
     * @param bytesSent     Optional counter for bytes sent (client -&gt; target).
     * @param bytesReceived Optional counter for bytes received (target -&gt;
     *                      client).
     */
    public static void relay(InputStream in1, OutputStream out1, InputStream in2, OutputStream out2,
            Executor executor, Counter bytesSent, Counter bytesReceived) {

        CompletableFuture<Void> f1 = CompletableFuture.runAsync(() -> {
            try {
                transferWithCounting(in1, out2, bytesSent);
            } catch (IOException e) {
                log.debug("Relay forward error: {}", e.getMessage());
            } finally {
                closeQuietly(in1);
                closeQuietly(out2);
            }
        }, executor);

        try {
            transferWithCounting(in2, out1, bytesReceived);
        } catch (IOException e) {
            log.debug("Relay backward error: {}", e.getMessage());
        } finally {
            closeQuietly(in2);
            closeQuietly(out1);
        }

        try {
            f1.join();
        } catch (Exception e) {
            log.debug("Bidirectional relay joined with exception: {}", e.getMessage());
        }
    }

    /**
     * Copies a stream, counting the bytes.
     *
     * @param in      Source.
     * @param out     Destination, flushed at the end.
     * @param counter Optional counter.
     * @return Number of bytes copied.
     * @throws IOException If reading or writing fails.
     */
    public static long transferWithCounting(InputStream in, OutputStream out, Counter counter) throws IOException {
        byte[] buffer = new byte[DEFAULT_BUFFER_SIZE];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) >= 0) {
            out.write(buffer, 0, read);
            total += read;
            if (counter != null) {
                counter.increment(read);
            }
        }
        out.flush();
        return total;
    }

    /**
     * Reads a single line of text from an input stream.
     * The line is considered terminated by CRLF (\r\n) or LF (\n).
     *
     * @param in The input stream to read from.
     * @return The line read, or null if the end of the stream is reached.
     * @throws IOException If an I/O error occurs.
     */
    public static String readLine(InputStream in) throws IOException {
        return readLine(in, 8192);
    }

    /**
     * Reads a single line of text from an input stream with a maximum length limit.
     * Decodes as ISO-8859-1, matching HTTP/1.1 wire encoding.
     *
     * @param in        The input stream to read from.
     * @param maxLength The maximum allowed length of the line.
     * @return The line read, or null if the end of the stream is reached.
     * @throws IOException If an I/O error occurs or the line exceeds maxLength.
     */
    public static String readLine(InputStream in, int maxLength) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int len = 0;
        int c;
        while ((c = in.read()) != -1) {
            if (c == '\n') {
                break;
            }
            if (c != '\r') {
                if (++len > maxLength) {
                    throw new IOException("Line length exceeds maximum allowed length of " + maxLength);
                }
                buf.write(c);
            }
        }
        if (c == -1 && len == 0) {
            return null;
        }
        return buf.toString(StandardCharsets.ISO_8859_1);
    }

    /**
     * Reads a {@code Transfer-Encoding: chunked} request body, including its
     * trailer section.
     *
     * @param in      The connection stream positioned at the first chunk size.
     * @param maxSize Maximum accepted body size.
     * @return The de-chunked body.
     * @throws IOException       If the stream ends early.
     * @throws ProtocolException If the framing is malformed or the body too large.
     */
    public static byte[] readChunkedBody(InputStream in, long maxSize) throws IOException {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        while (true) {
            String sizeLine = readLine(in);
            if (sizeLine == null) {
                throw new IOException("Unexpected end of chunked body");
            }
            int ext = sizeLine.indexOf(';');
            String hex = (ext >= 0 ? sizeLine.substring(0, ext) : sizeLine).trim();
            long size;
            try {
                size = Long.parseLong(hex, 16);
            } catch (NumberFormatException e) {
                throw new ProtocolException("Invalid chunk size: " + sizeLine, e);
            }
            if (size < 0 || body.size() + size > maxSize) {
                throw new ProtocolException("Chunked request body exceeds " + maxSize + " bytes");
            }
            if (size == 0) {
                String trailer;
                while ((trailer = readLine(in)) != null && !trailer.isEmpty()) {
                    log.trace("Ignoring chunked trailer {}", trailer);
                }
                return body.toByteArray();
            }
            body.write(in.readNBytes((int) size));
            readLine(in);
        }
    }

    /**
     * Reads at most {@code limit + 1} bytes, so callers can tell whether the
     * stream is longer than {@code limit}.
     *
     * @param in    The stream.
     * @param limit The size limit.
     * @return The bytes read.
     * @throws IOException If reading fails.
     */
    public static byte[] readAtMost(InputStream in, long limit) throws IOException {
        int cap = (int) Math.min(Integer.MAX_VALUE - 8L, limit + 1);
        return in.readNBytes(cap);
    }

    /**
     * Wraps a content-encoded stream with its decoder. An empty body decodes to
     * an empty stream whatever its coding.
     *
     * @param in       The encoded stream.
     * @param encoding The {@code Content-Encoding} value, or null for identity.
     * @return The decoding stream, or null when the coding is not supported.
     * @throws IOException If the gzip header cannot be read.
     */
    public static InputStream decodeContent(InputStream in, String encoding) throws IOException {
        if (encoding == null) {
            return in;
        }
        switch (encoding.trim().toLowerCase(Locale.ROOT)) {
            case "identity" -> {
                return in;
            }
            case "gzip", "x-gzip" -> {
                PushbackInputStream pin = new PushbackInputStream(in, 1);
                if (isEmpty(pin)) {
                    return InputStream.nullInputStream();
                }
                return new GZIPInputStream(pin, DEFAULT_BUFFER_SIZE);
            }
            case "deflate" -> {
                // zlib-wrapped per RFC 9110, but some servers send raw deflate
                PushbackInputStream pin = new PushbackInputStream(in, 2);
                byte[] header = pin.readNBytes(2);
                if (header.length == 0) {
                    return InputStream.nullInputStream();
                }
                pin.unread(header);
                boolean zlib = header.length == 2 && (header[0] & 0x0F) == 8
                        && (((header[0] & 0xFF) << 8) | (header[1] & 0xFF)) % 31 == 0;
                return new InflaterInputStream(pin, new Inflater(!zlib), DEFAULT_BUFFER_SIZE);
            }
            default -> {
                return null;
            }
        }
    }

    private static boolean isEmpty(PushbackInputStream in) throws IOException {
        int first = in.read();
        if (first == -1) {
            return true;
        }
        in.unread(first);
        return false;
    }

    /**
     * Creates a factory for named daemon threads.
     *
     * @param prefix Thread name prefix; a sequence number is appended.
     * @return The factory.
     */
    public static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Safely closes a resource without throwing exceptions.
     *
     * @param closeable The resource to close.
     */
    public static void closeQuietly(AutoCloseable closeable) {
        closeQuietly(closeable, "resource");
    }

    /**
     * Safely closes a resource, logging any exceptions.
     *
     * @param closeable The resource to close.
     * @param name      Name of the resource for logging.
     */
    public static void closeQuietly(AutoCloseable closeable, String name) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.debug("Error closing {}: {}", name, e.getMessage());
            }
        }
    }
}
