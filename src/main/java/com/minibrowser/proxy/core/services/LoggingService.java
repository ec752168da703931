package com.minibrowser.proxy.core.services;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

import com.minibrowser.proxy.config.LoggingConfig;
import com.minibrowser.proxy.config.MiniBrowserProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the access log through SLF4J using a configurable Apache-style
 * format. Destinations (console, file, rotation) are up to the logging
 * backend configuration; lines go to the {@code access} logger.
 */
public class LoggingService {

    private static final Logger accessLog = LoggerFactory.getLogger("access");

    private static final DateTimeFormatter DATE_FORMATTER =
            DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z", Locale.ENGLISH);

    private final AtomicReference<MiniBrowserProperties> properties;

    /**
     * Cached formatted timestamp, refreshed at most once per second.
     */
    private volatile String cachedTimestamp = "";
    /** The epoch second at which {@link #cachedTimestamp} was last produced. */
    private volatile long cachedTimestampSec = 0;

    /**
     * Initializes the LoggingService with the provided configuration.
     * 
     * @param properties The configuration properties containing logging settings.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public LoggingService(MiniBrowserProperties properties) {
        this.properties = new AtomicReference<>(properties);
    }

    /**
     * Values available to the format tokens of one access log line.
     */
    record LogRecord(String remoteHost, String user, String time, String requestLine,
            String status, String bytes, String method, String query, String rewrite) {
    }

    /**
     * Updates the logging configuration.
     * 
     * @param properties The new configuration properties.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void updateProperties(MiniBrowserProperties properties) {
        this.properties.set(properties);
    }

    /**
     * Logs a proxied request using the configured format.
     * 
     * @param remoteHost Client's IP or hostname.
     * @param method     HTTP method (GET, POST, etc.).
     * @param uri        Request URI as received.
     * @param status     HTTP response status code.
     * @param bytes      Number of body bytes sent to the client.
     * @param rewrite    Rewrite path taken, or null when none applied.
     */
    public void logRequest(String remoteHost, String method, String uri, int status, long bytes, String rewrite) {
        LoggingConfig logCfg = properties.get().getLogging();
        String time = "[" + getCachedTimestamp() + "]";
        String byteStr = bytes > 0 ? String.valueOf(bytes) : "-";
        String requestLine = method + " " + uri + " HTTP/1.1";
        int queryIndex = uri.indexOf('?');
        String query = queryIndex != -1 ? uri.substring(queryIndex) : "";

        LogRecord logRecord = new LogRecord(remoteHost, "-", time, requestLine, String.valueOf(status), byteStr,
                method, query, rewrite != null ? rewrite : "-");
        accessLog.info(formatLogLine(logCfg.getFormat(), logRecord));
    }

    /**
     * Logs the upstream side of a response when {@code logResponse} is enabled.
     *
     * @param method   HTTP method.
     * @param target   Final upstream URL.
     * @param status   Upstream status code.
     * @param rewrite  Rewrite path taken.
     */
    public void logResponse(String method, String target, int status, String rewrite) {
        if (properties.get().getLogging().isLogResponse()) {
            accessLog.info("[RESPONSE] {} {} -> STATUS: {}, REWRITE: {}", method, target, status, rewrite);
        }
    }

    /**
     * Formats a log line based on the Apache-style format string.
     * Supported tokens: %h, %l, %u, %t, %r, %>s, %b, %m, %q, %R.
     * 
     * @param format    The format string.
     * @param logRecord The logging context containing all request data.
     * @return The formatted log line.
     */
    String formatLogLine(String format, LogRecord logRecord) {
        StringBuilder sb = new StringBuilder(format.length() + 100);
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i);
            if (c == '%' && i + 1 < format.length()) {
                i = appendToken(sb, format, i, logRecord);
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private int appendToken(StringBuilder sb, String format, int currentIdx, LogRecord logRecord) {
        char next = format.charAt(currentIdx + 1);
        int skip = 1;
        switch (next) {
            case 'h' -> sb.append(logRecord.remoteHost());
            case 'l' -> sb.append('-');
            case 'u' -> sb.append(logRecord.user());
            case 't' -> sb.append(logRecord.time());
            case 'r' -> sb.append(logRecord.requestLine());
            case 'm' -> sb.append(logRecord.method());
            case 'q' -> sb.append(logRecord.query());
            case 'R' -> sb.append(logRecord.rewrite());
            case '>' -> {
                if (currentIdx + 2 < format.length() && format.charAt(currentIdx + 2) == 's') {
                    sb.append(logRecord.status());
                    skip = 2;
                } else {
                    sb.append('%');
                    skip = 0;
                }
            }
            case 'b' -> sb.append(logRecord.bytes());
            default -> {
                sb.append('%');
                skip = 0;
            }
        }
        return currentIdx + skip + 1;
    }

    /**
     * Returns a formatted timestamp string for the current second, e.g.
     * {@code 22/Feb/2026:23:30:00 +0900}.
     */
    private String getCachedTimestamp() {
        long nowSec = Instant.now().getEpochSecond();
        if (nowSec != cachedTimestampSec) {
            cachedTimestampSec = nowSec;
            cachedTimestamp = ZonedDateTime.now().format(DATE_FORMATTER);
        }
        return cachedTimestamp;
    }
}
