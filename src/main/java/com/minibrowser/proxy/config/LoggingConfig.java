package com.minibrowser.proxy.config;

/**
 * Configuration for the access log.
 */
public class LoggingConfig {
    /**
     * Access log format. Apache-style placeholders {@code %h %l %u %t %r %>s %b %m %q}
     * plus {@code %R} for the rewrite path taken (html, css or passthrough).
     */
    private String format = "%h %l %u %t \"%r\" %>s %b";

    /** Whether to log an extra line per response with the upstream URL and rewrite path. */
    private boolean logResponse = false;

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public boolean isLogResponse() {
        return logResponse;
    }

    public void setLogResponse(boolean logResponse) {
        this.logResponse = logResponse;
    }
}
