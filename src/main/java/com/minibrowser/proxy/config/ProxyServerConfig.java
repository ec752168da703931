package com.minibrowser.proxy.config;

import java.util.Objects;

import com.minibrowser.proxy.core.codec.UrlCodec;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Configuration for one embedding proxy listener.
 */
public class ProxyServerConfig {
    /** Browser-like user agent sent when the caller does not provide one. */
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    /** Unique name for the listener. */
    private String name;

    /** Port to listen on. {@code 0} picks a free port. */
    private int port = 8080;

    /** Server type. Only {@code EMBED} is built in. */
    private String type = "EMBED";

    /** Path prefix the target URL is mounted under. */
    private String prefix = UrlCodec.DEFAULT_PREFIX;

    /** Whether HTTP/1.1 persistent connections are kept open. */
    private boolean keepAlive = true;

    /** Connect and upstream response timeout in milliseconds. Default is 30s. */
    private int timeout = 30000;

    /** Maximum number of upstream redirects to follow. Default is 5. */
    private int maxRedirects = 5;

    /** Maximum concurrent client connections. Default is 10,000. */
    private int maxConnections = 10000;

    /** Local IP address to bind to. Null means all interfaces. */
    private String bindAddress;

    /** HTML and CSS bodies larger than this are passed through without rewriting. */
    private long maxRewriteBodySize = 10L * 1024 * 1024;

    /** Whether targets resolving to private, loopback or link-local addresses are refused. */
    private boolean blockPrivateAddresses = false;

    /** User agent for outbound requests when the caller sends none. */
    private String userAgent = DEFAULT_USER_AGENT;

    /** Upstream HTTP proxy for outbound requests. */
    private UpstreamProxyConfig upstreamProxy;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }

    public boolean isKeepAlive() {
        return keepAlive;
    }

    public void setKeepAlive(boolean keepAlive) {
        this.keepAlive = keepAlive;
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        this.timeout = timeout;
    }

    public int getMaxRedirects() {
        return maxRedirects;
    }

    public void setMaxRedirects(int maxRedirects) {
        this.maxRedirects = maxRedirects;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public void setBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
    }

    public long getMaxRewriteBodySize() {
        return maxRewriteBodySize;
    }

    public void setMaxRewriteBodySize(long maxRewriteBodySize) {
        this.maxRewriteBodySize = maxRewriteBodySize;
    }

    public boolean isBlockPrivateAddresses() {
        return blockPrivateAddresses;
    }

    public void setBlockPrivateAddresses(boolean blockPrivateAddresses) {
        this.blockPrivateAddresses = blockPrivateAddresses;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public UpstreamProxyConfig getUpstreamProxy() {
        return upstreamProxy;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setUpstreamProxy(UpstreamProxyConfig upstreamProxy) {
        this.upstreamProxy = upstreamProxy;
    }

    /**
     * @return The name, or the port when unnamed. Used as the registry key.
     */
    public String key() {
        return name != null ? name : String.valueOf(port);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ProxyServerConfig that = (ProxyServerConfig) o;
        return port == that.port &&
               keepAlive == that.keepAlive &&
               timeout == that.timeout &&
               maxRedirects == that.maxRedirects &&
               maxConnections == that.maxConnections &&
               maxRewriteBodySize == that.maxRewriteBodySize &&
               blockPrivateAddresses == that.blockPrivateAddresses &&
               Objects.equals(name, that.name) &&
               Objects.equals(type, that.type) &&
               Objects.equals(prefix, that.prefix) &&
               Objects.equals(bindAddress, that.bindAddress) &&
               Objects.equals(userAgent, that.userAgent) &&
               Objects.equals(upstreamProxy, that.upstreamProxy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, port, type, prefix, keepAlive, timeout, maxRedirects, maxConnections,
                bindAddress, maxRewriteBodySize, blockPrivateAddresses, userAgent, upstreamProxy);
    }
}
