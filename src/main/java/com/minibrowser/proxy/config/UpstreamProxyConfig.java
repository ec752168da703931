package com.minibrowser.proxy.config;

import java.util.Objects;

/**
 * Configuration for an HTTP forward proxy that outbound requests are sent
 * through.
 */
public class UpstreamProxyConfig {
    private String host;
    private int port;
    private String username;
    private String password;

    public UpstreamProxyConfig() {
    }

    public UpstreamProxyConfig(String host, int port) {
        this.host = host;
        this.port = port;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    /**
     * @return true when both username and password are set.
     */
    public boolean hasCredentials() {
        return username != null && password != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UpstreamProxyConfig that = (UpstreamProxyConfig) o;
        return port == that.port &&
                Objects.equals(host, that.host) &&
                Objects.equals(username, that.username) &&
                Objects.equals(password, that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, username, password);
    }
}
