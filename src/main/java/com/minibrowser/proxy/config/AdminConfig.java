package com.minibrowser.proxy.config;

import java.util.Objects;

/**
 * Configuration for the administration server (health check and metrics).
 */
public class AdminConfig {
    private boolean enabled = true;
    private int port = 9090;
    /** Bind address for the admin server. Defaults to loopback. */
    private String bindAddress = "127.0.0.1";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Gets the port for the admin server. {@code 0} picks a free port.
     * 
     * @return the port number.
     */
    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public void setBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
    }

    /**
     * Checks whether another configuration needs a different listener.
     *
     * @param other The configuration to compare with.
     * @return true if enabled flag, port or bind address differ.
     */
    public boolean listenerDiffers(AdminConfig other) {
        return other.enabled != enabled || other.port != port || !Objects.equals(other.bindAddress, bindAddress);
    }
}
