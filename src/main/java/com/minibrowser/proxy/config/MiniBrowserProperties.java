package com.minibrowser.proxy.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root configuration object for the Mini Browser proxy.
 * Maps to the top-level structure of application.yml.
 */
public class MiniBrowserProperties {
    /**
     * List of proxy listener configurations.
     */
    private List<ProxyServerConfig> proxies;

    /**
     * Injected runtime configuration, shared by all listeners.
     */
    private ShimConfig shim = new ShimConfig();

    /**
     * Access log configuration.
     */
    private LoggingConfig logging = new LoggingConfig();

    /**
     * Administration and metrics configuration.
     */
    private AdminConfig admin = new AdminConfig();

    public List<ProxyServerConfig> getProxies() {
        return proxies == null ? null : Collections.unmodifiableList(proxies);
    }

    public void setProxies(List<ProxyServerConfig> proxies) {
        this.proxies = proxies == null ? null : new ArrayList<>(proxies);
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ShimConfig getShim() {
        return shim;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setShim(ShimConfig shim) {
        this.shim = shim;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public LoggingConfig getLogging() {
        return logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setLogging(LoggingConfig logging) {
        this.logging = logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }
}
