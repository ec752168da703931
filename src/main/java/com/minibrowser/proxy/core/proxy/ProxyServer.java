package com.minibrowser.proxy.core.proxy;

import com.minibrowser.proxy.config.ProxyServerConfig;

/**
 * A listener serving proxied content.
 */
public interface ProxyServer {
    /**
     * Binds the listener and runs the accept loop. Blocks until stopped.
     */
    void start();
    
    /**
     * Stops the listener and releases all associated resources.
     */
    void stop();
    
    /**
     * @return The configuration used by this listener.
     */
    ProxyServerConfig getConfig();
}
