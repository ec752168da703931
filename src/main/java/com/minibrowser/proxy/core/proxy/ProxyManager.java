package com.minibrowser.proxy.core.proxy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import com.minibrowser.proxy.config.MiniBrowserProperties;
import com.minibrowser.proxy.config.ProxyServerConfig;
import com.minibrowser.proxy.core.exceptions.ProxyException;
import com.minibrowser.proxy.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the configured proxy listeners.
 * Manages starting, stopping, and dynamic reloading of servers.
 */
public class ProxyManager {

    private static final Logger log = LoggerFactory.getLogger(ProxyManager.class);

    private final MiniBrowserProperties properties;
    private final ProxyServerFactory factory;
    private final Map<String, ProxyServer> activeServers = new ConcurrentHashMap<>();
    private final ExecutorService executor = Executors.newCachedThreadPool(IoUtils.daemonThreadFactory("listener"));

    /**
     * Creates a ProxyManager with the specified configuration and factory.
     * 
     * @param properties Root configuration properties.
     * @param factory    Factory to create server instances.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ProxyManager(MiniBrowserProperties properties, ProxyServerFactory factory) {
        this.properties = properties;
        this.factory = factory;
    }

    /**
     * Starts all listeners defined in the initial configuration.
     */
    public void startServers() {
        refreshServers(properties.getProxies());
    }

    /**
     * Updates the set of running listeners to match a new configuration.
     * Listeners whose configuration is unchanged keep running.
     * 
     * @param newConfigs The updated list of listener configurations.
     */
    public synchronized void refreshServers(List<ProxyServerConfig> newConfigs) {
        if (newConfigs == null) {
            newConfigs = List.of();
        }

        Map<String, ProxyServerConfig> newConfigMap = new HashMap<>();
        for (ProxyServerConfig config : newConfigs) {
            newConfigMap.put(config.key(), config);
        }

        for (String activeKey : new ArrayList<>(activeServers.keySet())) {
            if (!newConfigMap.containsKey(activeKey)) {
                stopServer(activeKey);
            }
        }

        for (Map.Entry<String, ProxyServerConfig> entry : newConfigMap.entrySet()) {
            String key = entry.getKey();
            ProxyServerConfig newConfig = entry.getValue();

            ProxyServer activeServer = activeServers.get(key);
            if (activeServer == null) {
                startServer(newConfig);
            } else if (!activeServer.getConfig().equals(newConfig)) {
                log.info("Configuration changed for listener {}. Restarting...", key);
                stopServer(key);
                startServer(newConfig);
            }
        }
    }

    /**
     * Recreates every running listener, e.g. after the shared shim settings
     * changed.
     *
     * @param configs The listener configurations to start.
     */
    public synchronized void restartAll(List<ProxyServerConfig> configs) {
        for (String key : new ArrayList<>(activeServers.keySet())) {
            stopServer(key);
        }
        refreshServers(configs);
    }

    /**
     * @return The running listeners keyed by {@link ProxyServerConfig#key()}.
     */
    public Map<String, ProxyServer> getActiveServers() {
        return Collections.unmodifiableMap(activeServers);
    }

    private void startServer(ProxyServerConfig config) {
        try {
            ProxyServer server = factory.create(config);
            executor.submit(server::start);
            // Only register listeners that actually bound within 2 s.
            if (server instanceof AbstractProxyServer abs && abs.awaitBind(2, TimeUnit.SECONDS)) {
                activeServers.put(config.key(), server);
                log.info("Started {} listener {} on port {}", config.getType(), config.key(), abs.getLocalPort());
            } else {
                log.error("Listener {} failed to bind on port {} within 2 s", config.key(), config.getPort());
                server.stop();
            }
        } catch (ProxyException e) {
            log.error("Failed to start listener {}: {}", config.key(), e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error starting listener {}: {}", config.key(), e.getMessage(), e);
        }
    }

    private void stopServer(String key) {
        ProxyServer server = activeServers.remove(key);
        if (server != null) {
            log.info("Stopping listener {}...", key);
            try {
                server.stop();
            } catch (Exception e) {
                log.error("Error stopping listener {}: {}", key, e.getMessage());
            }
        }
    }

    /**
     * Stops all active listeners and shuts down the internal executor.
     */
    public void stopAll() {
        log.info("Stopping all listeners...");
        for (String key : new ArrayList<>(activeServers.keySet())) {
            stopServer(key);
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("ProxyManager executor did not terminate cleanly after 5 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
