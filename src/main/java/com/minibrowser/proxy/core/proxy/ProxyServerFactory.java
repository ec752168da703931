package com.minibrowser.proxy.core.proxy;

import com.minibrowser.proxy.config.MiniBrowserProperties;
import com.minibrowser.proxy.config.ProxyServerConfig;
import com.minibrowser.proxy.core.exceptions.ProxyException;
import com.minibrowser.proxy.core.proxy.impl.embed.EmbedProxyServer;
import com.minibrowser.proxy.core.services.LoggingService;
import com.minibrowser.proxy.core.shim.RuntimeShimBuilder;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Factory for creating {@link ProxyServer} implementations based on configuration.
 */
public class ProxyServerFactory {

    /** Listener type of the embedding proxy. */
    public static final String TYPE_EMBED = "EMBED";

    private final LoggingService loggingService;
    private final MeterRegistry registry;
    private volatile MiniBrowserProperties globalProps;

    /**
     * Creates a new factory with the required shared services.
     * @param loggingService The access log.
     * @param registry The Micrometer meter registry.
     * @param globalProps The global configuration, source of the shim settings.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ProxyServerFactory(LoggingService loggingService, MeterRegistry registry,
            MiniBrowserProperties globalProps) {
        this.loggingService = loggingService;
        this.registry = registry;
        this.globalProps = globalProps;
    }

    /**
     * Replaces the global configuration used for listeners created from now on.
     * @param globalProps The new configuration.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void updateProperties(MiniBrowserProperties globalProps) {
        this.globalProps = globalProps;
    }

    /**
     * Creates a {@link ProxyServer} instance based on the provided configuration.
     * @param config The listener configuration.
     * @return A specialized server implementation.
     * @throws ProxyException if the type is not supported.
     */
    public ProxyServer create(ProxyServerConfig config) {
        String type = config.getType();
        if (type == null) {
            throw new IllegalArgumentException("Proxy type cannot be null");
        }

        if (TYPE_EMBED.equalsIgnoreCase(type)) {
            RuntimeShimBuilder shimBuilder = new RuntimeShimBuilder(globalProps.getShim());
            return new EmbedProxyServer(config, loggingService, registry, shimBuilder);
        }

        throw new ProxyException("Unsupported proxy type: " + type);
    }
}
