package com.minibrowser.proxy.core.services;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.minibrowser.proxy.config.AdminConfig;
import com.minibrowser.proxy.config.MiniBrowserProperties;
import com.minibrowser.proxy.core.utils.IoUtils;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service providing application metrics via Micrometer and a simple HTTP admin
 * server with {@code /health} and {@code /metrics}.
 */
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);
    private final PrometheusMeterRegistry registry;
    private HttpServer adminServer;
    private ExecutorService adminExecutor;
    private AdminConfig config;

    public MetricsService(MiniBrowserProperties properties) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.config = properties.getAdmin();
        setupAdminServer();
    }

    private void setupAdminServer() {
        if (!config.isEnabled()) {
            return;
        }

        try {
            this.adminServer = HttpServer.create(new InetSocketAddress(config.getBindAddress(), config.getPort()), 0);
            adminServer.createContext("/health", exchange -> respond(exchange, "OK", "text/plain; charset=utf-8"));
            adminServer.createContext("/metrics", exchange -> respond(exchange, registry.scrape(),
                    "text/plain; version=0.0.4; charset=utf-8"));

            adminExecutor = Executors.newCachedThreadPool(IoUtils.daemonThreadFactory("admin"));
            adminServer.setExecutor(adminExecutor);
            adminServer.start();
            log.info("Admin server started on port {} (/health, /metrics)", getAdminPort());
        } catch (IOException e) {
            log.error("Failed to start admin server: {}", e.getMessage());
            adminServer = null;
        }
    }

    private static void respond(HttpExchange exchange, String body, String contentType) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * @return The bound admin port, or -1 when the admin server is not running.
     */
    public int getAdminPort() {
        return adminServer != null ? adminServer.getAddress().getPort() : -1;
    }

    /**
     * Restarts the admin server if its listener settings changed.
     *
     * @param properties The new configuration.
     */
    public void updateProperties(MiniBrowserProperties properties) {
        AdminConfig newConfig = properties.getAdmin();
        if (config.listenerDiffers(newConfig)) {
            shutdown();
            this.config = newConfig;
            setupAdminServer();
        }
    }

    public void shutdown() {
        if (adminServer != null) {
            log.info("Stopping admin server...");
            adminServer.stop(0);
            adminServer = null;
        }
        if (adminExecutor != null) {
            adminExecutor.shutdownNow();
            adminExecutor = null;
        }
    }
}
