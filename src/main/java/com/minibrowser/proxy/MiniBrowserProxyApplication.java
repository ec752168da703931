package com.minibrowser.proxy;

import com.minibrowser.proxy.config.MiniBrowserProperties;
import com.minibrowser.proxy.config.ProxyServerConfig;
import com.minibrowser.proxy.core.exceptions.ConfigException;
import com.minibrowser.proxy.core.exceptions.ProxyException;
import com.minibrowser.proxy.core.proxy.ProxyManager;
import com.minibrowser.proxy.core.proxy.ProxyServerFactory;
import com.minibrowser.proxy.core.services.LoggingService;
import com.minibrowser.proxy.core.services.MetricsService;
import com.minibrowser.proxy.core.shim.RuntimeShimBuilder;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.HashSet;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Scanner;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Mini Browser proxy.
 * Handles command-line arguments, configuration loading, and application
 * lifecycle.
 */
@Command(name = "mini-browser-proxy", mixinStandardHelpOptions = true, version = "1.0.0",
        description = "Embedding reverse proxy that lets frame-hostile pages be shown inside an iframe.")
public class MiniBrowserProxyApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MiniBrowserProxyApplication.class);

    /**
     * Path to the YAML configuration file.
     */
    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)", defaultValue = "application.yml")
    private String configPath;

    private ProxyManager proxyManager;
    private ProxyServerFactory factory;
    private LoggingService loggingService;
    private MetricsService metricsService;
    private volatile MiniBrowserProperties properties;

    /** Latch to block the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /** Flag to signal background threads to stop. */
    private final AtomicBoolean running = new AtomicBoolean(true);

    /** Assigned once by the watcher thread, read during shutdown. */
    private volatile WatchService watchService;

    /** Reference to the registered shutdown hook for cleanup. */
    private Thread shutdownHook;

    /**
     * Main method to launch the application.
     *
     * @param args Command-line arguments.
     */
    public static void main(String[] args) {
        new CommandLine(new MiniBrowserProxyApplication()).execute(args);
    }

    /**
     * Bootstraps the application, starts the listeners, and sets up configuration
     * watching.
     *
     * @return Exit code (0 for success, 1 for failure).
     */
    @Override
    public Integer call() {
        try {
            log.info("Starting Mini Browser proxy...");

            MiniBrowserProperties props = loadConfig(configPath);
            this.properties = props;
            this.loggingService = new LoggingService(props);
            this.metricsService = new MetricsService(props);

            this.factory = new ProxyServerFactory(loggingService, metricsService.getRegistry(), props);
            this.proxyManager = new ProxyManager(props, factory);

            proxyManager.startServers();

            startFileWatcher();
            if (System.getProperty("minibrowser.no-command-listener") == null) {
                startCommandListener();
            }

            if (System.getProperty("minibrowser.no-shutdown-hook") == null) {
                this.shutdownHook = new Thread(this::stop, "ShutdownHook");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            shutdownLatch.await();
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration Error: {}", e.getMessage());
            return 1;
        } catch (ProxyException e) {
            log.error("Fatal proxy error: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            log.warn("Application interrupted");
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            log.error("Unexpected fatal error", e);
            return 1;
        } finally {
            stop();
        }
    }

    /**
     * Starts an interactive command listener on System.in using a daemon thread.
     */
    private void startCommandListener() {
        Thread listener = new Thread(() -> {
            try (Scanner scanner = new Scanner(System.in, StandardCharsets.UTF_8)) {
                log.info("Interactive console ready. Type 'reload' to refresh config or 'stop' to exit.");
                while (running.get() && readAndProcessCommand(scanner)) {
                    // Loop continues as long as input is available and stop hasn't been signaled
                }
            } catch (Exception e) {
                if (running.get()) {
                    log.warn("Command listener fatal error: {}", e.getMessage(), e);
                }
            }
        }, "CommandListener");
        listener.setDaemon(true);
        listener.start();
    }

    /**
     * Reads and processes the next command from the scanner.
     *
     * @param scanner Input scanner.
     * @return True if a command was processed, false if input was closed.
     */
    private boolean readAndProcessCommand(Scanner scanner) {
        try {
            if (scanner.hasNextLine()) {
                processCommand(scanner.nextLine().trim().toLowerCase(Locale.ROOT));
                return true;
            }
        } catch (NoSuchElementException e) {
            log.debug("Console input closed");
        }
        return false;
    }

    /**
     * Processes a single interactive command from the console.
     *
     * @param command The command string.
     */
    void processCommand(String command) {
        if (command.isEmpty()) {
            return;
        }

        switch (command) {
            case "reload" -> reloadConfiguration();
            case "stop", "exit", "quit" -> stop();
            case "help" -> log.info("Available commands: reload, stop, exit, quit, help");
            default -> log.warn("Unknown command: {}. Type 'help' for available commands.", command);
        }
    }

    /**
     * Gracefully stops all listeners, the configuration watcher, and background
     * listeners. Also unregisters the shutdown hook.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down Mini Browser proxy...");

            unregisterShutdownHook();

            if (proxyManager != null) {
                proxyManager.stopAll();
            }
            if (metricsService != null) {
                metricsService.shutdown();
            }
            closeWatchService();
            shutdownLatch.countDown();
        }
    }

    /**
     * @return The listener manager, null before startup.
     */
    ProxyManager getProxyManager() {
        return proxyManager;
    }

    /**
     * @return The metrics service, null before startup.
     */
    MetricsService getMetricsService() {
        return metricsService;
    }

    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown already in progress");
            }
        }
    }

    private void closeWatchService() {
        WatchService ws = watchService;
        if (ws != null) {
            try {
                ws.close();
            } catch (IOException e) {
                log.debug("Error closing watch service: {}", e.getMessage());
            }
        }
    }

    /**
     * Reloads the configuration from disk and refreshes the listeners. A change
     * of the shim settings restarts every listener.
     */
    void reloadConfiguration() {
        try {
            log.info("Reloading configuration from {}...", configPath);
            MiniBrowserProperties newProps = loadConfig(configPath);
            boolean shimChanged = !newProps.getShim().equals(properties.getShim());
            this.properties = newProps;

            this.loggingService.updateProperties(newProps);
            this.metricsService.updateProperties(newProps);
            this.factory.updateProperties(newProps);

            if (shimChanged) {
                log.info("Shim configuration changed. Restarting all listeners...");
                proxyManager.restartAll(newProps.getProxies());
            } else {
                proxyManager.refreshServers(newProps.getProxies());
            }
            log.info("Configuration reloaded successfully.");
        } catch (ProxyException e) {
            log.error("Failed to reload configuration: {}", e.getMessage());
        }
    }

    /**
     * Starts a background thread to watch for changes in the configuration file.
     * Uses a debounce mechanism to avoid multiple reloads for a single logical
     * change.
     */
    private void startFileWatcher() {
        Thread watcherThread = new Thread(() -> {
            try {
                Path path = Paths.get(configPath).toAbsolutePath();
                Path parent = path.getParent();
                if (parent == null || !path.toFile().exists()) {
                    log.debug("Configuration {} is not a file on disk, not watching it", configPath);
                    return;
                }

                this.watchService = FileSystems.getDefault().newWatchService();
                parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_CREATE);

                log.info("Watching configuration file for changes: {}", path);
                runWatcherLoop(path.getFileName().toString());
            } catch (ClosedWatchServiceException e) {
                log.debug("Watch service closed");
            } catch (InterruptedException e) {
                log.debug("File watcher interrupted");
                Thread.currentThread().interrupt();
            } catch (IOException e) {
                if (running.get()) {
                    log.warn("File watcher error: {}", e.getMessage(), e);
                }
            }
        }, "ConfigWatcher");
        watcherThread.setDaemon(true);
        watcherThread.start();
    }

    /**
     * Executes the main loop for the configuration file watcher.
     *
     * @param fileName The name of the file to watch.
     * @throws InterruptedException If the thread is interrupted.
     */
    private void runWatcherLoop(String fileName) throws InterruptedException {
        // Reload only after 1 s without further events.
        final long debounceNanos = 1_000_000_000L;
        long lastEventNano = 0;

        while (running.get()) {
            WatchKey key = watchService.poll(500, TimeUnit.MILLISECONDS);
            if (key != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.context().toString().equals(fileName)) {
                        lastEventNano = System.nanoTime();
                    }
                }
                if (!key.reset()) {
                    break;
                }
            }

            if (lastEventNano > 0 && System.nanoTime() - lastEventNano >= debounceNanos) {
                lastEventNano = 0;
                reloadConfiguration();
            }
        }
    }

    /**
     * Loads and validates the configuration from the specified path or
     * classpath.
     *
     * @param path Path to the configuration file.
     * @return The loaded properties.
     * @throws ConfigException if configuration cannot be loaded or is invalid.
     */
    static MiniBrowserProperties loadConfig(String path) {
        Yaml yaml = new Yaml(new Constructor(MiniBrowserProperties.class, new LoaderOptions()));

        MiniBrowserProperties props = tryLoadFromFile(yaml, path);
        if (props == null) {
            props = tryLoadFromClasspath(yaml, path);
        }
        if (props == null) {
            throw new ConfigException("Configuration file not found: " + path);
        }
        validate(props);
        return props;
    }

    /**
     * Checks values SnakeYAML cannot check by type alone.
     *
     * @param props The loaded configuration.
     * @throws ConfigException on the first invalid value.
     */
    static void validate(MiniBrowserProperties props) {
        // Fails with ConfigException on unknown hook identifiers.
        new RuntimeShimBuilder(props.getShim());
        if (props.getProxies() == null || props.getProxies().isEmpty()) {
            log.warn("No proxy listeners configured");
            return;
        }
        Set<String> keys = new HashSet<>();
        for (ProxyServerConfig cfg : props.getProxies()) {
            if (cfg.getPort() < 0 || cfg.getPort() > 65535) {
                throw new ConfigException("Invalid port " + cfg.getPort() + " for listener " + cfg.key());
            }
            if (cfg.getMaxRedirects() < 0) {
                throw new ConfigException("maxRedirects must not be negative for listener " + cfg.key());
            }
            if (cfg.getMaxRewriteBodySize() <= 0) {
                throw new ConfigException("maxRewriteBodySize must be positive for listener " + cfg.key());
            }
            if (cfg.getMaxConnections() <= 0) {
                throw new ConfigException("maxConnections must be positive for listener " + cfg.key());
            }
            if (cfg.getUpstreamProxy() != null && cfg.getUpstreamProxy().getHost() == null) {
                throw new ConfigException("upstreamProxy.host is required for listener " + cfg.key());
            }
            if (!keys.add(cfg.key())) {
                throw new ConfigException("Duplicate listener " + cfg.key());
            }
        }
    }

    private static MiniBrowserProperties tryLoadFromFile(Yaml yaml, String path) {
        File file = new File(path);
        if (file.exists()) {
            try (InputStream is = new FileInputStream(file)) {
                return requireDocument(yaml.load(is), path);
            } catch (YAMLException e) {
                throw new ConfigException("Invalid YAML in " + path + ": " + e.getMessage(), e);
            } catch (IOException e) {
                throw new ConfigException("Error reading config file: " + path, e);
            }
        }
        return null;
    }

    private static MiniBrowserProperties tryLoadFromClasspath(Yaml yaml, String path) {
        try (InputStream is = MiniBrowserProxyApplication.class.getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                return requireDocument(yaml.load(is), path);
            }
        } catch (YAMLException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }
        return null;
    }

    private static MiniBrowserProperties requireDocument(MiniBrowserProperties props, String path) {
        if (props == null) {
            throw new ConfigException("Configuration file is empty: " + path);
        }
        return props;
    }
}
