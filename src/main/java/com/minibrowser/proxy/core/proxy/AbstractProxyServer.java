package com.minibrowser.proxy.core.proxy;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import com.minibrowser.proxy.config.ProxyServerConfig;
import com.minibrowser.proxy.config.UpstreamProxyConfig;
import com.minibrowser.proxy.core.services.LoggingService;
import com.minibrowser.proxy.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for socket listeners.
 * Handles server lifecycle, connection limits, executor management and
 * connection metrics.
 */
public abstract class AbstractProxyServer implements ProxyServer {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    /** Configuration for this listener. */
    protected final ProxyServerConfig config;

    /** Service for the access log. */
    protected final LoggingService loggingService;

    /** Micrometer registry for metrics. */
    protected final MeterRegistry registry;

    /** Executor for connection handlers, one task per connection. */
    protected final ExecutorService executor;

    /** Semaphore to enforce the maximum number of concurrent connections. */
    protected final Semaphore connectionSemaphore;

    /** Set of active client sockets for graceful shutdown. */
    protected final Set<Socket> activeSockets = ConcurrentHashMap.newKeySet();

    /** Tag value identifying this listener in metrics. */
    protected final String metricName;

    /** The main server socket listening for incoming connections. */
    protected volatile ServerSocket serverSocket;

    private final Counter totalConnections;
    private final Counter connectionErrors;
    private final Meter activeGauge;

    /**
     * Latch released once {@code serverSocket.bind()} has completed (successfully
     * or not), so {@code ProxyManager} can wait for the listener to become ready.
     */
    private final CountDownLatch bindLatch = new CountDownLatch(1);
    private volatile boolean bindSuccess = false;

    /**
     * Initializes the listener with shared services and configuration.
     * 
     * @param config         The server configuration.
     * @param loggingService The access log.
     * @param registry       The Micrometer meter registry.
     */
    protected AbstractProxyServer(ProxyServerConfig config, LoggingService loggingService, MeterRegistry registry) {
        this.config = config;
        this.loggingService = loggingService;
        this.registry = registry;
        this.metricName = config.key().replace(" ", "_").toLowerCase(Locale.ROOT);
        this.executor = Executors.newCachedThreadPool(IoUtils.daemonThreadFactory("proxy-" + metricName));
        this.connectionSemaphore = new Semaphore(config.getMaxConnections());

        String type = config.getType() != null ? config.getType().toLowerCase(Locale.ROOT) : "embed";

        this.totalConnections = Counter.builder("proxy.connections.total")
                .tag("type", type)
                .tag("name", metricName)
                .description("Total number of accepted connections")
                .register(registry);

        this.connectionErrors = Counter.builder("proxy.connections.errors")
                .tag("type", type)
                .tag("name", metricName)
                .description("Total number of connection errors")
                .register(registry);

        this.activeGauge = Gauge.builder("proxy.connections.active", activeSockets, Set::size)
                .tag("type", type)
                .tag("name", metricName)
                .description("Current number of active connections")
                .register(registry);
    }

    /**
     * Starts the listener. Binds to the configured port and enters the accept
     * loop.
     */
    @Override
    public void start() {
        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            InetSocketAddress bindAddr = config.getBindAddress() != null
                    ? new InetSocketAddress(config.getBindAddress(), config.getPort())
                    : new InetSocketAddress(config.getPort());
            serverSocket.bind(bindAddr);
            bindSuccess = true;
            bindLatch.countDown();
            log.info("{} started on {}:{} (prefix {})", getProxyName(),
                    config.getBindAddress() != null ? config.getBindAddress() : "0.0.0.0", getLocalPort(),
                    config.getPrefix());

            while (!serverSocket.isClosed()) {
                if (!acceptAndProcessNextClient()) {
                    break;
                }
            }
        } catch (IOException e) {
            bindLatch.countDown();
            connectionErrors.increment();
            log.error("{} server error on port {}: {}", getProxyName(), config.getPort(), e.getMessage(), e);
        }
    }

    /**
     * Accepts and processes the next incoming client connection.
     * 
     * @return {@code true} to continue the accept loop, {@code false} if the loop
     *         should terminate.
     */
    private boolean acceptAndProcessNextClient() {
        try {
            Socket client = serverSocket.accept();
            processClient(client);
            return true;
        } catch (SocketException e) {
            if (serverSocket.isClosed()) {
                return false;
            }
            connectionErrors.increment();
            log.error("{} accept error on port {}: {}", getProxyName(), config.getPort(), e.getMessage());
            return true;
        } catch (IOException e) {
            connectionErrors.increment();
            log.error("{} I/O error during accept on port {}: {}", getProxyName(), config.getPort(),
                    e.getMessage());
            return true;
        }
    }

    /**
     * Waits for the listener to finish binding to its port.
     * 
     * @param timeout Maximum time to wait.
     * @param unit    Unit for the timeout.
     * @return {@code true} if the bind completed successfully within the timeout.
     */
    public boolean awaitBind(long timeout, TimeUnit unit) {
        try {
            return bindLatch.await(timeout, unit) && bindSuccess;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * @return The bound port, or the configured port before binding.
     */
    public int getLocalPort() {
        ServerSocket ss = serverSocket;
        return ss != null && ss.isBound() ? ss.getLocalPort() : config.getPort();
    }

    private void processClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();

        totalConnections.increment();
        try {
            client.setTcpNoDelay(true);
            client.setSoTimeout(config.getTimeout() > 0 ? config.getTimeout() : 60000);
        } catch (SocketException e) {
            log.debug("{} failed to configure client socket: {}", getProxyName(), e.getMessage());
        }

        if (connectionSemaphore.tryAcquire()) {
            activeSockets.add(client);
            executor.submit(() -> {
                try {
                    handleClient(client);
                } catch (Exception e) {
                    connectionErrors.increment();
                    log.error("{} unexpected error handling client {}: {}", getProxyName(), remoteAddr, e.getMessage(),
                            e);
                } finally {
                    activeSockets.remove(client);
                    connectionSemaphore.release();
                    IoUtils.closeQuietly(client, "client socket");
                }
            });
        } else {
            log.warn("{} connection limit reached ({})", getProxyName(), config.getMaxConnections());
            IoUtils.closeQuietly(client, "limit reached client socket");
        }
    }

    /**
     * Stops the listener. Closes the server socket and all active client
     * connections.
     */
    @Override
    public void stop() {
        log.info("Stopping {} server on port {}...", getProxyName(), getLocalPort());
        try {
            if (serverSocket != null) {
                serverSocket.close();
            }
        } catch (IOException e) {
            log.error("{} failed to close server socket: {}", getProxyName(), e.getMessage(), e);
        }

        for (Socket s : activeSockets) {
            IoUtils.closeQuietly(s);
        }
        activeSockets.clear();

        registry.remove(totalConnections);
        registry.remove(connectionErrors);
        registry.remove(activeGauge);

        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("{} executor did not terminate cleanly after 5 s", getProxyName());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ProxyServerConfig getConfig() {
        return config;
    }

    /**
     * Opens a TCP connection to a target host, either directly or through the
     * configured upstream proxy.
     * 
     * @param targetHost Target host name or IP.
     * @param port       Target port.
     * @return Connected socket.
     * @throws IOException If connection fails.
     */
    protected Socket connectToTarget(String targetHost, int port) throws IOException {
        UpstreamProxyConfig upstream = config.getUpstreamProxy();
        int timeout = config.getTimeout() > 0 ? config.getTimeout() : 10000;

        if (upstream != null) {
            log.debug("{} chaining via upstream proxy {}:{}", getProxyName(), upstream.getHost(), upstream.getPort());
            return UpstreamConnector.connect(targetHost, port, upstream, timeout);
        }
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(targetHost, port), timeout);
            return socket;
        } catch (IOException e) {
            IoUtils.closeQuietly(socket, "target socket");
            throw e;
        }
    }

    /**
     * @return Descriptive name of the listener for logs.
     */
    protected abstract String getProxyName();

    /**
     * Handles an accepted client connection on an executor thread.
     * 
     * @param client The accepted client socket.
     */
    protected abstract void handleClient(Socket client);
}
