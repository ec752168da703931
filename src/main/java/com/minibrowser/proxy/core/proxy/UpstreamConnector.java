package com.minibrowser.proxy.core.proxy;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import com.minibrowser.proxy.config.UpstreamProxyConfig;
import com.minibrowser.proxy.core.utils.IoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens raw TCP tunnels through an upstream HTTP proxy with {@code CONNECT}.
 */
public class UpstreamConnector {
    private UpstreamConnector() {
        // Utility class
    }

    private static final Logger log = LoggerFactory.getLogger(UpstreamConnector.class);

    /**
     * Connects to a target through an upstream proxy.
     * 
     * @param targetHost Target host.
     * @param targetPort Target port.
     * @param upstream   Upstream proxy configuration.
     * @param timeout    Connection timeout in milliseconds.
     * @return Socket tunnelled to the target.
     * @throws IOException If connection or handshake fails.
     */
    public static Socket connect(String targetHost, int targetPort, UpstreamProxyConfig upstream, int timeout)
            throws IOException {
        Socket proxySocket = new Socket();
        try {
            proxySocket.connect(new InetSocketAddress(upstream.getHost(), upstream.getPort()), timeout);
            performHttpHandshake(proxySocket, targetHost, targetPort, upstream);
            return proxySocket;
        } catch (IOException e) {
            IoUtils.closeQuietly(proxySocket);
            throw e;
        }
    }

    /**
     * Performs the HTTP CONNECT handshake with the upstream proxy.
     * 
     * @param socket   The socket connected to the proxy.
     * @param host     The target host.
     * @param port     The target port.
     * @param upstream The upstream proxy configuration.
     * @throws IOException If the handshake fails or the proxy returns an error.
     */
    static void performHttpHandshake(Socket socket, String host, int port, UpstreamProxyConfig upstream)
            throws IOException {
        OutputStream out = socket.getOutputStream();
        StringBuilder sb = new StringBuilder();
        sb.append("CONNECT ").append(host).append(":").append(port).append(" HTTP/1.1\r\n");
        sb.append("Host: ").append(host).append(":").append(port).append("\r\n");

        if (upstream.hasCredentials()) {
            String auth = upstream.getUsername() + ":" + upstream.getPassword();
            String encoded = Base64.getEncoder().encodeToString(auth.getBytes(StandardCharsets.UTF_8));
            sb.append("Proxy-Authorization: Basic ").append(encoded).append("\r\n");
        }
        sb.append("\r\n");

        out.write(sb.toString().getBytes(StandardCharsets.US_ASCII));
        out.flush();

        InputStream in = socket.getInputStream();
        String line = IoUtils.readLine(in);
        String[] status = line == null ? new String[0] : line.split(" ", 3);
        if (status.length < 2 || !"200".equals(status[1])) {
            throw new IOException("Failed to connect via upstream HTTP proxy: " + line);
        }
        while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
            log.trace("Upstream CONNECT response header: {}", line);
        }
    }
}
