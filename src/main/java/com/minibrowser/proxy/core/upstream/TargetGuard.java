package com.minibrowser.proxy.core.upstream;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Set;

import com.minibrowser.proxy.core.codec.UrlCodec;
import com.minibrowser.proxy.core.exceptions.TargetNotAllowedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refuses targets that resolve to internal addresses when
 * {@code blockPrivateAddresses} is enabled.
 */
public class TargetGuard {

    private static final Logger log = LoggerFactory.getLogger(TargetGuard.class);

    private static final Set<String> BLOCKED_HOSTS = Set.of("localhost", "metadata.google.internal");

    /**
     * Name resolution seam.
     */
    @FunctionalInterface
    public interface HostResolver {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }

    private final boolean enabled;
    private final HostResolver resolver;

    public TargetGuard(boolean enabled) {
        this(enabled, InetAddress::getAllByName);
    }

    public TargetGuard(boolean enabled, HostResolver resolver) {
        this.enabled = enabled;
        this.resolver = resolver;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Checks a target.
     *
     * @param target The decoded target URL.
     * @throws TargetNotAllowedException if the guard is enabled and the host is
     *                                   internal.
     */
    public void check(URI target) {
        if (!enabled) {
            return;
        }
        String host = UrlCodec.hostOf(target);
        if (host == null) {
            throw new TargetNotAllowedException("Target has no host");
        }
        String h = host.toLowerCase(Locale.ROOT);
        if (h.startsWith("[") && h.endsWith("]")) {
            h = h.substring(1, h.length() - 1);
        }
        if (BLOCKED_HOSTS.contains(h) || h.endsWith(".localhost")) {
            throw new TargetNotAllowedException("Target host is not allowed: " + host);
        }
        InetAddress[] addresses;
        try {
            addresses = resolver.resolve(h);
        } catch (UnknownHostException e) {
            // left to the fetch, which reports it as an upstream error
            log.debug("Target guard could not resolve {}: {}", host, e.getMessage());
            return;
        }
        for (InetAddress address : addresses) {
            if (isInternal(address)) {
                log.warn("Blocked request to {} resolving to internal address {}", host, address.getHostAddress());
                throw new TargetNotAllowedException("Target resolves to an internal address: " + host);
            }
        }
    }

    /**
     * @param address A resolved address.
     * @return true for loopback, site-local, link-local, wildcard, multicast and
     *         unique local IPv6 addresses.
     */
    static boolean isInternal(InetAddress address) {
        if (address.isLoopbackAddress() || address.isSiteLocalAddress() || address.isLinkLocalAddress()
                || address.isAnyLocalAddress() || address.isMulticastAddress()) {
            return true;
        }
        byte[] raw = address.getAddress();
        if (address instanceof Inet6Address) {
            // fc00::/7
            return (raw[0] & 0xFE) == 0xFC;
        }
        // 100.64.0.0/10 carrier-grade NAT
        return (raw[0] & 0xFF) == 100 && (raw[1] & 0xC0) == 64;
    }
}
