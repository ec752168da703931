package com.minibrowser.proxy.core.shim;

import java.util.Locale;

/**
 * The independent behaviours the injected runtime is assembled from. Each
 * hook is a JavaScript fragment on the classpath under {@code shim/}.
 */
public enum ShimHook {
    /** fetch, XMLHttpRequest, sendBeacon, EventSource, WebSocket and service workers. */
    NETWORK("network", "shim/network.js"),
    /** getUserMedia and AudioContext restrictions. */
    MEDIA_GUARD("media-guard", "shim/media-guard.js"),
    /** Rewrites elements inserted or mutated after load. */
    DOM_MUTATION("dom-mutation", "shim/dom-mutation.js"),
    /** Page ready, navigation and error notifications to the parent frame. */
    MESSAGE_BRIDGE("message-bridge", "shim/message-bridge.js"),
    /** Scroll remote control driven by the parent frame. */
    AUTO_SCROLL("auto-scroll", "shim/auto-scroll.js");

    private final String id;
    private final String resource;

    ShimHook(String id, String resource) {
        this.id = id;
        this.resource = resource;
    }

    /**
     * @return The configuration identifier, e.g. {@code media-guard}.
     */
    public String getId() {
        return id;
    }

    public String getResource() {
        return resource;
    }

    /**
     * Looks a hook up by its configuration identifier or enum name.
     *
     * @param value The identifier, case-insensitive.
     * @return The hook.
     * @throws IllegalArgumentException if no hook matches.
     */
    public static ShimHook fromId(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ShimHook hook : values()) {
            if (hook.id.equals(v)) {
                return hook;
            }
        }
        throw new IllegalArgumentException("Unknown shim hook: " + value);
    }
}
