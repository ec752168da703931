package com.minibrowser.proxy.core.shim;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.minibrowser.proxy.config.ShimConfig;
import com.minibrowser.proxy.core.exceptions.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the {@code <script>} block injected into every proxied HTML page.
 * <p>
 * The payload is one immediately-invoked function. It starts with the
 * per-page constants ({@code PROXY_PREFIX}, {@code ORIGINAL_URL},
 * {@code MESSAGE_PREFIX}, {@code NAVIGATION_POLL_INTERVAL}), followed by the
 * shared helpers from {@code shim/core.js} and then each enabled
 * {@link ShimHook} in declaration order. Hook sources are loaded once, when
 * the builder is created.
 */
public class RuntimeShimBuilder {

    private static final Logger log = LoggerFactory.getLogger(RuntimeShimBuilder.class);

    static final String CORE_RESOURCE = "shim/core.js";
    static final long DEFAULT_NAVIGATION_POLL_INTERVAL = 1500;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Set<ShimHook> hooks;
    private final long navigationPollInterval;
    private final String messagePrefix;
    private final String coreSource;
    private final Map<ShimHook, String> hookSources = new EnumMap<>(ShimHook.class);

    /**
     * Creates a builder with every hook enabled.
     */
    public RuntimeShimBuilder() {
        this(EnumSet.allOf(ShimHook.class), DEFAULT_NAVIGATION_POLL_INTERVAL, RuntimeShimConfig.DEFAULT_MESSAGE_PREFIX);
    }

    /**
     * Creates a builder from configuration.
     *
     * @param config The shim configuration; a null hook list enables all hooks.
     * @throws ConfigException if a hook identifier is unknown.
     */
    public RuntimeShimBuilder(ShimConfig config) {
        this(parseHooks(config.getHooks()), config.getNavigationPollInterval(), config.getMessagePrefix());
    }

    /**
     * Creates a builder.
     *
     * @param hooks                  The hooks to include.
     * @param navigationPollInterval Milliseconds between navigation checks.
     * @param messagePrefix          Default message type prefix.
     */
    public RuntimeShimBuilder(Collection<ShimHook> hooks, long navigationPollInterval, String messagePrefix) {
        this.hooks = hooks.isEmpty() ? EnumSet.noneOf(ShimHook.class) : EnumSet.copyOf(hooks);
        this.navigationPollInterval = navigationPollInterval > 0 ? navigationPollInterval
                : DEFAULT_NAVIGATION_POLL_INTERVAL;
        this.messagePrefix = messagePrefix != null ? messagePrefix : RuntimeShimConfig.DEFAULT_MESSAGE_PREFIX;
        this.coreSource = loadResource(CORE_RESOURCE);
        for (ShimHook hook : this.hooks) {
            hookSources.put(hook, loadResource(hook.getResource()));
        }
        log.debug("Runtime shim hooks enabled: {}", this.hooks);
    }

    /**
     * @return The enabled hooks.
     */
    public Set<ShimHook> getHooks() {
        return Collections.unmodifiableSet(hooks);
    }

    /**
     * Builds the shim for a page served under {@code proxyPrefix}.
     *
     * @param proxyPrefix The proxy mount prefix.
     * @param originalUrl The absolute URL of the page.
     * @return The {@code <script>} element.
     */
    public String build(String proxyPrefix, String originalUrl) {
        return build(new RuntimeShimConfig(proxyPrefix, originalUrl, messagePrefix));
    }

    /**
     * Builds the shim.
     *
     * @param shimConfig The per-page values.
     * @return The {@code <script>} element.
     */
    public String build(RuntimeShimConfig shimConfig) {
        StringBuilder sb = new StringBuilder(coreSource.length() * 4 + 512);
        sb.append("<script>(function(){\n");
        sb.append("  var PROXY_PREFIX = ").append(jsString(shimConfig.proxyPrefix())).append(";\n");
        sb.append("  var ORIGINAL_URL = ").append(jsString(shimConfig.originalUrl())).append(";\n");
        sb.append("  var MESSAGE_PREFIX = ").append(jsString(shimConfig.messagePrefix())).append(";\n");
        sb.append("  var NAVIGATION_POLL_INTERVAL = ").append(navigationPollInterval).append(";\n");
        sb.append(coreSource);
        for (ShimHook hook : hooks) {
            sb.append(hookSources.get(hook));
        }
        sb.append("})();</script>");
        return sb.toString();
    }

    /**
     * Encodes a value as a JavaScript string literal that is safe inside an
     * HTML {@code <script>} element.
     *
     * @param value The raw string.
     * @return A quoted literal.
     */
    static String jsString(String value) {
        try {
            return MAPPER.writeValueAsString(value)
                    .replace("</", "<\\/")
                    .replace("<!--", "\\u003C!--")
                    .replace("\u2028", "\\u2028")
                    .replace("\u2029", "\\u2029");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode shim constant", e);
        }
    }

    private static Set<ShimHook> parseHooks(List<String> ids) {
        if (ids == null) {
            return EnumSet.allOf(ShimHook.class);
        }
        Set<ShimHook> result = EnumSet.noneOf(ShimHook.class);
        for (String id : ids) {
            try {
                result.add(ShimHook.fromId(id));
            } catch (IllegalArgumentException e) {
                throw new ConfigException(e.getMessage(), e);
            }
        }
        return result;
    }

    private static String loadResource(String name) {
        try (InputStream in = RuntimeShimBuilder.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new ConfigException("Shim resource not found on classpath: " + name);
            }
            String source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return source.endsWith("\n") ? source : source + "\n";
        } catch (IOException e) {
            throw new ConfigException("Failed to read shim resource " + name, e);
        }
    }
}
