package com.minibrowser.proxy.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of the runtime injected into proxied HTML pages.
 */
public class ShimConfig {
    /** Prefix of every message type posted to the parent frame. */
    private String messagePrefix = "ENHANCED_BROWSER_";

    /** Interval in milliseconds between navigation checks. */
    private long navigationPollInterval = 1500;

    /** Enabled hooks by identifier. Null means all hooks. */
    private List<String> hooks;

    public String getMessagePrefix() {
        return messagePrefix;
    }

    public void setMessagePrefix(String messagePrefix) {
        this.messagePrefix = messagePrefix;
    }

    public long getNavigationPollInterval() {
        return navigationPollInterval;
    }

    public void setNavigationPollInterval(long navigationPollInterval) {
        this.navigationPollInterval = navigationPollInterval;
    }

    public List<String> getHooks() {
        return hooks == null ? null : Collections.unmodifiableList(hooks);
    }

    public void setHooks(List<String> hooks) {
        this.hooks = hooks == null ? null : new ArrayList<>(hooks);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ShimConfig that = (ShimConfig) o;
        return navigationPollInterval == that.navigationPollInterval
                && Objects.equals(messagePrefix, that.messagePrefix)
                && Objects.equals(hooks, that.hooks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messagePrefix, navigationPollInterval, hooks);
    }
}
