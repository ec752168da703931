package com.minibrowser.proxy.core.rewrite;

/**
 * A single resource reference seen during rewriting.
 *
 * @param original The raw value as it appeared in the document.
 * @param absolute The resolved absolute URL, or null when the value was left
 *                 untouched.
 * @param proxied  The value to emit: the proxy-relative URL, or
 *                 {@code original} when the value was left untouched.
 */
public record ProxiedReference(String original, String absolute, String proxied) {

    static ProxiedReference untouched(String original) {
        return new ProxiedReference(original, null, original);
    }

    public boolean isRewritten() {
        return absolute != null;
    }
}
