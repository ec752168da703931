package com.minibrowser.proxy.core.rewrite;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.minibrowser.proxy.core.codec.UrlCodec;

/**
 * Rewrites an HTML document so that every resource reference points back at
 * the proxy, and injects the runtime shim.
 * <p>
 * The document is processed in a single pass over {@link HtmlTokenizer}
 * tokens. Everything that is not rewritten is emitted exactly as received.
 */
public final class HtmlRewriter {

    /** Elements whose URL attributes are rewritten. */
    public static final Set<String> REWRITTEN_TAGS = Set.of(
            "a", "link", "img", "script", "iframe", "source", "video", "audio", "form", "base");

    /** Attributes holding a single URL. */
    public static final Set<String> URL_ATTRIBUTES = Set.of("href", "src", "action", "poster", "data");

    private static final String SRCSET = "srcset";
    private static final String STYLE = "style";
    private static final String BASE = "base";

    private HtmlRewriter() {
        // Utility class
    }

    /**
     * Rewrites a document without injecting anything.
     *
     * @param html    The document.
     * @param context The rewrite context.
     * @return The rewritten document.
     */
    public static String rewrite(String html, RewriteContext context) {
        return rewrite(html, context, null);
    }

    /**
     * Rewrites a document and injects {@code shim} right after the first
     * {@code <head>} start tag. Without one, the shim goes before
     * {@code </head>}, then before {@code </body>}, and is appended otherwise.
     *
     * @param html    The document.
     * @param context The rewrite context.
     * @param shim    Markup to inject, or null.
     * @return The rewritten document.
     */
    public static String rewrite(String html, RewriteContext context, String shim) {
        if (html == null) {
            return null;
        }
        RewriteContext current = context;
        boolean baseSeen = false;
        StringBuilder out = new StringBuilder(html.length() + (shim != null ? shim.length() : 0) + 1024);
        int afterHeadOpen = -1;
        int beforeHeadClose = -1;
        int beforeBodyClose = -1;

        HtmlTokenizer tokenizer = new HtmlTokenizer(html);
        HtmlToken token;
        while ((token = tokenizer.next()) != null) {
            switch (token.getType()) {
                case START_TAG -> {
                    if (!isFrameBustingMeta(token)) {
                        out.append(rewriteStartTag(token, current));
                        if (!baseSeen && BASE.equals(token.getName())) {
                            RewriteContext rebased = rebase(token, current);
                            if (rebased != null) {
                                current = rebased;
                                baseSeen = true;
                            }
                        }
                        if (afterHeadOpen < 0 && "head".equals(token.getName())) {
                            afterHeadOpen = out.length();
                        }
                    }
                }
                case END_TAG -> {
                    if (beforeHeadClose < 0 && "head".equals(token.getName())) {
                        beforeHeadClose = out.length();
                    } else if (beforeBodyClose < 0 && "body".equals(token.getName())) {
                        beforeBodyClose = out.length();
                    }
                    out.append(token.getRaw());
                }
                case RAW_TEXT -> out.append(STYLE.equals(token.getName())
                        ? CssRewriter.rewrite(token.getRaw(), current)
                        : token.getRaw());
                default -> out.append(token.getRaw());
            }
        }

        if (shim != null && !shim.isEmpty()) {
            int at = firstNonNegative(afterHeadOpen, beforeHeadClose, beforeBodyClose);
            if (at < 0) {
                out.append(shim);
            } else {
                out.insert(at, shim);
            }
        }
        return out.toString();
    }

    /**
     * Rewrites the URL, {@code srcset} and {@code style} attributes of one
     * start tag.
     *
     * @param token   A start tag token.
     * @param context The rewrite context.
     * @return The tag source, identical to the input when nothing changed.
     */
    static String rewriteStartTag(HtmlToken token, RewriteContext context) {
        boolean inTagSet = REWRITTEN_TAGS.contains(token.getName());
        List<HtmlToken.Attribute> attributes = token.getAttributes();
        List<HtmlToken.Attribute> rewritten = null;

        for (int i = 0; i < attributes.size(); i++) {
            HtmlToken.Attribute attribute = attributes.get(i);
            String newValue = rewriteAttribute(attribute, inTagSet, context);
            if (newValue == null) {
                continue;
            }
            if (rewritten == null) {
                rewritten = new ArrayList<>(attributes);
            }
            rewritten.set(i, attribute.withValue(quoteSafe(newValue, attribute.quote())));
        }
        return rewritten == null ? token.getRaw() : token.renderStartTag(rewritten);
    }

    /**
     * @return The new value, or null when the attribute stays as it is.
     */
    private static String rewriteAttribute(HtmlToken.Attribute attribute, boolean inTagSet,
            RewriteContext context) {
        String value = attribute.value();
        if (value == null || value.isEmpty()) {
            return null;
        }
        String name = attribute.name().toLowerCase(Locale.ROOT);
        String result;
        if (STYLE.equals(name)) {
            result = CssRewriter.rewrite(value, context);
        } else if (!inTagSet) {
            return null;
        } else if (URL_ATTRIBUTES.contains(name)) {
            ProxiedReference ref = context.rewrite(value);
            result = ref.isRewritten() ? ref.proxied() : value;
        } else if (SRCSET.equals(name)) {
            result = SrcsetRewriter.rewrite(value, context);
        } else {
            return null;
        }
        return value.equals(result) ? null : result;
    }

    /**
     * Applies the document's first {@code <base href>} to the references that
     * follow it. The tag itself is rewritten like any other link.
     *
     * @return The rebased context, or null when the tag has no usable href.
     */
    static RewriteContext rebase(HtmlToken token, RewriteContext context) {
        HtmlToken.Attribute href = token.getAttribute("href");
        if (href == null || href.value() == null || href.value().isBlank()) {
            return null;
        }
        String value = UrlCodec.decodeHtmlEntities(href.value().strip());
        if (RewriteContext.isExcluded(value) || value.startsWith(context.getPrefix())) {
            return null;
        }
        URI base = context.resolve(value);
        if (base == null || !UrlCodec.isHttpUrl(base.toString())) {
            return null;
        }
        return context.withBaseUri(base);
    }

    private static String quoteSafe(String value, char quote) {
        return quote == '\'' ? value.replace("'", "%27") : value;
    }

    /**
     * Detects {@code <meta http-equiv="X-Frame-Options">} and
     * {@code <meta http-equiv="Content-Security-Policy">}.
     */
    static boolean isFrameBustingMeta(HtmlToken token) {
        if (!"meta".equals(token.getName())) {
            return false;
        }
        HtmlToken.Attribute httpEquiv = token.getAttribute("http-equiv");
        if (httpEquiv == null || httpEquiv.value() == null) {
            return false;
        }
        String v = UrlCodec.decodeHtmlEntities(httpEquiv.value()).strip().toLowerCase(Locale.ROOT);
        return v.startsWith("x-frame-options") || v.startsWith("content-security-policy");
    }

    private static int firstNonNegative(int... candidates) {
        for (int c : candidates) {
            if (c >= 0) {
                return c;
            }
        }
        return -1;
    }
}
