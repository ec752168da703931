package com.minibrowser.proxy.core.rewrite;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.minibrowser.proxy.core.codec.UrlCodec;

/**
 * Rewrites {@code url(...)} tokens and {@code @import} rules in CSS text.
 * Used for stylesheet responses, {@code <style>} blocks and {@code style}
 * attributes.
 */
public final class CssRewriter {

    /** {@code @import "x.css" media;} or {@code @import 'x.css';}. */
    private static final Pattern IMPORT_STRING = Pattern.compile(
            "@import\\s+(?:\"([^\"]*)\"|'([^']*)')([^;]*);?", Pattern.CASE_INSENSITIVE);

    /** {@code url(x)}, {@code url("x")} or {@code url('x')}, not preceded by an identifier character. */
    private static final Pattern URL_TOKEN = Pattern.compile(
            "(?<![\\w-])url\\(\\s*(?:\"([^\"]*)\"|'([^']*)'|([^)'\"]*?))\\s*\\)", Pattern.CASE_INSENSITIVE);

    private CssRewriter() {
        // Utility class
    }

    /**
     * Rewrites every resource reference in a CSS fragment.
     *
     * @param css     The CSS text.
     * @param context The rewrite context.
     * @return The rewritten CSS; unchanged references keep their original text.
     */
    public static String rewrite(String css, RewriteContext context) {
        if (css == null || css.isEmpty()) {
            return css;
        }
        String lower = css.toLowerCase(Locale.ROOT);
        if (!lower.contains("url(") && !lower.contains("@import")) {
            return css;
        }
        return rewriteUrlTokens(rewriteStringImports(css, context), context);
    }

    private static String rewriteStringImports(String css, RewriteContext context) {
        Matcher m = IMPORT_STRING.matcher(css);
        StringBuilder sb = new StringBuilder(css.length() + 64);
        while (m.find()) {
            String raw = m.group(1) != null ? m.group(1) : m.group(2);
            ProxiedReference ref = context.rewrite(raw);
            String replacement = ref.isRewritten()
                    ? "@import url(" + cssSafe(ref.proxied()) + ")" + m.group(3) + ";"
                    : m.group();
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String rewriteUrlTokens(String css, RewriteContext context) {
        Matcher m = URL_TOKEN.matcher(css);
        StringBuilder sb = new StringBuilder(css.length() + 128);
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(rewriteUrlToken(m, context)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String rewriteUrlToken(Matcher m, RewriteContext context) {
        String quote;
        String raw;
        if (m.group(1) != null) {
            quote = "\"";
            raw = m.group(1);
        } else if (m.group(2) != null) {
            quote = "'";
            raw = m.group(2);
        } else {
            quote = "";
            // inside a style attribute quotes arrive entity-escaped
            raw = stripQuotes(UrlCodec.decodeHtmlEntities(m.group(3).trim()));
        }
        ProxiedReference ref = context.rewrite(raw);
        if (!ref.isRewritten()) {
            return m.group();
        }
        return "url(" + quote + cssSafe(ref.proxied()) + quote + ")";
    }

    private static String stripQuotes(String value) {
        String v = value;
        if (v.startsWith("\"") || v.startsWith("'")) {
            v = v.substring(1);
        }
        if (v.endsWith("\"") || v.endsWith("'")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }

    /**
     * Escapes the characters {@code encodeURIComponent} leaves alone but that
     * would terminate a CSS {@code url()} token. The escapes decode back to the
     * same target.
     */
    static String cssSafe(String proxied) {
        if (proxied.indexOf('(') < 0 && proxied.indexOf(')') < 0 && proxied.indexOf('\'') < 0) {
            return proxied;
        }
        return proxied.replace("(", "%28").replace(")", "%29").replace("'", "%27");
    }
}
