package com.minibrowser.proxy.core.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Single-pass, lossless HTML tokenizer.
 * <p>
 * It recognises just enough of the HTML syntax to find start tags and their
 * attributes reliably: comments, declarations, end tags and the contents of
 * raw text elements ({@code <script>}, {@code <style>}, ...) are returned as
 * opaque tokens. Anything it cannot make sense of (an unterminated tag or
 * quote, a stray {@code <}) degrades to {@link HtmlToken.Type#TEXT}, so no
 * input is ever lost.
 */
public final class HtmlTokenizer {

    /** Elements whose contents are not markup. */
    private static final Set<String> RAW_TEXT_ELEMENTS = Set.of(
            "script", "style", "textarea", "title", "xmp", "iframe", "noembed", "noframes");

    private final String html;
    private final int length;
    private int pos;

    /** Name of the raw text element whose contents come next, if any. */
    private String pendingRawText;

    public HtmlTokenizer(String html) {
        this.html = html == null ? "" : html;
        this.length = this.html.length();
    }

    /**
     * Tokenizes a whole document.
     *
     * @param html The document text.
     * @return All tokens in document order.
     */
    public static List<HtmlToken> tokenize(String html) {
        HtmlTokenizer tokenizer = new HtmlTokenizer(html);
        List<HtmlToken> tokens = new ArrayList<>();
        HtmlToken t;
        while ((t = tokenizer.next()) != null) {
            tokens.add(t);
        }
        return tokens;
    }

    /**
     * Returns the next token.
     *
     * @return The next token, or null at the end of the input.
     */
    public HtmlToken next() {
        if (pos >= length) {
            return null;
        }
        if (pendingRawText != null) {
            return readRawText();
        }
        if (html.charAt(pos) != '<') {
            return readText(pos);
        }
        if (html.startsWith("<!--", pos)) {
            return readUntil(HtmlToken.Type.COMMENT, "-->");
        }
        char next = pos + 1 < length ? html.charAt(pos + 1) : 0;
        if (next == '!' || next == '?') {
            return readUntil(HtmlToken.Type.DECLARATION, ">");
        }
        if (next == '/' && pos + 2 < length && isAsciiLetter(html.charAt(pos + 2))) {
            return readEndTag();
        }
        if (isAsciiLetter(next)) {
            HtmlToken tag = readStartTag();
            if (tag != null) {
                return tag;
            }
            // unterminated tag: the rest of the document is text
            return emit(HtmlToken.Type.TEXT, length);
        }
        return readText(pos + 1);
    }

    private HtmlToken readText(int searchFrom) {
        int end = html.indexOf('<', searchFrom);
        return emit(HtmlToken.Type.TEXT, end < 0 ? length : end);
    }

    private HtmlToken readUntil(HtmlToken.Type type, String terminator) {
        int end = html.indexOf(terminator, pos + 2);
        return emit(type, end < 0 ? length : end + terminator.length());
    }

    private HtmlToken readEndTag() {
        int end = html.indexOf('>', pos);
        if (end < 0) {
            return emit(HtmlToken.Type.TEXT, length);
        }
        int i = pos + 2;
        while (i < end && !isTagNameTerminator(html.charAt(i))) {
            i++;
        }
        String name = lower(html.substring(pos + 2, i));
        String raw = html.substring(pos, end + 1);
        pos = end + 1;
        return HtmlToken.endTag(raw, name);
    }

    private HtmlToken readRawText() {
        String element = pendingRawText;
        pendingRawText = null;
        int end = findRawTextEnd(element);
        String raw = html.substring(pos, end);
        pos = end;
        return HtmlToken.rawText(raw, element);
    }

    private int findRawTextEnd(String element) {
        String closing = "</" + element;
        int from = pos;
        while (true) {
            int idx = indexOfIgnoreCase(closing, from);
            if (idx < 0) {
                return length;
            }
            int after = idx + closing.length();
            if (after >= length || isTagNameTerminator(html.charAt(after))) {
                return idx;
            }
            from = idx + 1;
        }
    }

    private HtmlToken readStartTag() {
        int start = pos;
        int i = pos + 1;
        while (i < length && !isTagNameTerminator(html.charAt(i))) {
            i++;
        }
        String nameRaw = html.substring(start + 1, i);
        List<HtmlToken.Attribute> attributes = new ArrayList<>();

        while (true) {
            int leadStart = i;
            while (i < length && (Character.isWhitespace(html.charAt(i)) || html.charAt(i) == '/')) {
                i++;
            }
            if (i >= length) {
                return null;
            }
            if (html.charAt(i) == '>') {
                String trailer = html.substring(leadStart, i);
                String raw = html.substring(start, i + 1);
                pos = i + 1;
                String name = lower(nameRaw);
                if (RAW_TEXT_ELEMENTS.contains(name)) {
                    pendingRawText = name;
                }
                return HtmlToken.startTag(raw, nameRaw, attributes, trailer);
            }

            int nameStart = i;
            i++; // the first character of a name may be '='
            while (i < length && !isAttributeNameTerminator(html.charAt(i))) {
                i++;
            }
            String attrName = html.substring(nameStart, i);

            int sepStart = i;
            int j = skipWhitespace(i);
            if (j < length && html.charAt(j) == '=') {
                int valueStart = skipWhitespace(j + 1);
                if (valueStart >= length) {
                    return null;
                }
                char c = html.charAt(valueStart);
                String separator = html.substring(sepStart, valueStart);
                if (c == '"' || c == '\'') {
                    int close = html.indexOf(c, valueStart + 1);
                    if (close < 0) {
                        return null;
                    }
                    attributes.add(new HtmlToken.Attribute(html.substring(leadStart, nameStart), attrName,
                            separator, html.substring(valueStart + 1, close), c));
                    i = close + 1;
                } else {
                    int k = valueStart;
                    while (k < length && !Character.isWhitespace(html.charAt(k)) && html.charAt(k) != '>') {
                        k++;
                    }
                    attributes.add(new HtmlToken.Attribute(html.substring(leadStart, nameStart), attrName,
                            separator, html.substring(valueStart, k), (char) 0));
                    i = k;
                }
            } else {
                attributes.add(new HtmlToken.Attribute(html.substring(leadStart, nameStart), attrName, "", null,
                        (char) 0));
            }
        }
    }

    private HtmlToken emit(HtmlToken.Type type, int end) {
        String raw = html.substring(pos, end);
        pos = end;
        return HtmlToken.of(type, raw);
    }

    private int skipWhitespace(int from) {
        int i = from;
        while (i < length && Character.isWhitespace(html.charAt(i))) {
            i++;
        }
        return i;
    }

    private int indexOfIgnoreCase(String needle, int from) {
        int max = length - needle.length();
        for (int i = from; i <= max; i++) {
            if (html.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isTagNameTerminator(char c) {
        return Character.isWhitespace(c) || c == '/' || c == '>';
    }

    private static boolean isAttributeNameTerminator(char c) {
        return Character.isWhitespace(c) || c == '/' || c == '>' || c == '=';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
