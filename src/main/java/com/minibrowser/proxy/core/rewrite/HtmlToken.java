package com.minibrowser.proxy.core.rewrite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A lexical unit of an HTML document produced by {@link HtmlTokenizer}.
 * <p>
 * Every token keeps its exact source text in {@link #getRaw()}, so a document
 * re-emitted token by token is byte-identical to the input. Start tags also
 * expose their attributes, which can be replaced and re-rendered.
 */
public final class HtmlToken {

    /**
     * Token categories.
     */
    public enum Type {
        /** Character data between tags. */
        TEXT,
        /** {@code <!-- ... -->}. */
        COMMENT,
        /** {@code <!DOCTYPE ...>}, {@code <![CDATA[ ... ]]>} or {@code <? ... >}. */
        DECLARATION,
        /** An opening tag with its attributes. */
        START_TAG,
        /** A closing tag. */
        END_TAG,
        /** Contents of a raw text element such as {@code <script>} or {@code <style>}. */
        RAW_TEXT
    }

    /**
     * A single attribute of a start tag.
     *
     * @param leading   Whitespace (and stray slashes) before the name.
     * @param name      The attribute name as written.
     * @param separator Text between name and value, including {@code =}; empty
     *                  for a bare attribute.
     * @param value     The value without quotes, or null for a bare attribute.
     * @param quote     The quote character, or {@code 0} for an unquoted value.
     */
    public record Attribute(String leading, String name, String separator, String value, char quote) {

        /**
         * Returns a copy carrying a new value. Unquoted values are emitted with
         * double quotes.
         *
         * @param newValue The replacement value.
         * @return The updated attribute.
         */
        public Attribute withValue(String newValue) {
            char q = quote == 0 ? '"' : quote;
            String sep = separator.isEmpty() ? "=" : separator;
            return new Attribute(leading, name, sep, newValue, q);
        }

        void render(StringBuilder sb) {
            sb.append(leading).append(name);
            if (value != null) {
                sb.append(separator);
                if (quote != 0) {
                    sb.append(quote).append(value).append(quote);
                } else {
                    sb.append(value);
                }
            }
        }
    }

    private final Type type;
    private final String raw;
    private final String name;
    private final String nameRaw;
    private final List<Attribute> attributes;
    private final String trailer;

    private HtmlToken(Type type, String raw, String name, String nameRaw, List<Attribute> attributes,
            String trailer) {
        this.type = type;
        this.raw = raw;
        this.name = name;
        this.nameRaw = nameRaw;
        this.attributes = attributes;
        this.trailer = trailer;
    }

    static HtmlToken of(Type type, String raw) {
        return new HtmlToken(type, raw, null, null, List.of(), "");
    }

    static HtmlToken endTag(String raw, String name) {
        return new HtmlToken(Type.END_TAG, raw, name, null, List.of(), "");
    }

    static HtmlToken rawText(String raw, String elementName) {
        return new HtmlToken(Type.RAW_TEXT, raw, elementName, null, List.of(), "");
    }

    static HtmlToken startTag(String raw, String nameRaw, List<Attribute> attributes, String trailer) {
        return new HtmlToken(Type.START_TAG, raw, HtmlTokenizer.lower(nameRaw), nameRaw,
                Collections.unmodifiableList(new ArrayList<>(attributes)), trailer);
    }

    public Type getType() {
        return type;
    }

    /**
     * @return The exact source text of the token.
     */
    public String getRaw() {
        return raw;
    }

    /**
     * @return The lower-cased tag name for tags, the enclosing element name for
     *         raw text, otherwise null.
     */
    public String getName() {
        return name;
    }

    public List<Attribute> getAttributes() {
        return attributes;
    }

    /**
     * Finds an attribute by case-insensitive name.
     *
     * @param attributeName The attribute name.
     * @return The first matching attribute, or null.
     */
    public Attribute getAttribute(String attributeName) {
        for (Attribute a : attributes) {
            if (a.name().equalsIgnoreCase(attributeName)) {
                return a;
            }
        }
        return null;
    }

    /**
     * Renders a start tag with a replacement attribute list, keeping the
     * original tag name spelling and the text before {@code >}.
     *
     * @param newAttributes The attributes to emit.
     * @return The tag source text.
     */
    public String renderStartTag(List<Attribute> newAttributes) {
        StringBuilder sb = new StringBuilder(raw.length() + 128);
        sb.append('<').append(nameRaw);
        for (Attribute a : newAttributes) {
            a.render(sb);
        }
        return sb.append(trailer).append('>').toString();
    }

    @Override
    public String toString() {
        return type + "[" + raw + "]";
    }
}
