package com.minibrowser.proxy.core.rewrite;

/**
 * Rewrites {@code srcset} candidate lists such as
 * {@code img1.png 1x, img2.png 2x}.
 * <p>
 * Each candidate URL is rewritten on its own; descriptors ({@code 2x},
 * {@code 480w}), whitespace and comma separators are copied through exactly.
 * A URL is a run of non-whitespace characters, and trailing commas on it are
 * separators, so URLs that contain commas survive.
 */
public final class SrcsetRewriter {

    private SrcsetRewriter() {
        // Utility class
    }

    /**
     * Rewrites a srcset value.
     *
     * @param srcset  The raw attribute value.
     * @param context The rewrite context.
     * @return The rewritten value.
     */
    public static String rewrite(String srcset, RewriteContext context) {
        if (srcset == null || srcset.isBlank()) {
            return srcset;
        }
        StringBuilder out = new StringBuilder(srcset.length() * 2);
        int i = 0;
        int n = srcset.length();
        while (i < n) {
            // separators between candidates
            int start = i;
            while (i < n && (Character.isWhitespace(srcset.charAt(i)) || srcset.charAt(i) == ',')) {
                i++;
            }
            out.append(srcset, start, i);
            if (i >= n) {
                break;
            }

            int urlStart = i;
            while (i < n && !Character.isWhitespace(srcset.charAt(i))) {
                i++;
            }
            int urlEnd = i;
            while (urlEnd > urlStart && srcset.charAt(urlEnd - 1) == ',') {
                urlEnd--;
            }
            out.append(context.proxify(srcset.substring(urlStart, urlEnd)));
            out.append(srcset, urlEnd, i);
            if (urlEnd < i) {
                // the candidate ended with a comma, so it has no descriptor
                continue;
            }

            int descStart = i;
            int depth = 0;
            while (i < n) {
                char c = srcset.charAt(i);
                if (c == '(') {
                    depth++;
                } else if (c == ')' && depth > 0) {
                    depth--;
                } else if (c == ',' && depth == 0) {
                    break;
                }
                i++;
            }
            out.append(srcset, descStart, i);
        }
        return out.toString();
    }
}
