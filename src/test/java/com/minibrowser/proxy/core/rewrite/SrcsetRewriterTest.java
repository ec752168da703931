package com.minibrowser.proxy.core.rewrite;

import com.minibrowser.proxy.core.codec.UrlCodec;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class SrcsetRewriterTest {

    private static final String P = "/proxy/https%3A%2F%2Fexample.com%2F";

    private final RewriteContext context = new RewriteContext(URI.create("https://example.com/"), new UrlCodec());

    @Test
    void rewritesEachCandidateAndKeepsDescriptors() {
        assertThat(SrcsetRewriter.rewrite("a.png 1x, b.png 2x", context))
                .isEqualTo(P + "a.png 1x, " + P + "b.png 2x");
    }

    @Test
    void keepsSeparatorsExactly() {
        assertThat(SrcsetRewriter.rewrite("small.jpg 480w,large.jpg 1080w", context))
                .isEqualTo(P + "small.jpg 480w," + P + "large.jpg 1080w");
    }

    @Test
    void candidatesWithoutDescriptors() {
        assertThat(SrcsetRewriter.rewrite("a.png, b.png", context))
                .isEqualTo(P + "a.png, " + P + "b.png");
    }

    @Test
    void urlsMayContainCommas() {
        assertThat(SrcsetRewriter.rewrite("https://cdn.example.com/img,w_100/a.png 2x", context))
                .isEqualTo("/proxy/https%3A%2F%2Fcdn.example.com%2Fimg%2Cw_100%2Fa.png 2x");
    }

    @Test
    void leavesExcludedCandidates() {
        String srcset = "data:image/png;base64,AAAA 1x, /b.png 2x";

        assertThat(SrcsetRewriter.rewrite(srcset, context))
                .isEqualTo("data:image/png;base64,AAAA 1x, " + P + "b.png 2x");
    }

    @Test
    void blankIsReturnedAsIs() {
        assertThat(SrcsetRewriter.rewrite("  ", context)).isEqualTo("  ");
        assertThat(SrcsetRewriter.rewrite(null, context)).isNull();
    }
}
