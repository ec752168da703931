package com.minibrowser.proxy.core.rewrite;

import com.minibrowser.proxy.core.codec.UrlCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class RewriteContextTest {

    private final RewriteContext context = new RewriteContext(URI.create("https://example.com/dir/page.html"),
            new UrlCodec());

    @ParameterizedTest
    @CsvSource({
            "/logo.png, https://example.com/logo.png",
            "img/a.png, https://example.com/dir/img/a.png",
            "../up.png, https://example.com/up.png",
            "/../../x.png, https://example.com/x.png",
            "//cdn.example.com/x.js, https://cdn.example.com/x.js",
            "?page=2, https://example.com/dir/page.html?page=2",
            "https://other.org, https://other.org/",
            "'  /padded.png  ', https://example.com/padded.png",
            "/a?x=1&amp;y=2, https://example.com/a?x=1&y=2"
    })
    void resolvesAgainstTargetUrl(String raw, String absolute) {
        ProxiedReference ref = context.rewrite(raw);

        assertThat(ref.isRewritten()).isTrue();
        assertThat(ref.absolute()).isEqualTo(absolute);
        assertThat(ref.proxied()).isEqualTo("/proxy/" + UrlCodec.encodeUriComponent(absolute));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "#top",
            "mailto:someone@example.com",
            "tel:+15551234",
            "javascript:void(0)",
            "JavaScript:alert(1)",
            "data:image/png;base64,AAAA",
            "/proxy/https%3A%2F%2Fexample.com%2F",
            "ftp://files.example.com/a.zip",
            "   "
    })
    void leavesValueUntouched(String raw) {
        ProxiedReference ref = context.rewrite(raw);

        assertThat(ref.isRewritten()).isFalse();
        assertThat(ref.proxied()).isEqualTo(raw);
    }

    @Test
    void nullIsUntouched() {
        assertThat(context.proxify(null)).isNull();
    }

    @Test
    void baseWithoutPathGetsRootPath() {
        RewriteContext bare = new RewriteContext(URI.create("https://example.com"), new UrlCodec());

        assertThat(bare.getBaseUri().toString()).isEqualTo("https://example.com/");
        assertThat(bare.rewrite("a.css").absolute()).isEqualTo("https://example.com/a.css");
    }

    @Test
    void honoursCustomPrefix() {
        RewriteContext custom = new RewriteContext(URI.create("https://example.com/"), new UrlCodec("/embed/"));

        assertThat(custom.proxify("/x.js")).isEqualTo("/embed/https%3A%2F%2Fexample.com%2Fx.js");
        assertThat(custom.proxify("/embed/already")).isEqualTo("/embed/already");
    }
}
