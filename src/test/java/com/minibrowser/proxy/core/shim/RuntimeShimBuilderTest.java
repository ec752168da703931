package com.minibrowser.proxy.core.shim;

import com.minibrowser.proxy.config.ShimConfig;
import com.minibrowser.proxy.core.exceptions.ConfigException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuntimeShimBuilderTest {

    @Test
    void build_wrapsConstantsAndHooksInOneScript() {
        String shim = new RuntimeShimBuilder().build("/proxy/", "https://example.com/page");

        assertThat(shim).startsWith("<script>(function(){").endsWith("})();</script>");
        assertThat(shim).contains("var PROXY_PREFIX = \"/proxy/\";");
        assertThat(shim).contains("var ORIGINAL_URL = \"https://example.com/page\";");
        assertThat(shim).contains("var MESSAGE_PREFIX = \"ENHANCED_BROWSER_\";");
        assertThat(shim).contains("var NAVIGATION_POLL_INTERVAL = 1500;");
        assertThat(shim).contains("getUserMedia");
        assertThat(shim.indexOf("</script>")).isEqualTo(shim.length() - "</script>".length());
    }

    @Test
    void build_includesOnlyConfiguredHooks() {
        ShimConfig config = new ShimConfig();
        config.setHooks(List.of("network", "MESSAGE_BRIDGE"));

        RuntimeShimBuilder builder = new RuntimeShimBuilder(config);

        assertThat(builder.getHooks()).containsExactlyInAnyOrder(ShimHook.NETWORK, ShimHook.MESSAGE_BRIDGE);
        assertThat(builder.build("/proxy/", "https://example.com/")).doesNotContain("getUserMedia");
    }

    @Test
    void proxifyLeavesProxiedValuesAlone() {
        String shim = new RuntimeShimBuilder(EnumSet.noneOf(ShimHook.class), 0, null)
                .build("/proxy/", "https://example.com/");

        assertThat(shim).contains("if(typeof u === 'string' && u.indexOf(PROXY_PREFIX)===0) return u;");
        assertThat(shim).contains("return PROXY_PREFIX + encodeURIComponent(abs);");
        assertThat(shim).contains("if(!/^https?:\\/\\//i.test(abs)) return abs;");
    }

    @Test
    void networkHookRewritesRequestsWithCredentials() {
        String shim = new RuntimeShimBuilder(EnumSet.of(ShimHook.NETWORK), 0, null)
                .build("/proxy/", "https://example.com/");

        assertThat(shim).contains("if(!('credentials' in newInit)) newInit.credentials = 'include';");
        assertThat(shim).contains("input instanceof URL) input = input.href;");
        assertThat(shim).contains("new Request(pr, input)");
        assertThat(shim).contains("this.withCredentials = true;");
        assertThat(shim).contains("navigator.sendBeacon = function");
        assertThat(shim).contains("window.EventSource = function");
    }

    @Test
    void networkHookMapsWebSocketSchemes() {
        String shim = new RuntimeShimBuilder(EnumSet.of(ShimHook.NETWORK), 0, null)
                .build("/proxy/", "https://example.com/");

        assertThat(shim).contains("url.replace(/^ws(s?):\\/\\//i, 'http$1://')");
        assertThat(shim).contains("location.protocol.replace(/^http/, 'ws') + '//' + location.host + proxied");
        assertThat(shim).contains("url instanceof URL) url = url.href;");
    }

    @Test
    void mediaGuardClampsGain() {
        String shim = new RuntimeShimBuilder(EnumSet.of(ShimHook.MEDIA_GUARD), 0, null)
                .build("/proxy/", "https://example.com/");

        assertThat(shim).contains("Math.min(0.1, gain.gain.value || 0.1)");
        assertThat(shim).doesNotContain("window.fetch = function");
    }

    @Test
    void nullHookListEnablesEverything() {
        assertThat(new RuntimeShimBuilder(new ShimConfig()).getHooks())
                .containsExactlyInAnyOrder(ShimHook.values());
    }

    @Test
    void unknownHookIsAConfigError() {
        ShimConfig config = new ShimConfig();
        config.setHooks(List.of("network", "teleport"));

        assertThatThrownBy(() -> new RuntimeShimBuilder(config))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("teleport");
    }

    @Test
    void customMessagePrefixAndInterval() {
        RuntimeShimBuilder builder = new RuntimeShimBuilder(EnumSet.noneOf(ShimHook.class), 250, "MY_APP_");
        String shim = builder.build("/embed/", "https://example.com/");

        assertThat(shim).contains("var MESSAGE_PREFIX = \"MY_APP_\";");
        assertThat(shim).contains("var NAVIGATION_POLL_INTERVAL = 250;");
        assertThat(shim).contains("var PROXY_PREFIX = \"/embed/\";");
    }

    @Test
    void nonPositiveIntervalFallsBackToDefault() {
        String shim = new RuntimeShimBuilder(List.of(), 0, null).build("/proxy/", "https://example.com/");

        assertThat(shim).contains("var NAVIGATION_POLL_INTERVAL = 1500;");
        assertThat(shim).contains("var MESSAGE_PREFIX = \"ENHANCED_BROWSER_\";");
    }

    @Test
    void originalUrlCannotCloseTheScript() {
        String shim = new RuntimeShimBuilder().build("/proxy/",
                "https://example.com/?q=</script><script>alert(1)</script>");

        assertThat(shim).doesNotContain("</script><script>alert");
        assertThat(shim.indexOf("</script>")).isEqualTo(shim.length() - "</script>".length());
    }

    @Test
    void jsString_escapesLiterals() {
        assertThat(RuntimeShimBuilder.jsString("a\"b\\c")).isEqualTo("\"a\\\"b\\\\c\"");
        assertThat(RuntimeShimBuilder.jsString("</script>")).isEqualTo("\"<\\/script>\"");
        assertThat(RuntimeShimBuilder.jsString("x\u2028y")).isEqualTo("\"x\\u2028y\"");
    }

    @Test
    void shimHook_fromIdAcceptsEnumNames() {
        assertThat(ShimHook.fromId("MEDIA_GUARD")).isEqualTo(ShimHook.MEDIA_GUARD);
        assertThat(ShimHook.fromId(" Auto-Scroll ")).isEqualTo(ShimHook.AUTO_SCROLL);
        assertThatThrownBy(() -> ShimHook.fromId("nope")).isInstanceOf(IllegalArgumentException.class);
    }
}
