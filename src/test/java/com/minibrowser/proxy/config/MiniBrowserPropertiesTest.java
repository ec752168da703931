package com.minibrowser.proxy.config;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MiniBrowserPropertiesTest {

    @Test
    void listenerDefaults() {
        ProxyServerConfig psc = new ProxyServerConfig();

        assertThat(psc.getPort()).isEqualTo(8080);
        assertThat(psc.getType()).isEqualTo("EMBED");
        assertThat(psc.getPrefix()).isEqualTo("/proxy/");
        assertThat(psc.isKeepAlive()).isTrue();
        assertThat(psc.getTimeout()).isEqualTo(30000);
        assertThat(psc.getMaxRedirects()).isEqualTo(5);
        assertThat(psc.getMaxRewriteBodySize()).isEqualTo(10L * 1024 * 1024);
        assertThat(psc.isBlockPrivateAddresses()).isFalse();
        assertThat(psc.getUserAgent()).isEqualTo(ProxyServerConfig.DEFAULT_USER_AGENT);
        assertThat(psc.getUpstreamProxy()).isNull();
    }

    @Test
    void key_fallsBackToPort() {
        ProxyServerConfig psc = new ProxyServerConfig();
        psc.setPort(8181);
        assertThat(psc.key()).isEqualTo("8181");

        psc.setName("main");
        assertThat(psc.key()).isEqualTo("main");
    }

    @Test
    void testEqualsAndHashCode() {
        ProxyServerConfig c1 = new ProxyServerConfig();
        c1.setName("n");
        c1.setUpstreamProxy(new UpstreamProxyConfig("corp", 3128));
        ProxyServerConfig c2 = new ProxyServerConfig();
        c2.setName("n");
        c2.setUpstreamProxy(new UpstreamProxyConfig("corp", 3128));

        assertThat(c1).isEqualTo(c2);
        assertThat(c1.hashCode()).isEqualTo(c2.hashCode());

        c2.setBlockPrivateAddresses(true);
        assertThat(c1).isNotEqualTo(c2);

        c2.setBlockPrivateAddresses(false);
        c2.getUpstreamProxy().setPassword("secret");
        assertThat(c1).isNotEqualTo(c2);
    }

    @Test
    void upstreamProxyCredentials() {
        UpstreamProxyConfig config = new UpstreamProxyConfig("localhost", 8080);
        assertThat(config.hasCredentials()).isFalse();

        config.setUsername("user");
        assertThat(config.hasCredentials()).isFalse();

        config.setPassword("pass");
        assertThat(config.hasCredentials()).isTrue();
    }

    @Test
    void shimConfigEqualityDrivesRestart() {
        ShimConfig a = new ShimConfig();
        ShimConfig b = new ShimConfig();
        assertThat(a).isEqualTo(b);

        b.setHooks(List.of("network"));
        assertThat(a).isNotEqualTo(b);

        a.setHooks(List.of("network"));
        a.setNavigationPollInterval(500);
        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void collectionsAreCopied() {
        List<String> hooks = new ArrayList<>(List.of("network"));
        ShimConfig shim = new ShimConfig();
        shim.setHooks(hooks);
        hooks.add("auto-scroll");
        assertThat(shim.getHooks()).containsExactly("network");

        List<ProxyServerConfig> proxies = new ArrayList<>(List.of(new ProxyServerConfig()));
        MiniBrowserProperties props = new MiniBrowserProperties();
        props.setProxies(proxies);
        proxies.clear();
        assertThat(props.getProxies()).hasSize(1);
    }

    @Test
    void adminListenerDiffers() {
        AdminConfig a = new AdminConfig();
        AdminConfig b = new AdminConfig();
        assertThat(a.listenerDiffers(b)).isFalse();
        assertThat(a.getBindAddress()).isEqualTo("127.0.0.1");

        b.setPort(0);
        assertThat(a.listenerDiffers(b)).isTrue();

        b.setPort(a.getPort());
        b.setEnabled(false);
        assertThat(a.listenerDiffers(b)).isTrue();
    }

    @Test
    void sectionsAreNeverNullByDefault() {
        MiniBrowserProperties props = new MiniBrowserProperties();

        assertThat(props.getProxies()).isNull();
        assertThat(props.getShim()).isNotNull();
        assertThat(props.getLogging()).isNotNull();
        assertThat(props.getAdmin()).isNotNull();
        assertThat(props.getShim().getMessagePrefix()).isEqualTo("ENHANCED_BROWSER_");
        assertThat(props.getShim().getNavigationPollInterval()).isEqualTo(1500);
    }
}
