package com.minibrowser.proxy.core.proxy;

import com.minibrowser.proxy.config.MiniBrowserProperties;
import com.minibrowser.proxy.config.ProxyServerConfig;
import com.minibrowser.proxy.core.exceptions.ConfigException;
import com.minibrowser.proxy.core.exceptions.ProxyException;
import com.minibrowser.proxy.core.proxy.impl.embed.EmbedProxyServer;
import com.minibrowser.proxy.core.services.LoggingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class ProxyServerFactoryTest {

    private MiniBrowserProperties props;
    private ProxyServerFactory factory;

    @BeforeEach
    void setUp() {
        props = new MiniBrowserProperties();
        factory = new ProxyServerFactory(mock(LoggingService.class), new SimpleMeterRegistry(), props);
    }

    @Test
    void create_returnsEmbedServer() {
        ProxyServerConfig cfg = new ProxyServerConfig();
        cfg.setType("embed");
        cfg.setPrefix("/mini/");

        ProxyServer server = factory.create(cfg);

        assertThat(server).isInstanceOf(EmbedProxyServer.class);
        assertThat(((EmbedProxyServer) server).getCodec().getPrefix()).isEqualTo("/mini/");
        assertThat(server.getConfig()).isSameAs(cfg);
        server.stop();
    }

    @Test
    void create_rejectsUnknownType() {
        ProxyServerConfig cfg = new ProxyServerConfig();
        cfg.setType("SOCKS5");

        assertThatThrownBy(() -> factory.create(cfg))
                .isInstanceOf(ProxyException.class)
                .hasMessageContaining("SOCKS5");
    }

    @Test
    void create_rejectsMissingType() {
        ProxyServerConfig cfg = new ProxyServerConfig();
        cfg.setType(null);

        assertThatThrownBy(() -> factory.create(cfg)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void updateProperties_appliesToNewServers() {
        MiniBrowserProperties updated = new MiniBrowserProperties();
        updated.getShim().setHooks(List.of("unknown-hook"));
        factory.updateProperties(updated);

        assertThatThrownBy(() -> factory.create(new ProxyServerConfig()))
                .isInstanceOf(ConfigException.class);
    }
}
