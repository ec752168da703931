package com.minibrowser.proxy;

import com.minibrowser.proxy.config.MiniBrowserProperties;
import com.minibrowser.proxy.config.ProxyServerConfig;
import com.minibrowser.proxy.config.UpstreamProxyConfig;
import com.minibrowser.proxy.core.exceptions.ConfigException;
import com.minibrowser.proxy.core.proxy.ProxyServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class MiniBrowserProxyApplicationTest {

    @TempDir
    Path tempDir;

    private MiniBrowserProxyApplication app;
    private Thread appThread;

    @BeforeAll
    static void disableConsole() {
        System.setProperty("minibrowser.no-command-listener", "true");
        System.setProperty("minibrowser.no-shutdown-hook", "true");
        System.setProperty("picocli.ansi", "false");
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (app != null) {
            app.stop();
        }
        if (appThread != null) {
            appThread.join(5000);
        }
    }

    private static int freePort() throws IOException {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }

    private static boolean accepting(int port) {
        try (Socket s = new Socket("localhost", port)) {
            return s.isConnected();
        } catch (IOException e) {
            return false;
        }
    }

    private static String yaml(int port, String prefix, String messagePrefix) {
        return """
                admin:
                  enabled: false
                shim:
                  messagePrefix: %s
                proxies:
                  - name: p1
                    port: %d
                    type: EMBED
                    prefix: %s
                logging:
                  format: '%%h "%%r" %%>s %%R'
                """.formatted(messagePrefix, port, prefix);
    }

    private Path startApp(String content) throws IOException {
        Path configFile = tempDir.resolve("mini-browser.yml");
        Files.writeString(configFile, content);
        app = new MiniBrowserProxyApplication();
        CommandLine cmd = new CommandLine(app);
        appThread = new Thread(() -> cmd.execute("-c", configFile.toAbsolutePath().toString()));
        appThread.setDaemon(true);
        appThread.start();
        return configFile;
    }

    @Test
    void main_withHelpOption_returnsZero() {
        int exitCode = new CommandLine(new MiniBrowserProxyApplication()).execute("--help");
        assertThat(exitCode).isZero();
    }

    @Test
    void main_withVersionOption_returnsZero() {
        int exitCode = new CommandLine(new MiniBrowserProxyApplication()).execute("--version");
        assertThat(exitCode).isZero();
    }

    @Test
    void call_withValidConfig_startsServers() throws Exception {
        int port = freePort();
        startApp(yaml(port, "/proxy/", "ENHANCED_BROWSER_"));

        await().atMost(Duration.ofSeconds(10)).until(() -> accepting(port));

        app.stop();
        await().atMost(Duration.ofSeconds(10)).until(() -> !appThread.isAlive());
        assertThat(accepting(port)).isFalse();
    }

    @Test
    void call_withInvalidConfig_returnsError() throws Exception {
        Path configFile = tempDir.resolve("bad.yml");
        Files.writeString(configFile, "invalid yaml content: !!!");

        int exitCode = new CommandLine(new MiniBrowserProxyApplication())
                .execute("-c", configFile.toAbsolutePath().toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void call_withEmptyConfig_returnsError() throws Exception {
        Path configFile = tempDir.resolve("empty.yml");
        Files.writeString(configFile, "");

        int exitCode = new CommandLine(new MiniBrowserProxyApplication())
                .execute("-c", configFile.toAbsolutePath().toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void call_withMissingConfig_returnsError() {
        int exitCode = new CommandLine(new MiniBrowserProxyApplication())
                .execute("-c", tempDir.resolve("missing.yml").toAbsolutePath().toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void call_withUnknownHook_returnsError() throws Exception {
        Path configFile = tempDir.resolve("hooks.yml");
        Files.writeString(configFile, "shim:\n  hooks: [network, telepathy]\n");

        int exitCode = new CommandLine(new MiniBrowserProxyApplication())
                .execute("-c", configFile.toAbsolutePath().toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void loadConfig_readsBundledDefaults() {
        MiniBrowserProperties props = MiniBrowserProxyApplication.loadConfig("application.yml");

        assertThat(props.getProxies()).hasSize(1);
        ProxyServerConfig cfg = props.getProxies().get(0);
        assertThat(cfg.getType()).isEqualTo("EMBED");
        assertThat(cfg.getPrefix()).isEqualTo("/proxy/");
        assertThat(props.getShim().getHooks()).contains("network", "message-bridge");
    }

    @Test
    void validate_rejectsBadListeners() {
        ProxyServerConfig badPort = new ProxyServerConfig();
        badPort.setPort(70000);
        assertThatThrownBy(() -> MiniBrowserProxyApplication.validate(props(badPort)))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Invalid port");

        ProxyServerConfig negativeRedirects = new ProxyServerConfig();
        negativeRedirects.setMaxRedirects(-1);
        assertThatThrownBy(() -> MiniBrowserProxyApplication.validate(props(negativeRedirects)))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("maxRedirects");

        ProxyServerConfig noUpstreamHost = new ProxyServerConfig();
        noUpstreamHost.setUpstreamProxy(new UpstreamProxyConfig());
        assertThatThrownBy(() -> MiniBrowserProxyApplication.validate(props(noUpstreamHost)))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("upstreamProxy.host");
    }

    @Test
    void validate_rejectsDuplicateListeners() {
        ProxyServerConfig a = new ProxyServerConfig();
        a.setName("same");
        ProxyServerConfig b = new ProxyServerConfig();
        b.setName("same");
        b.setPort(8081);

        assertThatThrownBy(() -> MiniBrowserProxyApplication.validate(props(a, b)))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Duplicate listener same");
    }

    @Test
    void validate_acceptsNoListeners() {
        MiniBrowserProperties props = new MiniBrowserProperties();
        props.setProxies(null);

        MiniBrowserProxyApplication.validate(props);
    }

    @Test
    void reloadCommand_appliesListenerChanges() throws Exception {
        int port = freePort();
        Path configFile = startApp(yaml(port, "/proxy/", "ENHANCED_BROWSER_"));
        await().atMost(Duration.ofSeconds(10)).until(() -> accepting(port));
        ProxyServer before = app.getProxyManager().getActiveServers().get("p1");

        Files.writeString(configFile, yaml(port, "/embed/", "ENHANCED_BROWSER_"));
        app.processCommand("reload");

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            ProxyServer after = app.getProxyManager().getActiveServers().get("p1");
            assertThat(after).isNotNull().isNotSameAs(before);
            assertThat(after.getConfig().getPrefix()).isEqualTo("/embed/");
        });
        await().atMost(Duration.ofSeconds(10)).until(() -> accepting(port));
    }

    @Test
    void reloadCommand_withShimChange_restartsEveryListener() throws Exception {
        int port = freePort();
        Path configFile = startApp(yaml(port, "/proxy/", "ENHANCED_BROWSER_"));
        await().atMost(Duration.ofSeconds(10)).until(() -> accepting(port));
        ProxyServer before = app.getProxyManager().getActiveServers().get("p1");

        Files.writeString(configFile, yaml(port, "/proxy/", "HOST_APP_"));
        app.processCommand("reload");

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
                assertThat(app.getProxyManager().getActiveServers().get("p1")).isNotNull().isNotSameAs(before));
    }

    @Test
    void reloadCommand_keepsRunningConfigOnError() throws Exception {
        int port = freePort();
        Path configFile = startApp(yaml(port, "/proxy/", "ENHANCED_BROWSER_"));
        await().atMost(Duration.ofSeconds(10)).until(() -> accepting(port));
        ProxyServer before = app.getProxyManager().getActiveServers().get("p1");

        Files.writeString(configFile, "proxies: [ not, valid");
        app.processCommand("reload");

        assertThat(app.getProxyManager().getActiveServers().get("p1")).isSameAs(before);
        assertThat(accepting(port)).isTrue();
    }

    @Test
    void stopCommand_shutsDown() throws Exception {
        int port = freePort();
        startApp(yaml(port, "/proxy/", "ENHANCED_BROWSER_"));
        await().atMost(Duration.ofSeconds(10)).until(() -> accepting(port));

        app.processCommand("help");
        app.processCommand("bogus");
        app.processCommand("stop");

        await().atMost(Duration.ofSeconds(10)).until(() -> !appThread.isAlive());
    }

    private static MiniBrowserProperties props(ProxyServerConfig... configs) {
        MiniBrowserProperties props = new MiniBrowserProperties();
        props.setProxies(List.of(configs));
        return props;
    }
}
