package com.minibrowser.proxy.core.upstream;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.minibrowser.proxy.config.ProxyServerConfig;
import com.minibrowser.proxy.core.exceptions.UpstreamFetchException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.head;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpstreamFetcherTest {

    private WireMockServer wireMockServer;
    private ExecutorService executor;
    private ProxyServerConfig config;
    private UpstreamFetcher fetcher;
    private String base;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(wireMockConfig().dynamicPort());
        wireMockServer.start();
        WireMock.configureFor("localhost", wireMockServer.port());
        base = "http://localhost:" + wireMockServer.port();

        executor = Executors.newCachedThreadPool();
        config = new ProxyServerConfig();
        config.setTimeout(5000);
        fetcher = new UpstreamFetcher(config, executor);
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
        executor.shutdownNow();
    }

    private UpstreamResponse fetch(String method, String path, Map<String, String> headers, byte[] body) {
        return fetcher.fetch(new ProxyRequest(method, URI.create(base + path), headers, body));
    }

    @Test
    void get_forwardsCuratedHeadersOnly() throws IOException {
        stubFor(get(urlEqualTo("/page")).willReturn(aResponse().withStatus(200)
                .withHeader("Content-Type", "text/html")
                .withBody("<p>hi</p>")));

        try (UpstreamResponse response = fetch("GET", "/page",
                Map.of("Cookie", "sid=1", "Authorization", "Bearer t", "X-Custom", "nope",
                        "Origin", "https://host.app", "Referer", "https://host.app/index"),
                null)) {
            assertThat(response.getStatusCode()).isEqualTo(200);
            assertThat(new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("<p>hi</p>");
        }

        verify(getRequestedFor(urlEqualTo("/page"))
                .withHeader("Cookie", equalTo("sid=1"))
                .withHeader("Authorization", equalTo("Bearer t"))
                .withHeader("Origin", equalTo(base))
                .withHeader("Referer", equalTo(base + "/page"))
                .withHeader("User-Agent", equalTo(ProxyServerConfig.DEFAULT_USER_AGENT))
                .withHeader("Accept", equalTo(UpstreamFetcher.DEFAULT_ACCEPT))
                .withHeader("Accept-Encoding", equalTo(UpstreamFetcher.ACCEPT_ENCODING))
                .withHeader("Cache-Control", equalTo("no-cache"))
                .withHeader("X-Custom", absent()));
    }

    @Test
    void get_prefersCallerUserAgentAndAccept() throws IOException {
        stubFor(get(urlEqualTo("/ua")).willReturn(aResponse().withStatus(204)));

        fetch("GET", "/ua", Map.of("User-Agent", "Test/1.0", "Accept", "image/*"), null).close();

        verify(getRequestedFor(urlEqualTo("/ua"))
                .withHeader("User-Agent", equalTo("Test/1.0"))
                .withHeader("Accept", equalTo("image/*")));
    }

    @Test
    void followsRedirectsAndReportsFinalUrl() throws IOException {
        stubFor(get(urlEqualTo("/start")).willReturn(aResponse().withStatus(302).withHeader("Location", "/middle")));
        stubFor(get(urlEqualTo("/middle")).willReturn(aResponse().withStatus(301)
                .withHeader("Location", base + "/final#section")));
        stubFor(get(urlEqualTo("/final")).willReturn(aResponse().withStatus(200).withBody("done")));

        try (UpstreamResponse response = fetch("GET", "/start", Map.of(), null)) {
            assertThat(response.getStatusCode()).isEqualTo(200);
            assertThat(response.getFinalUri().toString()).isEqualTo(base + "/final");
        }
    }

    @Test
    void stopsAtRedirectLimit() throws IOException {
        config.setMaxRedirects(0);
        fetcher = new UpstreamFetcher(config, executor);
        stubFor(get(urlEqualTo("/start")).willReturn(aResponse().withStatus(302).withHeader("Location", "/final")));

        try (UpstreamResponse response = fetch("GET", "/start", Map.of(), null)) {
            assertThat(response.getStatusCode()).isEqualTo(302);
            assertThat(response.firstHeader("Location")).isEqualTo("/final");
            assertThat(response.getFinalUri().toString()).isEqualTo(base + "/start");
        }
    }

    @Test
    void seeOtherAfterPostBecomesGet() throws IOException {
        stubFor(post(urlEqualTo("/form")).willReturn(aResponse().withStatus(303).withHeader("Location", "/done")));
        stubFor(get(urlEqualTo("/done")).willReturn(aResponse().withStatus(200).withBody("ok")));

        try (UpstreamResponse response = fetch("POST", "/form",
                Map.of("Content-Type", "application/x-www-form-urlencoded"),
                "a=1".getBytes(StandardCharsets.UTF_8))) {
            assertThat(response.getStatusCode()).isEqualTo(200);
        }

        verify(postRequestedFor(urlEqualTo("/form"))
                .withHeader("Content-Type", containing("application/x-www-form-urlencoded"))
                .withRequestBody(equalTo("a=1")));
        verify(getRequestedFor(urlEqualTo("/done")));
    }

    @Test
    void headReturnsEmptyBody() throws IOException {
        stubFor(head(urlEqualTo("/h")).willReturn(aResponse().withStatus(200)
                .withHeader("Content-Type", "text/html")));

        try (UpstreamResponse response = fetch("HEAD", "/h", Map.of(), null)) {
            assertThat(response.getStatusCode()).isEqualTo(200);
            assertThat(response.getBody().readAllBytes()).isEmpty();
        }
    }

    @Test
    void nonSuccessStatusIsReturned() throws IOException {
        stubFor(get(urlEqualTo("/missing")).willReturn(aResponse().withStatus(404).withBody("gone")));

        try (UpstreamResponse response = fetch("GET", "/missing", Map.of(), null)) {
            assertThat(response.getStatusCode()).isEqualTo(404);
        }
    }

    @Test
    void correctsContentType() throws IOException {
        stubFor(get(urlEqualTo("/assets/site.css")).willReturn(aResponse().withStatus(200)
                .withHeader("Content-Type", "application/octet-stream")
                .withBody("a{}")));

        try (UpstreamResponse response = fetch("GET", "/assets/site.css", Map.of(), null)) {
            assertThat(response.getContentType()).isEqualTo(ContentTypeResolver.CSS);
        }
    }

    @Test
    void unreachableTargetFails() throws IOException {
        int closedPort;
        try (ServerSocket s = new ServerSocket(0)) {
            closedPort = s.getLocalPort();
        }
        ProxyRequest request = new ProxyRequest("GET", URI.create("http://localhost:" + closedPort + "/"),
                Map.of(), null);

        assertThatThrownBy(() -> fetcher.fetch(request)).isInstanceOf(UpstreamFetchException.class);
    }

    @Test
    void resolveLocation() {
        URI base = URI.create("https://a.example.com/x/y");

        assertThat(UpstreamFetcher.resolveLocation(base, "../z").toString()).isEqualTo("https://a.example.com/z");
        assertThat(UpstreamFetcher.resolveLocation(base, " https://b.example.com/ ").toString())
                .isEqualTo("https://b.example.com/");
        assertThat(UpstreamFetcher.origin(URI.create("http://h.example.com:8080/p"))).isEqualTo(
                "http://h.example.com:8080");
    }
}
