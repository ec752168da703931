package com.minibrowser.proxy.core.services;

import com.minibrowser.proxy.config.MiniBrowserProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsServiceTest {

    private MetricsService metricsService;
    private final HttpClient client = HttpClient.newHttpClient();

    @BeforeEach
    void setUp() {
        MiniBrowserProperties props = new MiniBrowserProperties();
        props.getAdmin().setPort(0);
        props.getAdmin().setEnabled(true);
        metricsService = new MetricsService(props);
    }

    @AfterEach
    void tearDown() {
        if (metricsService != null) {
            metricsService.shutdown();
        }
    }

    private HttpResponse<String> get(int port, String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + port + path))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void health_returnsOk() throws Exception {
        HttpResponse<String> response = get(metricsService.getAdminPort(), "/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("OK");
    }

    @Test
    void metrics_returnsPrometheusData() throws Exception {
        metricsService.getRegistry().counter("proxy.rewrite.total", "name", "test", "kind", "html").increment();

        HttpResponse<String> response = get(metricsService.getAdminPort(), "/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("proxy_rewrite_total{").contains("kind=\"html\"");
    }

    @Test
    void disabledAdminServerHasNoPort() {
        metricsService.shutdown();
        MiniBrowserProperties props = new MiniBrowserProperties();
        props.getAdmin().setEnabled(false);

        metricsService = new MetricsService(props);

        assertThat(metricsService.getAdminPort()).isEqualTo(-1);
        assertThat(metricsService.getRegistry()).isNotNull();
    }

    @Test
    void updateProperties_restartsServerOnChange() throws Exception {
        int oldPort = metricsService.getAdminPort();
        MiniBrowserProperties props = new MiniBrowserProperties();
        props.getAdmin().setPort(0);
        props.getAdmin().setBindAddress("0.0.0.0");

        metricsService.updateProperties(props);

        assertThat(metricsService.getAdminPort()).isPositive();
        HttpResponse<String> response = get(metricsService.getAdminPort(), "/health");
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(oldPort).isPositive();
    }
}
