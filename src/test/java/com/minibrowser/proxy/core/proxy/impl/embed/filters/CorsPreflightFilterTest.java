package com.minibrowser.proxy.core.proxy.impl.embed.filters;

import com.minibrowser.proxy.core.constants.HeaderConstants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

class CorsPreflightFilterTest {

    private CorsPreflightFilter filter;
    private ByteArrayOutputStream out;
    private Map<String, String> headers;

    @BeforeEach
    void setUp() {
        filter = new CorsPreflightFilter();
        out = new ByteArrayOutputStream();
        headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    }

    @Test
    void preHandle_nonOptions_continues() throws IOException {
        RequestContext context = new RequestContext("GET", "/proxy/x", headers, "127.0.0.1", true);

        assertThat(filter.preHandle(context, out)).isTrue();
        assertThat(out.size()).isZero();
        assertThat(context.getStatus()).isZero();
    }

    @Test
    void preHandle_options_answersWithNoContent() throws IOException {
        headers.put(HeaderConstants.ORIGIN.getValue(), "https://host.app");
        RequestContext context = new RequestContext("OPTIONS", "/proxy/x", headers, "127.0.0.1", true);

        assertThat(filter.preHandle(context, out)).isFalse();
        assertThat(context.getStatus()).isEqualTo(204);

        String raw = out.toString(StandardCharsets.ISO_8859_1);
        assertThat(raw).startsWith("HTTP/1.1 204 No Content\r\n");
        assertThat(raw).contains("Access-Control-Allow-Origin: https://host.app\r\n");
        assertThat(raw).contains("Access-Control-Max-Age: 86400\r\n");
        assertThat(raw).contains("Connection: keep-alive\r\n");
    }

    @Test
    void preHandle_optionsWithoutOrigin_allowsAnyOrigin() throws IOException {
        RequestContext context = new RequestContext("OPTIONS", "/proxy/x", headers, "127.0.0.1", false);

        filter.preHandle(context, out);

        assertThat(out.toString(StandardCharsets.ISO_8859_1))
                .contains("Access-Control-Allow-Origin: *\r\n")
                .contains("Connection: close\r\n");
    }
}
