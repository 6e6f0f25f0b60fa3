package com.opssentinel.service;

import com.opssentinel.core.spi.MetricsSourceException;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HttpMetricsSource} against a local HTTP server.
 */
class HttpMetricsSourceTest {

    private HttpServer server;
    private final AtomicReference<String> body = new AtomicReference<>("{}");
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> lastQuery = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/api/metrics", exchange -> {
            lastQuery.set(exchange.getRequestURI().getQuery());
            byte[] bytes = body.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("Should read numeric fields and pass the window in minutes")
    void shouldReadNumericFields() throws Exception {
        body.set("{\"error_rate\": 2.5, \"total_traces\": 120, \"service\": \"checkout\"}");

        Map<String, Double> metrics = source().getMetrics(Duration.ofMinutes(5));

        assertThat(metrics).containsOnly(
                Map.entry("error_rate", 2.5),
                Map.entry("total_traces", 120.0));
        assertThat(lastQuery.get()).isEqualTo("window_minutes=5");
    }

    @Test
    @DisplayName("Should read a nested metrics object")
    void shouldReadNestedMetrics() throws Exception {
        body.set("{\"generated_at\": \"now\", \"metrics\": {\"avg_latency_ms\": 840}}");

        assertThat(source().getMetrics(Duration.ofSeconds(30)))
                .containsOnly(Map.entry("avg_latency_ms", 840.0));
        assertThat(lastQuery.get()).isEqualTo("window_minutes=1");
    }

    @Test
    @DisplayName("Should fail on a non-200 response")
    void shouldFailOnErrorStatus() {
        status.set(503);

        assertThatThrownBy(() -> source().getMetrics(Duration.ofMinutes(1)))
                .isInstanceOf(MetricsSourceException.class)
                .hasMessageContaining("status 503");
    }

    @Test
    @DisplayName("Should fail when the body is not a JSON object")
    void shouldFailOnNonObjectBody() {
        body.set("[1, 2, 3]");

        assertThatThrownBy(() -> source().getMetrics(Duration.ofMinutes(1)))
                .isInstanceOf(MetricsSourceException.class)
                .hasMessageContaining("JSON object");
    }

    @Test
    @DisplayName("Should fail when the body is not JSON")
    void shouldFailOnInvalidJson() {
        body.set("not json");

        assertThatThrownBy(() -> source().getMetrics(Duration.ofMinutes(1)))
                .isInstanceOf(MetricsSourceException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    @DisplayName("Should fail when nothing listens on the endpoint")
    void shouldFailWhenUnreachable() {
        int port = server.getAddress().getPort();
        server.stop(0);
        HttpMetricsSource unreachable = new HttpMetricsSource(
                "http://127.0.0.1:" + port + "/api/metrics", Duration.ofSeconds(2));

        assertThatThrownBy(() -> unreachable.getMetrics(Duration.ofMinutes(1)))
                .isInstanceOf(MetricsSourceException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private HttpMetricsSource source() {
        return new HttpMetricsSource("http://127.0.0.1:" + server.getAddress().getPort() + "/api/metrics",
                Duration.ofSeconds(2));
    }
}
