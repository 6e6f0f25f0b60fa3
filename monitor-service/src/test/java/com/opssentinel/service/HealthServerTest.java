package com.opssentinel.service;

import com.opssentinel.core.control.SentinelControl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link HealthServer} over real HTTP.
 */
class HealthServerTest {

    private SentinelControl control;
    private HealthServer server;
    private final HttpClient client = HttpClient.newHttpClient();

    @BeforeEach
    void setUp() {
        control = mock(SentinelControl.class);
        server = new HealthServer(control, new RecordSerializer());
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Should serve the health summary as JSON")
    void shouldServeHealth() throws Exception {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("active_alerts", 3);
        when(control.health()).thenReturn(health);
        server.start(0);

        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("\"status\":\"UP\"").contains("\"active_alerts\":3");
    }

    @Test
    @DisplayName("Should answer readiness with 200 or 503")
    void shouldServeReadiness() throws Exception {
        server.start(0);

        when(control.isReady()).thenReturn(false);
        HttpResponse<String> notReady = get("/readiness");
        assertThat(notReady.statusCode()).isEqualTo(503);
        assertThat(notReady.body()).contains("NOT_READY");

        when(control.isReady()).thenReturn(true);
        HttpResponse<String> ready = get("/readiness");
        assertThat(ready.statusCode()).isEqualTo(200);
        assertThat(ready.body()).contains("\"READY\"");
    }

    @Test
    @DisplayName("Should track running state and bound port")
    void shouldTrackLifecycle() {
        assertThat(server.getPort()).isEqualTo(-1);
        assertThat(server.isRunning()).isFalse();

        server.start(0);
        assertThat(server.isRunning()).isTrue();
        assertThat(server.getPort()).isPositive();

        server.stop();
        assertThat(server.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should reject an out-of-range port")
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> server.start(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> server.start(65_536)).isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + server.getPort() + path))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
