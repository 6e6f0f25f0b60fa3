package com.opssentinel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opssentinel.core.spi.MetricsSource;
import com.opssentinel.core.spi.MetricsSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link MetricsSource} that reads a metrics snapshot from an HTTP endpoint.
 *
 * <p>
 * Issues {@code GET <url>?window_minutes=<n>} and expects a JSON object whose
 * numeric fields are metric values. When the object carries a {@code metrics}
 * field, that nested object is read instead. Non-numeric fields are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpMetricsSource implements MetricsSource {

    private static final Logger LOG = LoggerFactory.getLogger(HttpMetricsSource.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String url;
    private final Duration timeout;

    public HttpMetricsSource(String url, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(),
                RecordSerializer.newObjectMapper(), url, timeout);
    }

    HttpMetricsSource(HttpClient httpClient, ObjectMapper objectMapper, String url, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.url = Objects.requireNonNull(url, "url must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public Map<String, Double> getMetrics(Duration window) throws MetricsSourceException {
        URI uri = buildUri(window);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header("Accept", "application/json")
                .timeout(timeout)
                .GET()
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new MetricsSourceException(
                        "Metrics request to " + uri + " failed with status " + response.statusCode());
            }
            return parse(response.body());
        } catch (IOException e) {
            throw new MetricsSourceException("Metrics request to " + uri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetricsSourceException("Metrics request to " + uri + " was interrupted", e);
        }
    }

    @Override
    public String name() {
        return "http";
    }

    private URI buildUri(Duration window) {
        String separator = url.contains("?") ? "&" : "?";
        return URI.create(url + separator + "window_minutes=" + Math.max(1, window.toMinutes()));
    }

    Map<String, Double> parse(String body) throws MetricsSourceException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new MetricsSourceException("Metrics response is not valid JSON: " + e.getMessage(), e);
        }
        if (root != null && root.has("metrics")) {
            root = root.get("metrics");
        }
        if (root == null || !root.isObject()) {
            throw new MetricsSourceException("Metrics response must be a JSON object");
        }

        Map<String, Double> metrics = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNumber()) {
                metrics.put(field.getKey(), field.getValue().asDouble());
            } else {
                LOG.debug("Skipping non-numeric metric field '{}'", field.getKey());
            }
        }
        return metrics;
    }
}
