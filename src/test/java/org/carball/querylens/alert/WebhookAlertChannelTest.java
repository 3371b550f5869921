package org.carball.querylens.alert;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.carball.querylens.model.AlertEvent;
import org.carball.querylens.model.AlertKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

public class WebhookAlertChannelTest {

    private HttpServer server;
    private final AtomicReference<String> receivedBody = new AtomicReference<>();
    private final AtomicReference<String> receivedContentType = new AtomicReference<>();
    private final AtomicInteger responseStatus = new AtomicInteger(200);

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/hook", exchange -> {
            receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            receivedContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            exchange.sendResponseHeaders(responseStatus.get(), -1);
            exchange.close();
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void shouldPostSlackCompatiblePayload() throws Exception {
        // Given
        WebhookAlertChannel channel = new WebhookAlertChannel(url("/hook"), Duration.ofSeconds(2), 500);

        // When
        boolean delivered = channel.sendAsync(event()).get(5, TimeUnit.SECONDS);

        // Then
        assertThat(delivered).isTrue();
        assertThat(receivedContentType.get()).isEqualTo("application/json");

        JsonNode body = new ObjectMapper().readTree(receivedBody.get());
        assertThat(body.get("text").asText()).isEqualTo("N+1 Query Pattern Detected");
        assertThat(body.at("/blocks/0/type").asText()).isEqualTo("header");
        assertThat(body.at("/blocks/0/text/type").asText()).isEqualTo("plain_text");
        assertThat(body.at("/blocks/0/text/text").asText()).isEqualTo("🔍 N+1 Query Pattern Detected");
        assertThat(body.at("/blocks/1/type").asText()).isEqualTo("section");
        assertThat(body.at("/blocks/1/fields/0/type").asText()).isEqualTo("mrkdwn");
        assertThat(body.at("/blocks/1/fields/0/text").asText())
                .isEqualTo("*query_pattern:*\nSELECT * FROM order_lines WHERE order_id = ?");
        assertThat(body.at("/blocks/1/fields/1/text").asText()).isEqualTo("*count:*\n3");
    }

    @Test
    void shouldTruncateLongFields() {
        // Given
        WebhookAlertChannel channel = new WebhookAlertChannel(url("/hook"), Duration.ofSeconds(2), 10);

        // When
        Map<String, Object> payload = channel.buildPayload(event());

        // Then
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> blocks = (List<Map<String, Object>>) payload.get("blocks");
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> fields = (List<Map<String, Object>>) blocks.get(1).get("fields");
        assertThat(fields.get(0).get("text")).isEqualTo("*query_pattern:*\nSELECT * F");
    }

    @Test
    void shouldRenderNestedValuesAsJson() {
        // Given
        WebhookAlertChannel channel = new WebhookAlertChannel(url("/hook"), Duration.ofSeconds(2), 500);

        // When
        String rendered = channel.renderField(Map.of("rows", 3));

        // Then
        assertThat(rendered).contains("\"rows\" : 3");
        assertThat(channel.renderField(null)).isEqualTo("null");
        assertThat(channel.renderField(12.5)).isEqualTo("12.5");
    }

    @Test
    void shouldReportRejectedDeliveryAsFailure() throws Exception {
        // Given
        responseStatus.set(500);
        WebhookAlertChannel channel = new WebhookAlertChannel(url("/hook"), Duration.ofSeconds(2), 500);

        // When
        boolean delivered = channel.sendAsync(event()).get(5, TimeUnit.SECONDS);

        // Then
        assertThat(delivered).isFalse();
    }

    @Test
    void shouldSwallowUnreachableEndpoint() throws Exception {
        // Given
        HttpServer stopped = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        String deadUrl = "http://127.0.0.1:" + stopped.getAddress().getPort() + "/hook";
        stopped.start();
        stopped.stop(0);
        WebhookAlertChannel channel = new WebhookAlertChannel(deadUrl, Duration.ofMillis(500), 500);

        // When
        boolean delivered = channel.sendAsync(event()).get(5, TimeUnit.SECONDS);

        // Then
        assertThat(delivered).isFalse();
    }

    @Test
    void shouldTimeOutSlowEndpoint() throws Exception {
        // Given
        WebhookAlertChannel channel = new WebhookAlertChannel(url("/slow"), Duration.ofMillis(200), 500);

        // When
        boolean delivered = channel.sendAsync(event()).get(5, TimeUnit.SECONDS);

        // Then
        assertThat(delivered).isFalse();
    }

    private String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    private static AlertEvent event() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query_pattern", "SELECT * FROM order_lines WHERE order_id = ?");
        payload.put("count", 3);
        payload.put("route", "/orders");
        return new AlertEvent("N+1 Query Pattern Detected", AlertKind.N_PLUS_ONE, payload);
    }
}
