package org.carball.querylens.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.AlertEvent;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Posts alerts as a Slack-compatible JSON document: a plain-text summary plus a
 * header block and a section block with one markdown field per payload entry.
 */
@Slf4j
public class WebhookAlertChannel implements AlertChannel {

    public static final String NAME = "webhook";
    public static final String SLACK_ALIAS = "slack";

    private static final String TITLE_PREFIX = "🔍 ";

    private final URI webhookUrl;
    private final Duration timeout;
    private final int fieldLimit;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebhookAlertChannel(String webhookUrl, Duration timeout, int fieldLimit) {
        this.webhookUrl = URI.create(webhookUrl);
        this.timeout = timeout;
        this.fieldLimit = fieldLimit;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void send(AlertEvent event) {
        sendAsync(event);
    }

    /**
     * Fire-and-forget delivery. The future completes with {@code true} on a 2xx
     * response and {@code false} on any failure; it never completes exceptionally.
     */
    public CompletableFuture<Boolean> sendAsync(AlertEvent event) {
        String body;
        try {
            body = objectMapper.writeValueAsString(buildPayload(event));
        } catch (JsonProcessingException e) {
            log.error("[Query Lens] Failed to serialize alert '{}': {}", event.title(), e.getMessage());
            return CompletableFuture.completedFuture(false);
        }

        HttpRequest request = HttpRequest.newBuilder(webhookUrl)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    if (response.statusCode() / 100 == 2) {
                        log.debug("Alert '{}' delivered to webhook", event.title());
                        return true;
                    }
                    log.error("[Query Lens] Webhook rejected alert '{}' with status {}",
                            event.title(), response.statusCode());
                    return false;
                })
                .exceptionally(e -> {
                    log.error("[Query Lens] Failed to send alert '{}' to webhook: {}", event.title(), e.getMessage());
                    return false;
                });
    }

    Map<String, Object> buildPayload(AlertEvent event) {
        List<Map<String, Object>> fields = new ArrayList<>();
        event.payload().forEach((key, value) -> fields.add(Map.of(
                "type", "mrkdwn",
                "text", "*" + key + ":*\n" + renderField(value))));

        Map<String, Object> header = Map.of(
                "type", "header",
                "text", Map.of("type", "plain_text", "text", TITLE_PREFIX + event.title()));
        Map<String, Object> section = Map.of(
                "type", "section",
                "fields", fields);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", event.title());
        payload.put("blocks", List.of(header, section));
        return payload;
    }

    String renderField(Object value) {
        String rendered;
        if (value == null || value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            rendered = String.valueOf(value);
        } else if (value instanceof Map<?, ?> || value instanceof Collection<?> || value instanceof Record) {
            try {
                rendered = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
            } catch (JsonProcessingException e) {
                rendered = String.valueOf(value);
            }
        } else {
            rendered = String.valueOf(value);
        }

        if (rendered.length() > fieldLimit) {
            return rendered.substring(0, fieldLimit);
        }
        return rendered;
    }
}
