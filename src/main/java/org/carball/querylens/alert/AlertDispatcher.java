package org.carball.querylens.alert;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.config.QueryLensConfig;
import org.carball.querylens.model.AlertEvent;
import org.carball.querylens.model.AlertKind;
import org.carball.querylens.model.NPlusOnePattern;
import org.carball.querylens.model.QueryRecord;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns detections into {@link AlertEvent}s and fans them out to the configured
 * channels. Nothing is sent unless alerts are enabled, and each condition can be
 * switched off individually.
 */
@Slf4j
public class AlertDispatcher {

    private final QueryLensConfig config;
    private final Map<String, AlertChannel> channels;

    public AlertDispatcher(QueryLensConfig config, List<AlertChannel> availableChannels) {
        this.config = config;
        this.channels = new LinkedHashMap<>();
        for (AlertChannel channel : availableChannels) {
            channels.put(channel.name(), channel);
        }
    }

    /**
     * Dispatcher with the built-in channels: {@code log} always, {@code webhook}
     * (alias {@code slack}) when a webhook URL is configured.
     */
    public static AlertDispatcher create(QueryLensConfig config) {
        List<AlertChannel> available = new ArrayList<>();
        available.add(new LogAlertChannel());
        if (config.getWebhookUrl() != null && !config.getWebhookUrl().isBlank()) {
            available.add(new WebhookAlertChannel(config.getWebhookUrl(),
                    Duration.ofMillis(config.getWebhookTimeoutMs()), config.getWebhookFieldLimit()));
        }
        return new AlertDispatcher(config, available);
    }

    public void alertSlowQuery(QueryRecord record) {
        if (!config.isAlertsEnabled() || !config.isAlertOnSlowQuery()) {
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sql", record.sql());
        payload.put("time_ms", record.timeMs());
        payload.put("threshold_ms", config.getSlowQueryThresholdMs());
        payload.put("route", record.route());
        payload.put("connection", record.connection());
        if (record.source() != null) {
            payload.put("source", record.source());
        }
        if (!record.backtrace().isEmpty()) {
            payload.put("backtrace", record.backtrace());
        }
        if (record.explain() != null) {
            payload.put("explain", record.explain());
        }

        dispatch(new AlertEvent("Slow Query Detected", AlertKind.SLOW_QUERY, payload));
    }

    public void alertNPlusOne(NPlusOnePattern pattern) {
        if (!config.isAlertsEnabled() || !config.isAlertOnNPlusOne()) {
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query_pattern", pattern.queryPattern());
        payload.put("count", pattern.count());
        payload.put("route", pattern.route());
        payload.put("location", pattern.location());
        payload.put("suggestion", pattern.suggestion());

        dispatch(new AlertEvent("N+1 Query Pattern Detected", AlertKind.N_PLUS_ONE, payload));
    }

    public void alertHighQueryCount(int count, String route) {
        if (!config.isAlertsEnabled() || count < config.getQueryCountThreshold()) {
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("count", count);
        payload.put("threshold", config.getQueryCountThreshold());
        payload.put("route", route);
        payload.put("message", "Request executed " + count + " queries");

        dispatch(new AlertEvent("High Query Count", AlertKind.HIGH_QUERY_COUNT, payload));
    }

    void dispatch(AlertEvent event) {
        for (String channelName : config.getAlertChannels()) {
            AlertChannel channel = channels.get(resolveAlias(channelName));
            if (channel == null) {
                log.debug("Ignoring unknown or unconfigured alert channel: {}", channelName);
                continue;
            }
            try {
                channel.send(event);
            } catch (RuntimeException e) {
                log.error("[Query Lens] Alert channel '{}' failed for '{}': {}",
                        channelName, event.title(), e.getMessage());
            }
        }
    }

    private static String resolveAlias(String channelName) {
        if (WebhookAlertChannel.SLACK_ALIAS.equalsIgnoreCase(channelName)) {
            return WebhookAlertChannel.NAME;
        }
        return channelName.toLowerCase();
    }
}
