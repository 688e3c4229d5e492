package com.github.dimitryivaniuta.gateway.reconciliation.alert;

import com.github.dimitryivaniuta.gateway.reconciliation.config.AppProperties;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Posts critical alerts to a Slack incoming webhook as a block-kit message.
 */
@Component
public class SlackAlertNotifier implements AlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(SlackAlertNotifier.class);

    static final String ALERT_COLOR = "#E01E5A";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("MMM dd, yyyy 'at' hh:mm a 'UTC'", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    private final RestTemplate rest;
    private final AppProperties properties;
    private final Clock clock;

    /**
     * Creates the notifier.
     *
     * @param rest rest template with the alert timeout
     * @param properties application properties
     * @param clock clock
     */
    public SlackAlertNotifier(@Qualifier("alertsRestTemplate") RestTemplate rest, AppProperties properties, Clock clock) {
        this.rest = rest;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void sendCriticalAlert(String title, String message, String platform) {
        String url = properties.getAlerts().getSlackUrl();
        if (url == null || url.isBlank()) {
            log.warn("Slack alert dropped, no webhook URL configured: {}", title);
            return;
        }
        try {
            rest.postForEntity(url, buildPayload(title, message, platform), String.class);
            log.info("Slack alert sent: {}", title);
        } catch (RuntimeException ex) {
            log.error("Slack alert failed: {} error={}", title, ex.getMessage());
        }
    }

    /**
     * Builds the block-kit body.
     *
     * @param title title
     * @param message markdown body
     * @param platform platform or null
     * @return JSON-ready map
     */
    Map<String, Object> buildPayload(String title, String message, String platform) {
        List<Map<String, Object>> fields = new ArrayList<>();
        fields.add(mrkdwn("*Severity*\n🔴 Critical"));
        fields.add(mrkdwn("*Environment*\n" + capitalize(properties.getEnvironment())));
        if (platform != null && !platform.isBlank()) {
            fields.add(mrkdwn("*Platform*\n" + platform));
        }
        fields.add(mrkdwn("*Timestamp*\n" + TIMESTAMP.format(clock.instant())));

        List<Map<String, Object>> details = List.of(
                Map.of("type", "section", "text", mrkdwn(message)),
                Map.of("type", "divider"),
                Map.of("type", "section", "fields", fields)
        );

        Map<String, Object> header = Map.of(
                "type", "header",
                "text", Map.of("type", "plain_text", "text", "🚨  " + title, "emoji", true)
        );

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("blocks", List.of(header));
        payload.put("attachments", List.of(Map.of("color", ALERT_COLOR, "blocks", details)));
        return payload;
    }

    private static Map<String, Object> mrkdwn(String text) {
        return Map.of("type", "mrkdwn", "text", text);
    }

    private static String capitalize(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        return Character.toUpperCase(s.charAt(0)) + s.substring(1).toLowerCase(Locale.ROOT);
    }
}
