package com.github.dimitryivaniuta.gateway.reconciliation.alert;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.github.dimitryivaniuta.gateway.reconciliation.config.AppProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class SlackAlertNotifierTest {

    private static final String HOOK = "https://hooks.slack.test/services/T/B/X";

    private AppProperties props;
    private MockRestServiceServer server;
    private SlackAlertNotifier notifier;

    @BeforeEach
    void setUp() {
        props = new AppProperties();
        props.setEnvironment("production");
        props.getAlerts().setSlackUrl(HOOK);
        RestTemplate rest = new RestTemplate();
        server = MockRestServiceServer.bindTo(rest).build();
        notifier = new SlackAlertNotifier(rest, props, Clock.fixed(Instant.parse("2024-05-01T14:30:00Z"), ZoneOffset.UTC));
    }

    @Test
    void postsBlockKitMessage() {
        server.expect(requestTo(HOOK))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.blocks[0].text.text").value("🚨  Settlement failed"))
                .andExpect(jsonPath("$.attachments[0].color").value(SlackAlertNotifier.ALERT_COLOR))
                .andExpect(jsonPath("$.attachments[0].blocks[0].text.text").value("Cart `c1` could not be settled."))
                .andRespond(withSuccess());

        notifier.sendCriticalAlert("Settlement failed", "Cart `c1` could not be settled.", "Solidgate");

        server.verify();
    }

    @Test
    void payloadFieldsIncludePlatformEnvironmentAndTimestamp() {
        Map<String, Object> payload = notifier.buildPayload("t", "m", "Solidgate");

        String json = payload.toString();
        Assertions.assertTrue(json.contains("*Environment*\nProduction"));
        Assertions.assertTrue(json.contains("*Platform*\nSolidgate"));
        Assertions.assertTrue(json.contains("*Timestamp*\nMay 01, 2024 at 02:30 PM UTC"));
    }

    @Test
    void slackFailureIsLoggedNotThrown() {
        server.expect(requestTo(HOOK)).andRespond(withServerError());

        Assertions.assertDoesNotThrow(() -> notifier.sendCriticalAlert("t", "m", null));
    }

    @Test
    void missingUrl_dropsAlertWithoutHttp() {
        props.getAlerts().setSlackUrl("");

        notifier.sendCriticalAlert("t", "m", null);

        server.verify();
    }
}
