package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class WebhookEventClassifierTest {

    private final WebhookEventClassifier classifier = new WebhookEventClassifier();
    private final ObjectMapper mapper = new ObjectMapper();

    @ParameterizedTest
    @CsvSource({
            "payment.authorized, AUTHORIZED",
            "PAYMENT.CAPTURED, SUCCESSFUL",
            "order.paid, SUCCESSFUL",
            "payment.pending, PENDING",
            "payment.action_required, REQUIRES_MORE",
            "payment.requires_more, REQUIRES_MORE",
            "payment.declined, FAILED",
            "payment.failed, FAILED",
            "payment.cancelled, CANCELED",
            "payment.canceled, CANCELED",
            "customer.created, NOT_SUPPORTED"
    })
    void mapsTypesBySubstring(String type, WebhookAction expected) {
        Assertions.assertEquals(expected, classifier.actionFor(type));
    }

    @Test
    void firstMatchWins() {
        // "authorized" is checked before "failed"
        Assertions.assertEquals(WebhookAction.AUTHORIZED, classifier.actionFor("authorized_then_failed"));
    }

    @Test
    void classify_extractsSessionAndAmount() throws Exception {
        WebhookClassification c = classifier.classify(mapper.readTree(
                "{\"type\":\"payment.captured\",\"session_id\":\"sess_1\",\"amount\":19.99}"));

        Assertions.assertEquals(WebhookAction.SUCCESSFUL, c.action());
        Assertions.assertEquals("sess_1", c.data().sessionId());
        Assertions.assertEquals(19.99, ((Number) c.data().amount()).doubleValue(), 0.0001);
    }

    @Test
    void classify_fallsBackToIdForSession() throws Exception {
        WebhookClassification c = classifier.classify(mapper.readTree(
                "{\"type\":\"payment.pending\",\"id\":\"evt_9\",\"amount\":\"10.00\"}"));

        Assertions.assertEquals("evt_9", c.data().sessionId());
        Assertions.assertEquals("10.00", c.data().amount());
    }

    @Test
    void classify_withoutAmount_hasNoData() throws Exception {
        WebhookClassification c = classifier.classify(mapper.readTree("{\"type\":\"payment.failed\",\"session_id\":\"s\"}"));

        Assertions.assertEquals(WebhookAction.FAILED, c.action());
        Assertions.assertNull(c.data());
    }

    @Test
    void classify_withoutType_isNotSupported() throws Exception {
        Assertions.assertEquals(WebhookAction.NOT_SUPPORTED, classifier.classify(mapper.readTree("{\"id\":\"x\"}")).action());
    }
}
