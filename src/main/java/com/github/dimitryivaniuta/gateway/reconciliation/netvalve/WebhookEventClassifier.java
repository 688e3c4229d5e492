package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Maps a gateway webhook type to a {@link WebhookAction}.
 *
 * <p>Substring match on the lower-cased type, first match wins, in this order: authorized, captured|paid,
 * pending, requires_more|action_required, failed|declined, canceled|cancelled.</p>
 */
@Component
public class WebhookEventClassifier {

    /**
     * @param payload webhook body
     * @return classification
     */
    public WebhookClassification classify(JsonNode payload) {
        JsonNode type = payload.path("type");
        if (!type.isTextual() || type.asText().isEmpty()) {
            return new WebhookClassification(WebhookAction.NOT_SUPPORTED, null);
        }
        return new WebhookClassification(actionFor(type.asText()), extractData(payload));
    }

    /**
     * @param eventType gateway event type
     * @return action, {@link WebhookAction#NOT_SUPPORTED} when nothing matches
     */
    public WebhookAction actionFor(String eventType) {
        if (eventType == null) {
            return WebhookAction.NOT_SUPPORTED;
        }
        String t = eventType.toLowerCase(Locale.ROOT);
        if (t.contains("authorized")) {
            return WebhookAction.AUTHORIZED;
        }
        if (t.contains("captured") || t.contains("paid")) {
            return WebhookAction.SUCCESSFUL;
        }
        if (t.contains("pending")) {
            return WebhookAction.PENDING;
        }
        if (t.contains("requires_more") || t.contains("action_required")) {
            return WebhookAction.REQUIRES_MORE;
        }
        if (t.contains("failed") || t.contains("declined")) {
            return WebhookAction.FAILED;
        }
        if (t.contains("canceled") || t.contains("cancelled")) {
            return WebhookAction.CANCELED;
        }
        return WebhookAction.NOT_SUPPORTED;
    }

    private WebhookClassification.Data extractData(JsonNode payload) {
        String sessionId = firstTruthy(payload.path("session_id"), payload.path("id"));
        JsonNode amount = payload.path("amount");
        if (sessionId == null || !(amount.isTextual() || amount.isNumber())) {
            return null;
        }
        Object value = amount.isNumber() ? amount.numberValue() : amount.asText();
        return new WebhookClassification.Data(sessionId, value);
    }

    private static String firstTruthy(JsonNode... nodes) {
        for (JsonNode n : nodes) {
            if (n.isValueNode() && !n.isNull() && !n.asText().isEmpty()) {
                return n.asText();
            }
        }
        return null;
    }
}
