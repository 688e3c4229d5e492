package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Classified gateway webhook.
 *
 * @param action mapped action
 * @param data session id and amount when both were present, otherwise null
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record WebhookClassification(WebhookAction action, Data data) {

    /**
     * @param sessionId payment session id ({@code session_id}, else {@code id})
     * @param amount amount as sent
     */
    public record Data(@JsonProperty("session_id") String sessionId, Object amount) {}
}
