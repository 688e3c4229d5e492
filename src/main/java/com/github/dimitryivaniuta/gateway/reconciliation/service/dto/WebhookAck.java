package com.github.dimitryivaniuta.gateway.reconciliation.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Acknowledgment body returned to webhook senders.
 *
 * @param success outcome flag
 * @param message human readable message
 * @param statusCode HTTP status echoed in the body
 * @param data optional payload echo
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookAck(
        Boolean success,
        String message,
        @JsonProperty("status_code") Integer statusCode,
        Object data
) {

    /**
     * Body returned for a redelivery of an event that needs no work.
     */
    public static final String ALREADY_PROCESSED = "Event already processed";

    /**
     * @return ack for a skipped event
     */
    public static WebhookAck alreadyProcessed() {
        return new WebhookAck(null, ALREADY_PROCESSED, null, null);
    }

    /**
     * @param message message
     * @param data payload echo, may be null
     * @return successful ack
     */
    public static WebhookAck ok(String message, Object data) {
        return new WebhookAck(true, message, 200, data);
    }
}
