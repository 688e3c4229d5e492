package com.github.dimitryivaniuta.gateway.reconciliation.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Error body returned to webhook senders and API callers.
 *
 * <p>Providers log the body of a rejected delivery; {@code correlation_id} lets an operator find the
 * matching request in our logs, and {@code step} names the part of a webhook flow that failed.</p>
 *
 * @param code machine-readable code
 * @param message human readable message
 * @param step failed processing step, webhook processing errors only
 * @param correlationId request correlation id, when one was assigned
 * @param timestamp event time
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String code,
        String message,
        String step,
        @JsonProperty("correlation_id") String correlationId,
        Instant timestamp
) {

    /**
     * @param code machine-readable code
     * @param message message
     * @param correlationId correlation id, may be null
     * @return error without a step
     */
    public static ErrorResponse of(String code, String message, String correlationId) {
        return new ErrorResponse(code, message, null, correlationId, Instant.now());
    }

    /**
     * @param message message
     * @param step failed step
     * @param correlationId correlation id, may be null
     * @return webhook processing error
     */
    public static ErrorResponse processing(String message, String step, String correlationId) {
        return new ErrorResponse("WEBHOOK_PROCESSING_ERROR", message, step, correlationId, Instant.now());
    }
}
