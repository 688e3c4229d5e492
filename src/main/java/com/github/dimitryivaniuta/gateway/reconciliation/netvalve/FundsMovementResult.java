package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

/**
 * Result of a capture, refund or cancel. Failures carry a {@code *_error} status and the error text.
 *
 * @param status captured, refunded, canceled or the matching error status
 * @param transactionId transaction id as requested
 * @param refundedAmount refunded amount, refunds only
 * @param responseCode gateway response code
 * @param responseMessage gateway response message
 * @param error error text for error statuses
 * @param data gateway response, empty object when unavailable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FundsMovementResult(
        String status,
        String transactionId,
        BigDecimal refundedAmount,
        String responseCode,
        String responseMessage,
        String error,
        JsonNode data
) {

    public static final String CAPTURED = "captured";
    public static final String REFUNDED = "refunded";
    public static final String CANCELED = "canceled";

    /**
     * @return true for {@code *_error} statuses
     */
    @JsonIgnore
    public boolean isError() {
        return status.endsWith("_error");
    }
}
