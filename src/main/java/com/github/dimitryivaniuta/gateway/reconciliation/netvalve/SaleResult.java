package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import lombok.Builder;

/**
 * Result of one {@code POST /sale}.
 *
 * <p>Request-side fields (client order id through currency) echo what was sent so callers can persist
 * them even when the sale failed.</p>
 */
@Builder
public record SaleResult(
        boolean success,
        String transactionId,
        String orderId,
        String responseCode,
        String responseMessage,
        String bankResponseCode,
        String declineReason,
        JsonNode raw,
        String clientOrderId,
        String paymentToken,
        String siteId,
        String midId,
        BigDecimal amount,
        String currency,
        JsonNode gatewayErrors,
        String cardNumber,
        String cardType,
        String cardExpiry,
        String cardHolderName
) {

    /**
     * @param message failure message
     * @return failed result without gateway fields
     */
    public static SaleResult failure(String message) {
        return SaleResult.builder().success(false).responseMessage(message).build();
    }

    /**
     * @return " (reason)", " (bank code X)" or an empty string
     */
    public String declineDetail() {
        if (declineReason != null && !declineReason.isEmpty()) {
            return " (" + declineReason + ")";
        }
        if (bankResponseCode != null && !bankResponseCode.isEmpty()) {
            return " (bank code " + bankResponseCode + ")";
        }
        return "";
    }
}
