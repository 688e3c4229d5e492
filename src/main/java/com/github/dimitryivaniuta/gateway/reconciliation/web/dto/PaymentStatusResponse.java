package com.github.dimitryivaniuta.gateway.reconciliation.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;
import java.util.Set;

/**
 * Payment status echo.
 *
 * @param status normalized status
 * @param transactionId transaction id, may be null
 */
public record PaymentStatusResponse(String status, @JsonProperty("transaction_id") String transactionId) {

    static final Set<String> KNOWN_STATUSES = Set.of("authorized", "captured", "pending", "requires_more", "error", "canceled");

    /**
     * @param status requested status
     * @param transactionId transaction id
     * @return response with an unknown or missing status mapped to {@code pending}
     */
    public static PaymentStatusResponse normalized(String status, String transactionId) {
        String s = status == null ? "pending" : status.trim().toLowerCase(Locale.ROOT);
        return new PaymentStatusResponse(KNOWN_STATUSES.contains(s) ? s : "pending", transactionId);
    }
}
