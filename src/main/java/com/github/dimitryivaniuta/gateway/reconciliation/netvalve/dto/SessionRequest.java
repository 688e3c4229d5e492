package com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.util.Locale;

/**
 * Hosted-fields session request from the storefront.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SessionRequest(
        String version,
        String currencyCode,
        BigDecimal amount,
        String cartId,
        String orderDesc,
        String successUrl,
        String cancelUrl,
        String failedUrl,
        String pendingUrl
) {

    /**
     * @param currencyCode currency
     * @param amount amount
     * @param cartId cart id
     * @return request carrying only the checkout fields
     */
    public static SessionRequest of(String currencyCode, BigDecimal amount, String cartId) {
        return new SessionRequest(null, currencyCode, amount, cartId, null, null, null, null, null);
    }

    /**
     * @return upper-cased currency, null when absent
     */
    public String normalizedCurrency() {
        return currencyCode == null || currencyCode.isBlank() ? null : currencyCode.trim().toUpperCase(Locale.ROOT);
    }
}
